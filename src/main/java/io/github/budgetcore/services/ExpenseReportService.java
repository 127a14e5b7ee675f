package io.github.budgetcore.services;

import io.github.budgetcore.aggregator.MonthlyDataAggregator;
import io.github.budgetcore.aggregator.MonthlyDataResult;
import io.github.budgetcore.background_tasks.BackgroundTaskTrackerInterface;
import io.github.budgetcore.background_tasks.TaskContext;
import io.github.budgetcore.base_exceptions.TaskFailedException;
import io.github.budgetcore.base_exceptions.TaskNotFoundException;
import io.github.budgetcore.base_exceptions.TaskNotReadyException;
import io.github.budgetcore.base_exceptions.ValidationException;
import io.github.budgetcore.domain.Expense;
import io.github.budgetcore.domain.MonthlyData;
import io.github.budgetcore.domain.YearMonth;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds monthly expense reports in the background and hands them out by task id.
 */
public final class ExpenseReportService {
    private final static Logger logger = LoggerFactory.getLogger(ExpenseReportService.class);

    public static final String TASK_TYPE = "expense_report";
    static final int LARGEST_EXPENSES = 5;

    private final BackgroundTaskTrackerInterface tracker;
    private final MonthlyDataAggregator aggregator;
    private final Duration fetchTimeout;

    public ExpenseReportService(@NotNull BackgroundTaskTrackerInterface tracker, @NotNull MonthlyDataAggregator aggregator) {
        this(tracker, aggregator, Duration.ofSeconds(10));
    }

    public ExpenseReportService(@NotNull BackgroundTaskTrackerInterface tracker, @NotNull MonthlyDataAggregator aggregator,
                                @NotNull Duration fetchTimeout) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout");
    }

    /**
     * Starts a report for one month and returns its task id without waiting.
     *
     * @throws ValidationException if the month is invalid; no task is created
     */
    public @NotNull String requestReport(long userId, int year, int month) throws ValidationException {
        YearMonth period = YearMonth.of(year, month);
        String taskId = tracker.submitAsync(TASK_TYPE, period, ctx -> generate(ctx, userId, period));
        logger.info("Expense report for user {} {} requested as task {}", userId, period, taskId);
        return taskId;
    }

    /**
     * @throws TaskNotFoundException also when {@code taskId} names a task that is not an expense report
     */
    public @NotNull ExpenseReport getReport(@NotNull String taskId)
            throws TaskNotFoundException, TaskNotReadyException, TaskFailedException {
        if (!TASK_TYPE.equals(tracker.getStatus(taskId).type)) {
            throw new TaskNotFoundException(taskId);
        }
        return (ExpenseReport) tracker.getResult(taskId);
    }

    private ExpenseReport generate(TaskContext ctx, long userId, YearMonth period) throws Exception {
        ctx.reportProgress(10);
        ctx.token().throwIfStopRequested();

        MonthlyDataResult fetched = aggregator.fetch(userId, period.getYear(), period.getMonth(),
                ctx.token().child(fetchTimeout));
        ctx.reportProgress(60);
        ctx.token().throwIfStopRequested();

        MonthlyData data = fetched.toMonthlyData();
        Map<String, Long> byCategory = new TreeMap<>();
        for (Expense e : data.expenses) {
            String category = e.getCategory().isEmpty() ? "uncategorized" : e.getCategory();
            byCategory.merge(category, e.getAmountCents(), Long::sum);
        }
        List<Expense> largest = new ArrayList<>(data.expenses);
        largest.sort(Comparator.comparingLong(Expense::getAmountCents).reversed());
        if (largest.size() > LARGEST_EXPENSES) largest = largest.subList(0, LARGEST_EXPENSES);
        ctx.reportProgress(90);

        List<String> warnings = new ArrayList<>();
        for (Throwable t : fetched.errors) {
            warnings.add(t.getMessage() != null ? t.getMessage() : t.toString());
        }
        ExpenseReport report = new ExpenseReport(period, Instant.now(), data.toSummary(), byCategory, largest, warnings);
        logger.debug("Task {} built {}", ctx.taskId(), report);
        return report;
    }
}
