package io.github.budgetcore.services;

import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.aggregator.MonthlyDataAggregator;
import io.github.budgetcore.background_tasks.BackgroundTask;
import io.github.budgetcore.background_tasks.BackgroundTaskTracker;
import io.github.budgetcore.background_tasks.TaskStatus;
import io.github.budgetcore.base_exceptions.TaskNotFoundException;
import io.github.budgetcore.base_exceptions.TaskNotReadyException;
import io.github.budgetcore.base_exceptions.ValidationException;
import io.github.budgetcore.domain.Expense;
import io.github.budgetcore.domain.InMemoryBudgetRepository;
import io.github.budgetcore.domain.YearMonth;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExpenseReportServiceTest {

    InMemoryBudgetRepository repo;
    BackgroundTaskTracker tracker;
    MonthlyDataAggregator aggregator;
    ExpenseReportService reports;
    YearMonth march;

    @BeforeEach
    void setUp() throws Exception {
        repo = new InMemoryBudgetRepository();
        tracker = new BackgroundTaskTracker();
        aggregator = new MonthlyDataAggregator(repo);
        reports = new ExpenseReportService(tracker, aggregator);
        march = YearMonth.of(2024, 3);
    }

    @AfterEach
    void tearDown() {
        tracker.close();
        aggregator.close();
    }

    private BackgroundTask await(String taskId) throws Exception {
        return tracker.awaitCompletion(taskId, CancellationToken.withTimeout(Duration.ofSeconds(5)));
    }

    @Test
    void report_sumsByCategory_andKeepsFiveLargest() throws Exception {
        repo.createIncomeSource(7, "salary", march, 500_000);
        long[] amounts = {100, 900, 300, 700, 500, 200, 800};
        for (int i = 0; i < amounts.length; i++) {
            repo.addExpense(Expense.draft(march, i % 2 == 0 ? "food" : "", "e" + i, amounts[i]));
        }

        String taskId = reports.requestReport(7, 2024, 3);
        BackgroundTask task = await(taskId);

        assertEquals(TaskStatus.COMPLETED, task.status);
        assertEquals(ExpenseReportService.TASK_TYPE, task.type);
        ExpenseReport report = reports.getReport(taskId);
        assertTrue(report.isComplete());
        assertEquals(march, report.period);
        assertEquals(1_700L, report.spentByCategoryCents.get("food"));
        assertEquals(1_800L, report.spentByCategoryCents.get("uncategorized"));
        assertEquals(5, report.largestExpenses.size());
        assertEquals(900, report.largestExpenses.get(0).getAmountCents());
        assertEquals(300, report.largestExpenses.get(4).getAmountCents());
        assertEquals(496_500, report.summary.remainingCents);
    }

    @Test
    void invalidMonth_createsNoTask() {
        assertThrows(ValidationException.class, () -> reports.requestReport(7, 2024, 0));
        assertTrue(tracker.listTasks(null).isEmpty());
    }

    @Test
    void reportIsNotReady_whileReadsAreSlow() throws Exception {
        repo.delay(InMemoryBudgetRepository.LIST_EXPENSES, 300);

        String taskId = reports.requestReport(7, 2024, 3);

        assertThrows(TaskNotReadyException.class, () -> reports.getReport(taskId));
        await(taskId);
        assertNotNull(reports.getReport(taskId));
    }

    @Test
    void failedRead_becomesWarning() throws Exception {
        repo.failOn(InMemoryBudgetRepository.LIST_BUDGETS, "budgets unavailable");

        String taskId = reports.requestReport(7, 2024, 3);
        await(taskId);

        ExpenseReport report = reports.getReport(taskId);
        assertFalse(report.isComplete());
        assertEquals(1, report.warnings.size());
        assertTrue(report.warnings.get(0).contains("budgets unavailable"));
    }

    @Test
    void fetchTimeout_failsTheTask() throws Exception {
        repo.delay(InMemoryBudgetRepository.LIST_INCOME, 2_000);
        reports = new ExpenseReportService(tracker, aggregator, Duration.ofMillis(100));

        String taskId = reports.requestReport(7, 2024, 3);
        BackgroundTask task = await(taskId);

        assertEquals(TaskStatus.FAILED, task.status);
        assertNotNull(task.error);
    }

    @Test
    void taskOfAnotherType_isNotFound() throws Exception {
        String otherId = tracker.submitAsync("data_export", null, ctx -> "not a report");
        await(otherId);

        assertThrows(TaskNotFoundException.class, () -> reports.getReport(otherId));
        assertThrows(TaskNotFoundException.class, () -> reports.getReport("task_missing"));
    }
}
