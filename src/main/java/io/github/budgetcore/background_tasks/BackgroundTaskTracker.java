package io.github.budgetcore.background_tasks;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.UuidProvider;
import io.github.budgetcore.base_exceptions.OperationTimedOutException;
import io.github.budgetcore.base_exceptions.TaskFailedException;
import io.github.budgetcore.base_exceptions.TaskNotFoundException;
import io.github.budgetcore.base_exceptions.TaskNotReadyException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * BackgroundTaskTracker detaches long-running units of work and keeps a queryable record of each:
 * - status moves forward only: PENDING → PROCESSING → COMPLETED | FAILED | CANCELLED;
 * - a task that throws ends FAILED with the error text, the tracker itself is never affected;
 * - cancel is cooperative: the record turns CANCELLED at once and the unit's token is stopped;
 *   whatever the unit returns afterwards is discarded;
 * - finished records stay until {@link #cleanup(Duration)} (or the optional periodic sweep) removes them.
 */
@ThreadSafe
public final class BackgroundTaskTracker implements BackgroundTaskTrackerInterface {
    private final static Logger logger = LoggerFactory.getLogger(BackgroundTaskTracker.class);

    private static final long AWAIT_SLICE_MILLIS = 50;
    private static final String CANCELLED_BY_USER = "task cancelled by user";

    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final List<TaskEventListener> listeners = new CopyOnWriteArrayList<>();
    private final @Nullable ScheduledExecutorService sweeper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @GuardedBy("this")
    private final Map<String, TaskRecord> tasks = new LinkedHashMap<>();

    public BackgroundTaskTracker() {
        this(new Builder());
    }

    private BackgroundTaskTracker(Builder b) {
        if (b.executor != null) {
            this.executor = b.executor;
            this.ownsExecutor = false;
        } else {
            int cpus = Runtime.getRuntime().availableProcessors();
            this.executor = new ThreadPoolExecutor(
                    Math.max(2, cpus),
                    Math.max(2, cpus),
                    60L, TimeUnit.SECONDS,
                    new LinkedBlockingQueue<>(),
                    new ThreadFactoryBuilder()
                            .setNameFormat("background-task-%d")
                            .setDaemon(true)
                            .setUncaughtExceptionHandler((th, ex) -> logger.error("Uncaught in {}", th.getName(), ex))
                            .build());
            this.ownsExecutor = true;
        }
        this.listeners.addAll(b.listeners);

        if (b.sweepInterval != null) {
            final Duration retention = b.retention;
            this.sweeper = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                    .setNameFormat("background-task-sweeper-%d")
                    .setDaemon(true)
                    .build());
            long period = b.sweepInterval.toMillis();
            this.sweeper.scheduleAtFixedRate(() -> {
                try {
                    cleanup(retention);
                } catch (Exception e) {
                    logger.warn("Periodic task cleanup failed", e);
                }
            }, period, period, TimeUnit.MILLISECONDS);
        } else {
            this.sweeper = null;
        }
    }

    public static final class Builder {
        private ExecutorService executor;
        private final List<TaskEventListener> listeners = new ArrayList<>();
        private Duration sweepInterval = null;
        private Duration retention = Duration.ofHours(1);

        /**
         * Runs tasks on a caller-owned executor; the tracker will not shut it down.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = Objects.requireNonNull(executor);
            return this;
        }

        public Builder addListener(TaskEventListener listener) {
            this.listeners.add(Objects.requireNonNull(listener));
            return this;
        }

        /**
         * Enables a periodic sweep removing terminal tasks older than {@code retention}. Off by default.
         */
        public Builder autoCleanup(Duration interval, Duration retention) {
            Objects.requireNonNull(interval);
            Objects.requireNonNull(retention);
            if (interval.isZero() || interval.isNegative()) throw new IllegalArgumentException("interval must be > 0");
            if (retention.isNegative()) throw new IllegalArgumentException("retention must be >= 0");
            this.sweepInterval = interval;
            this.retention = retention;
            return this;
        }

        public BackgroundTaskTracker build() {
            return new BackgroundTaskTracker(this);
        }
    }

    public void addListener(@NotNull TaskEventListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(@NotNull TaskEventListener listener) {
        listeners.remove(listener);
    }

    // ======== Public API ========

    @Override
    public @NotNull String submitAsync(@NotNull String type, @Nullable Object payload, @NotNull AsyncTask work) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(work, "work");
        if (closed.get()) throw new IllegalStateException("background task tracker is closed");

        TaskRecord rec = new TaskRecord(UuidProvider.generatePrefixedId("task"), type, payload, Instant.now());
        synchronized (this) {
            tasks.put(rec.id, rec);
        }
        try {
            executor.execute(() -> runTask(rec, work));
            logger.debug("Task {} of type {} submitted", rec.id, type);
        } catch (RejectedExecutionException e) {
            logger.error("Task {} of type {} rejected by executor", rec.id, type, e);
            Throwable error = new IllegalStateException("task rejected: " + e.getMessage(), e);
            if (finish(rec, TaskStatus.FAILED, null, error.getMessage())) {
                fire(l -> l.onError(rec.id, error));
            }
        }
        return rec.id;
    }

    @Override
    public @NotNull BackgroundTask getStatus(@NotNull String taskId) throws TaskNotFoundException {
        synchronized (this) {
            return lookup(taskId).snapshot();
        }
    }

    @Override
    public @Nullable Object getResult(@NotNull String taskId)
            throws TaskNotFoundException, TaskNotReadyException, TaskFailedException {
        BackgroundTask t = getStatus(taskId);
        switch (t.status) {
            case COMPLETED:
                return t.result;
            case FAILED:
            case CANCELLED:
                throw new TaskFailedException(taskId, t.status.wireName(), t.error);
            default:
                throw new TaskNotReadyException(taskId, t.status.wireName());
        }
    }

    @Override
    public @NotNull BackgroundTask awaitCompletion(@NotNull String taskId, @NotNull CancellationToken token)
            throws TaskNotFoundException, OperationTimedOutException, InterruptedException {
        Objects.requireNonNull(token, "token");
        TaskRecord rec;
        synchronized (this) {
            rec = lookup(taskId);
        }
        while (!rec.finished.await(sliceMillis(token), TimeUnit.MILLISECONDS)) {
            if (token.isDone()) {
                throw new OperationTimedOutException("waiting for task " + taskId + " abandoned: " + token.reason());
            }
        }
        synchronized (this) {
            return rec.snapshot();
        }
    }

    @Override
    public @NotNull List<BackgroundTask> listTasks(@Nullable TaskStatus filter) {
        List<BackgroundTask> out = new ArrayList<>();
        synchronized (this) {
            for (TaskRecord rec : tasks.values()) {
                if (filter == null || rec.status == filter) out.add(rec.snapshot());
            }
        }
        out.sort(Comparator.comparing(t -> t.createdAt));
        return out;
    }

    @Override
    public boolean cancel(@NotNull String taskId) throws TaskNotFoundException {
        TaskRecord rec;
        synchronized (this) {
            rec = lookup(taskId);
            if (rec.status.isTerminal()) return false;
        }
        rec.token.requestStop(CANCELLED_BY_USER);
        if (!finish(rec, TaskStatus.CANCELLED, null, CANCELLED_BY_USER)) return false;
        logger.info("Task {} cancelled", taskId);
        fire(l -> l.onCancelled(taskId));
        return true;
    }

    @Override
    public int cleanup(@NotNull Duration olderThan) {
        Objects.requireNonNull(olderThan, "olderThan");
        Instant cutoff = Instant.now().minus(olderThan);
        int removed = 0;
        synchronized (this) {
            Iterator<TaskRecord> it = tasks.values().iterator();
            while (it.hasNext()) {
                TaskRecord rec = it.next();
                if (rec.status.isTerminal() && rec.completedAt != null && rec.completedAt.isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        }
        if (removed > 0) logger.info("Removed {} finished tasks older than {}", removed, olderThan);
        return removed;
    }

    /**
     * Stops the tokens of unfinished tasks and, when the executor is the tracker's own, waits up to
     * 10 seconds for running units to return before interrupting them.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        if (sweeper != null) sweeper.shutdownNow();

        synchronized (this) {
            for (TaskRecord rec : tasks.values()) {
                if (!rec.status.isTerminal()) rec.token.requestStop("tracker closing");
            }
        }

        if (ownsExecutor) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.warn("Background tasks did not finish within 10s, interrupting");
                    executor.shutdownNow();
                }
            } catch (InterruptedException ie) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        logger.info("Background task tracker closed");
    }

    // ======== Internals ========

    @GuardedBy("this")
    private TaskRecord lookup(String taskId) throws TaskNotFoundException {
        TaskRecord rec = tasks.get(taskId);
        if (rec == null) throw new TaskNotFoundException(taskId);
        return rec;
    }

    private void runTask(TaskRecord rec, AsyncTask work) {
        synchronized (this) {
            if (rec.status != TaskStatus.PENDING) {
                logger.debug("Task {} not started, already {}", rec.id, rec.status.wireName());
                return;
            }
            rec.status = TaskStatus.PROCESSING;
            rec.startedAt = Instant.now();
        }
        fire(l -> l.onStart(rec.id));

        TaskContext ctx = new TaskContext(rec.id, rec.type, rec.payload, rec.token, p -> updateProgress(rec, p));
        try {
            Object result = work.run(ctx);
            if (finish(rec, TaskStatus.COMPLETED, result, null)) {
                logger.debug("Task {} completed", rec.id);
                fire(l -> l.onComplete(rec.id));
            }
        } catch (Throwable t) {
            if (t instanceof InterruptedException) Thread.currentThread().interrupt();
            String message = t.getMessage() != null ? t.getMessage() : t.toString();
            if (finish(rec, TaskStatus.FAILED, null, message)) {
                logger.warn("Task {} of type {} failed: {}", rec.id, rec.type, message);
                fire(l -> l.onError(rec.id, t));
            }
        }
    }

    /**
     * Moves a non-terminal record to {@code target}. Returns false if it was already terminal.
     */
    private boolean finish(TaskRecord rec, TaskStatus target, @Nullable Object result, @Nullable String error) {
        synchronized (this) {
            if (rec.status.isTerminal()) return false;
            rec.status = target;
            rec.result = result;
            rec.error = error;
            rec.completedAt = Instant.now();
            if (target == TaskStatus.COMPLETED) rec.progress = 100;
        }
        rec.finished.countDown();
        return true;
    }

    private void updateProgress(TaskRecord rec, int percent) {
        int clamped = Math.max(0, Math.min(100, percent));
        synchronized (this) {
            if (rec.status.isTerminal()) return;
            rec.progress = clamped;
        }
    }

    private void fire(Consumer<TaskEventListener> call) {
        for (TaskEventListener l : listeners) {
            try {
                call.accept(l);
            } catch (Throwable t) {
                logger.warn("Task listener {} threw", l, t);
            }
        }
    }

    private static long sliceMillis(CancellationToken token) {
        Duration remaining = token.remaining();
        if (remaining == null) return AWAIT_SLICE_MILLIS;
        return Math.max(1, Math.min(remaining.toMillis(), AWAIT_SLICE_MILLIS));
    }
}
