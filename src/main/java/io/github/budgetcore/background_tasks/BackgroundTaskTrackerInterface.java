package io.github.budgetcore.background_tasks;

import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.base_exceptions.OperationTimedOutException;
import io.github.budgetcore.base_exceptions.TaskFailedException;
import io.github.budgetcore.base_exceptions.TaskNotFoundException;
import io.github.budgetcore.base_exceptions.TaskNotReadyException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.List;

public interface BackgroundTaskTrackerInterface extends AutoCloseable {

    /**
     * Registers a PENDING task and detaches {@code work}. Returns at once with the new task id.
     */
    @NotNull String submitAsync(@NotNull String type, @Nullable Object payload, @NotNull AsyncTask work);

    @NotNull BackgroundTask getStatus(@NotNull String taskId) throws TaskNotFoundException;

    /**
     * @throws TaskNotReadyException while the task is PENDING or PROCESSING
     * @throws TaskFailedException   if the task ended FAILED or CANCELLED
     */
    @Nullable Object getResult(@NotNull String taskId) throws TaskNotFoundException, TaskNotReadyException, TaskFailedException;

    /**
     * Blocks until the task is terminal or {@code token} is done.
     */
    @NotNull BackgroundTask awaitCompletion(@NotNull String taskId, @NotNull CancellationToken token)
            throws TaskNotFoundException, OperationTimedOutException, InterruptedException;

    /**
     * @param filter only tasks in this status; {@code null} lists everything
     */
    @NotNull List<BackgroundTask> listTasks(@Nullable TaskStatus filter);

    /**
     * @return true if the task was moved to CANCELLED, false if it was already terminal
     */
    boolean cancel(@NotNull String taskId) throws TaskNotFoundException;

    /**
     * Drops terminal tasks that completed more than {@code olderThan} ago.
     *
     * @return number of records removed
     */
    int cleanup(@NotNull Duration olderThan);

    @Override
    void close();
}
