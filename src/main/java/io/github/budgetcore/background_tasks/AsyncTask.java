package io.github.budgetcore.background_tasks;

/**
 * Work detached by {@link BackgroundTaskTracker#submitAsync}. Check {@link TaskContext#token()} periodically!
 */
@FunctionalInterface
public interface AsyncTask {
    /**
     * @return the task result, stored on completion
     * @throws Exception recorded as the task error; the task ends FAILED
     */
    Object run(TaskContext context) throws Exception;
}
