package io.github.budgetcore.background_tasks;

/**
 * Listener for background task lifecycle events. Called on the task's worker thread,
 * except {@link #onCancelled} which runs on the thread calling cancel.
 */
public interface TaskEventListener {
    default void onStart(String taskId) {
    }

    default void onComplete(String taskId) {
    }

    default void onError(String taskId, Throwable error) {
    }

    default void onCancelled(String taskId) {
    }
}
