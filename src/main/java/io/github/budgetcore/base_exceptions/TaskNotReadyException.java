package io.github.budgetcore.base_exceptions;

/**
 * The task exists but has not reached a terminal state yet.
 */
public class TaskNotReadyException extends Exception {
    private final String taskId;
    private final String status;

    public TaskNotReadyException(String taskId, String status) {
        super("task " + taskId + " is not completed yet (status: " + status + ")");
        this.taskId = taskId;
        this.status = status;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getStatus() {
        return status;
    }
}
