package io.github.budgetcore.base_exceptions;

/**
 * The task reached a terminal state other than completed, so there is no result to hand out.
 */
public class TaskFailedException extends Exception {
    private final String taskId;
    private final String status;

    public TaskFailedException(String taskId, String status, String error) {
        super("task " + taskId + " ended as " + status + (error == null || error.isEmpty() ? "" : ": " + error));
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
