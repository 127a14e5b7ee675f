package io.github.budgetcore.base_exceptions;

public class TaskNotFoundException extends Exception {
    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
