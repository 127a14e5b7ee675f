package io.github.budgetcore.background_tasks;

import io.github.budgetcore.CancellationToken;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.IntConsumer;

/**
 * What a running {@link AsyncTask} sees of its own record.
 */
public final class TaskContext {
    private final String taskId;
    private final String type;
    private final Object payload;
    private final CancellationToken token;
    private final IntConsumer progressSink;

    TaskContext(String taskId, String type, Object payload, CancellationToken token, IntConsumer progressSink) {
        this.taskId = taskId;
        this.type = type;
        this.payload = payload;
        this.token = token;
        this.progressSink = progressSink;
    }

    public @NotNull String taskId() {
        return taskId;
    }

    public @NotNull String type() {
        return type;
    }

    public @Nullable Object payload() {
        return payload;
    }

    /**
     * Stopped when the task is cancelled or the tracker closes.
     */
    public @NotNull CancellationToken token() {
        return token;
    }

    /**
     * Best-effort progress report, clamped to 0..100. Ignored once the task is terminal.
     */
    public void reportProgress(int percent) {
        progressSink.accept(percent);
    }
}
