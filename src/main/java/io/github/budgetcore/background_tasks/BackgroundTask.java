package io.github.budgetcore.background_tasks;

import java.time.Instant;

/**
 * Snapshot of a background task record. Callers never see the live record.
 */
public final class BackgroundTask {
    public final String id;
    public final String type;
    public final Object payload;
    public final TaskStatus status;
    public final int progress;
    public final Object result;
    public final String error;
    public final Instant createdAt;
    public final Instant startedAt;
    public final Instant completedAt;

    BackgroundTask(String id, String type, Object payload, TaskStatus status, int progress, Object result,
                   String error, Instant createdAt, Instant startedAt, Instant completedAt) {
        this.id = id;
        this.type = type;
        this.payload = payload;
        this.status = status;
        this.progress = progress;
        this.result = result;
        this.error = error;
        this.createdAt = createdAt;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
    }

    @Override
    public String toString() {
        return "BackgroundTask{id=" + id + ", type=" + type + ", status=" + status.wireName() + ", progress=" + progress +
                ", createdAt=" + createdAt + ", startedAt=" + startedAt + ", completedAt=" + completedAt +
                (error != null ? ", error='" + error + '\'' : "") + '}';
    }
}
