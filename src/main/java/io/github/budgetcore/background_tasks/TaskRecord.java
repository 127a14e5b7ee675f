package io.github.budgetcore.background_tasks;

import io.github.budgetcore.CancellationToken;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;

/**
 * Live task record. Every mutable field is guarded by the owning tracker's monitor.
 */
final class TaskRecord {
    final String id;
    final String type;
    final Object payload;
    final Instant createdAt;
    final CancellationToken token = new CancellationToken();
    final CountDownLatch finished = new CountDownLatch(1);

    TaskStatus status = TaskStatus.PENDING;
    int progress = 0;
    Object result = null;
    String error = null;
    Instant startedAt = null;
    Instant completedAt = null;

    TaskRecord(String id, String type, Object payload, Instant createdAt) {
        this.id = id;
        this.type = type;
        this.payload = payload;
        this.createdAt = createdAt;
    }

    BackgroundTask snapshot() {
        return new BackgroundTask(id, type, payload, status, progress, result, error, createdAt, startedAt, completedAt);
    }
}
