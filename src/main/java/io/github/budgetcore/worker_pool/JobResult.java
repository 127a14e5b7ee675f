package io.github.budgetcore.worker_pool;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one {@link Job}: either a value or an error, never both.
 */
public final class JobResult {
    public final String jobId;
    public final String type;
    public final Object value;
    public final Throwable error;
    public final Duration duration;
    public final Instant completed;
    public final int workerId;

    JobResult(String jobId, String type, Object value, Throwable error, Duration duration, Instant completed, int workerId) {
        this.jobId = jobId;
        this.type = type;
        this.value = value;
        this.error = error;
        this.duration = duration;
        this.completed = completed;
        this.workerId = workerId;
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public String toString() {
        return "JobResult{jobId=" + jobId + ", type=" + type + ", worker=" + workerId + ", duration=" + duration +
                (error != null ? ", error='" + error + '\'' : "") + '}';
    }
}
