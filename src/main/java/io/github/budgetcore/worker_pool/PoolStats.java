package io.github.budgetcore.worker_pool;

import java.time.Duration;

/**
 * Point-in-time copy of the pool counters.
 */
public final class PoolStats {
    public final long jobsProcessed;
    public final long jobsFailed;
    public final int queuedJobs;
    public final int activeWorkers;
    public final int busyWorkers;
    public final Duration totalDuration;
    public final Duration averageDuration;

    PoolStats(long jobsProcessed, long jobsFailed, int queuedJobs, int activeWorkers, int busyWorkers,
              Duration totalDuration, Duration averageDuration) {
        this.jobsProcessed = jobsProcessed;
        this.jobsFailed = jobsFailed;
        this.queuedJobs = queuedJobs;
        this.activeWorkers = activeWorkers;
        this.busyWorkers = busyWorkers;
        this.totalDuration = totalDuration;
        this.averageDuration = averageDuration;
    }

    @Override
    public String toString() {
        return "PoolStats{processed=" + jobsProcessed + ", failed=" + jobsFailed + ", queued=" + queuedJobs +
                ", activeWorkers=" + activeWorkers + ", busyWorkers=" + busyWorkers +
                ", totalDuration=" + totalDuration + ", averageDuration=" + averageDuration + '}';
    }
}
