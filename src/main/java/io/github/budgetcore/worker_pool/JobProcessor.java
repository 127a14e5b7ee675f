package io.github.budgetcore.worker_pool;

import io.github.budgetcore.CancellationToken;

/**
 * Business logic plugged into a {@link WorkerPool}. Called concurrently from every worker.
 */
@FunctionalInterface
public interface JobProcessor {
    /**
     * @param job   the job to execute
     * @param token stopped when the pool shuts down; long jobs should check it
     * @return the job's result value, may be null
     * @throws Exception recorded on the {@link JobResult}, never propagated
     */
    Object process(Job job, CancellationToken token) throws Exception;
}
