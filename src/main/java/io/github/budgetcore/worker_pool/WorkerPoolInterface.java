package io.github.budgetcore.worker_pool;

import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.base_exceptions.OperationTimedOutException;
import io.github.budgetcore.base_exceptions.PoolNotRunningException;
import io.github.budgetcore.base_exceptions.QueueFullException;

public interface WorkerPoolInterface extends AutoCloseable {
    void start() throws PoolNotRunningException;

    void stop();

    void submit(Job job) throws PoolNotRunningException, QueueFullException;

    void submit(Job job, CancellationToken token) throws PoolNotRunningException, OperationTimedOutException, InterruptedException;

    JobResultStream results();

    PoolStats getStats();

    boolean isRunning();

    @Override
    default void close() {
        stop();
    }
}
