package io.github.budgetcore.worker_pool;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.ObjectsUtils;
import io.github.budgetcore.base_exceptions.OperationTimedOutException;
import io.github.budgetcore.base_exceptions.PoolNotRunningException;
import io.github.budgetcore.base_exceptions.QueueFullException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * WorkerPool: a fixed set of workers pulling from one bounded job queue:
 * - {@link #start()} spins up exactly {@code workers} loops; a stopped pool cannot be restarted.
 * - {@link #submit(Job)} fails fast on a full queue, {@link #submit(Job, CancellationToken)} waits for space
 *   until the token is done. The bounded queue is the only backpressure in the core.
 * - Every accepted job produces exactly one {@link JobResult} on {@link #results()}; a failing processor
 *   is recorded on the result and the worker moves on.
 * - {@link #stop()} stops accepting jobs, lets the workers drain what was already accepted, then closes the
 *   result stream. It is idempotent.
 */
@ThreadSafe
public final class WorkerPool implements WorkerPoolInterface {
    private final static Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private static final long POLL_INTERVAL_MILLIS = 50;
    private static final long SUBMIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(25);

    private enum State {NEW, RUNNING, STOPPING, STOPPED}

    private final int workers;
    private final int queueCapacity;
    private final JobProcessor processor;
    private final BlockingQueue<Job> jobQueue;
    private final JobResultStream results;
    private final ThreadFactory threadFactory;
    private final CancellationToken shutdownToken = new CancellationToken();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();
    @GuardedBy("stateLock")
    private State state = State.NEW;
    @GuardedBy("stateLock")
    private ThreadPoolExecutor executor;
    private volatile boolean draining = false;

    private final Object statsLock = new Object();
    @GuardedBy("statsLock")
    private long jobsProcessed = 0;
    @GuardedBy("statsLock")
    private long jobsFailed = 0;
    @GuardedBy("statsLock")
    private long totalNanos = 0;
    @GuardedBy("statsLock")
    private int liveWorkers = 0;
    @GuardedBy("statsLock")
    private int busyWorkers = 0;

    /**
     * Pool with default capacities; {@code workers <= 0} is treated as one worker.
     */
    public WorkerPool(int workers, @NotNull JobProcessor processor) {
        this(new Builder().workers(Math.max(1, workers)).processor(processor));
    }

    private WorkerPool(Builder b) {
        this.workers = b.workers;
        this.processor = ObjectsUtils.requireNonNull(b.processor, new IllegalArgumentException("processor must be NotNull"));
        this.queueCapacity = b.queueCapacity > 0 ? b.queueCapacity : 2 * workers;
        int resultCapacity = b.resultBufferCapacity > 0 ? b.resultBufferCapacity : 2 * workers;
        this.jobQueue = new ArrayBlockingQueue<>(queueCapacity);
        this.results = new JobResultStream(resultCapacity);
        this.threadFactory = new ThreadFactoryBuilder()
                .setNameFormat(b.threadNamePrefix + "%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler((th, ex) -> logger.error("Uncaught in {}", th.getName(), ex))
                .build();
    }

    public static final class Builder {
        private int workers = 1;
        private JobProcessor processor;
        private int queueCapacity = 0;
        private int resultBufferCapacity = 0;
        private String threadNamePrefix = "worker-pool-";

        /**
         * Number of concurrent workers, must be &gt;= 1.
         */
        public Builder workers(int workers) {
            ObjectsUtils.requireTrue(workers >= 1, new IllegalArgumentException("workers must be >= 1"));
            this.workers = workers;
            return this;
        }

        public Builder processor(JobProcessor processor) {
            this.processor = Objects.requireNonNull(processor);
            return this;
        }

        /**
         * Job queue capacity. Defaults to twice the worker count.
         */
        public Builder queueCapacity(int queueCapacity) {
            ObjectsUtils.requireTrue(queueCapacity >= 1, new IllegalArgumentException("queueCapacity must be >= 1"));
            this.queueCapacity = queueCapacity;
            return this;
        }

        /**
         * Result buffer capacity. Defaults to twice the worker count.
         */
        public Builder resultBufferCapacity(int resultBufferCapacity) {
            ObjectsUtils.requireTrue(resultBufferCapacity >= 1, new IllegalArgumentException("resultBufferCapacity must be >= 1"));
            this.resultBufferCapacity = resultBufferCapacity;
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix);
            return this;
        }

        public WorkerPool build() {
            return new WorkerPool(this);
        }
    }

    // ======== Public API ========

    @Override
    public void start() throws PoolNotRunningException {
        stateLock.writeLock().lock();
        try {
            if (state == State.RUNNING) {
                throw new IllegalStateException("worker pool is already running");
            }
            if (state != State.NEW) {
                throw new PoolNotRunningException("worker pool has been stopped and cannot be restarted");
            }
            executor = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(), threadFactory);
            for (int i = 0; i < workers; i++) {
                final int workerId = i;
                executor.execute(() -> workerLoop(workerId));
            }
            state = State.RUNNING;
            logger.info("Worker pool started with {} workers, queue capacity {}", workers, queueCapacity);
        } finally {
            stateLock.writeLock().unlock();
        }
    }

    /**
     * Stops accepting jobs and blocks until every accepted job has produced its result.
     * Calling it again, concurrently or later, waits for the same termination and changes nothing.
     */
    @Override
    public void stop() {
        ThreadPoolExecutor toJoin = null;
        stateLock.writeLock().lock();
        try {
            switch (state) {
                case NEW:
                    state = State.STOPPED;
                    results.close();
                    terminated.countDown();
                    logger.debug("Worker pool stopped before it was started");
                    return;
                case RUNNING:
                    state = State.STOPPING;
                    draining = true;
                    shutdownToken.requestStop("worker pool stopping");
                    results.liftBound();
                    toJoin = executor;
                    break;
                default:
                    break;
            }
        } finally {
            stateLock.writeLock().unlock();
        }

        if (toJoin == null) {
            awaitTerminationUninterruptibly();
            return;
        }

        toJoin.shutdown();
        boolean interrupted = false;
        while (true) {
            try {
                if (toJoin.awaitTermination(1, TimeUnit.SECONDS)) break;
            } catch (InterruptedException ie) {
                interrupted = true;
            }
        }

        stateLock.writeLock().lock();
        try {
            state = State.STOPPED;
            results.close();
        } finally {
            stateLock.writeLock().unlock();
        }
        terminated.countDown();
        logger.info("Worker pool stopped: {}", getStats());
        if (interrupted) Thread.currentThread().interrupt();
    }

    /**
     * Enqueues without waiting.
     *
     * @throws PoolNotRunningException if the pool is not running
     * @throws QueueFullException      if the job queue has no free slot
     */
    @Override
    public void submit(@NotNull Job job) throws PoolNotRunningException, QueueFullException {
        Objects.requireNonNull(job, "job");
        stateLock.readLock().lock();
        try {
            ensureRunning();
            if (!jobQueue.offer(job)) {
                throw new QueueFullException("job queue is full", queueCapacity);
            }
            logger.debug("Accepted {}", job);
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * Enqueues, waiting for a free slot until {@code token} is done.
     *
     * @throws PoolNotRunningException    if the pool is not running, or stops while waiting
     * @throws OperationTimedOutException if the token is already done or becomes done before a slot frees
     */
    @Override
    public void submit(@NotNull Job job, @NotNull CancellationToken token)
            throws PoolNotRunningException, OperationTimedOutException, InterruptedException {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(token, "token");
        while (true) {
            stateLock.readLock().lockInterruptibly();
            try {
                ensureRunning();
                if (token.isDone()) {
                    throw new OperationTimedOutException("submit of " + job.getId() + " abandoned: " + token.reason());
                }
                Duration remaining = token.remaining();
                long waitNanos = remaining == null ? SUBMIT_SLICE_NANOS : Math.min(remaining.toNanos(), SUBMIT_SLICE_NANOS);
                if (jobQueue.offer(job, Math.max(1, waitNanos), TimeUnit.NANOSECONDS)) {
                    logger.debug("Accepted {}", job);
                    return;
                }
            } finally {
                stateLock.readLock().unlock();
            }
        }
    }

    @Override
    public @NotNull JobResultStream results() {
        return results;
    }

    @Override
    public @NotNull PoolStats getStats() {
        synchronized (statsLock) {
            Duration total = Duration.ofNanos(totalNanos);
            Duration avg = jobsProcessed == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos / jobsProcessed);
            return new PoolStats(jobsProcessed, jobsFailed, jobQueue.size(), liveWorkers, busyWorkers, total, avg);
        }
    }

    @Override
    public boolean isRunning() {
        stateLock.readLock().lock();
        try {
            return state == State.RUNNING;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public int getWorkerCount() {
        return workers;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    // ======== Internals ========

    @GuardedBy("stateLock")
    private void ensureRunning() throws PoolNotRunningException {
        if (state != State.RUNNING) {
            throw new PoolNotRunningException("worker pool is not running (state: " + state + ")");
        }
    }

    private void workerLoop(int workerId) {
        synchronized (statsLock) {
            liveWorkers++;
        }
        logger.debug("Worker {} started", workerId);
        try {
            while (true) {
                Job job;
                try {
                    job = jobQueue.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("Worker {} interrupted, {} jobs left in queue", workerId, jobQueue.size());
                    break;
                }
                if (job == null) {
                    if (draining) break;
                    continue;
                }
                processJob(workerId, job);
            }
        } finally {
            synchronized (statsLock) {
                liveWorkers--;
            }
            logger.debug("Worker {} exited", workerId);
        }
    }

    private void processJob(int workerId, Job job) {
        synchronized (statsLock) {
            busyWorkers++;
        }
        long start = System.nanoTime();
        Object value = null;
        Throwable error = null;
        try {
            value = processor.process(job, shutdownToken);
        } catch (Throwable t) {
            error = t;
            logger.warn("Job {} of type {} failed on worker {}: {}", job.getId(), job.getType(), workerId, t.toString());
        }
        long elapsed = System.nanoTime() - start;
        JobResult result = new JobResult(job.getId(), job.getType(), error == null ? value : null, error,
                Duration.ofNanos(elapsed), Instant.now(), workerId);

        synchronized (statsLock) {
            busyWorkers--;
            jobsProcessed++;
            if (error != null) jobsFailed++;
            totalNanos += elapsed;
        }

        try {
            results.publish(result);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            logger.error("Worker {} interrupted while publishing result of {}", workerId, job.getId());
        }
    }

    private void awaitTerminationUninterruptibly() {
        boolean interrupted = false;
        while (true) {
            try {
                terminated.await();
                break;
            } catch (InterruptedException ie) {
                interrupted = true;
            }
        }
        if (interrupted) Thread.currentThread().interrupt();
    }
}
