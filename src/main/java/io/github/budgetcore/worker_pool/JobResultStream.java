package io.github.budgetcore.worker_pool;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.base_exceptions.OperationTimedOutException;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded buffer of {@link JobResult}s produced by the workers of one pool.
 * <ul>
 *   <li>While the pool runs, a full buffer blocks the producing worker until a consumer drains it.</li>
 *   <li>Once the pool is stopping the bound is lifted so shutdown can always finish.</li>
 *   <li>After close, consumers still receive everything buffered, then end-of-stream.</li>
 * </ul>
 */
@ThreadSafe
public final class JobResultStream {
    private static final long WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    @GuardedBy("lock")
    private final ArrayDeque<JobResult> buffer = new ArrayDeque<>();
    @GuardedBy("lock")
    private boolean unbounded = false;
    @GuardedBy("lock")
    private boolean closed = false;

    JobResultStream(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
    }

    void publish(@NotNull JobResult result) throws InterruptedException {
        lock.lock();
        try {
            while (buffer.size() >= capacity && !unbounded) {
                notFull.await();
            }
            buffer.addLast(result);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    void liftBound() {
        lock.lock();
        try {
            unbounded = true;
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the next result.
     *
     * @return the next result, or empty once the stream is closed and fully drained
     * @throws OperationTimedOutException if {@code token} is done before a result arrives
     */
    public @NotNull Optional<JobResult> poll(@NotNull CancellationToken token) throws OperationTimedOutException, InterruptedException {
        Objects.requireNonNull(token, "token");
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty()) {
                if (closed) return Optional.empty();
                if (token.isDone()) {
                    throw new OperationTimedOutException("no job result available: " + token.reason());
                }
                Duration remaining = token.remaining();
                long waitNanos = remaining == null ? WAIT_SLICE_NANOS : Math.min(remaining.toNanos(), WAIT_SLICE_NANOS);
                notEmpty.awaitNanos(Math.max(1, waitNanos));
            }
            JobResult result = buffer.pollFirst();
            notFull.signal();
            return Optional.of(result);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Non-blocking variant of {@link #poll(CancellationToken)}.
     */
    public @NotNull Optional<JobResult> tryPoll() {
        lock.lock();
        try {
            JobResult result = buffer.pollFirst();
            if (result != null) notFull.signal();
            return Optional.ofNullable(result);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves everything currently buffered into {@code sink}.
     *
     * @return number of results moved
     */
    public int drainTo(@NotNull Collection<? super JobResult> sink) {
        lock.lock();
        try {
            int n = 0;
            JobResult r;
            while ((r = buffer.pollFirst()) != null) {
                sink.add(r);
                n++;
            }
            if (n > 0) notFull.signalAll();
            return n;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }
}
