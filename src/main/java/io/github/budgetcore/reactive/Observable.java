package io.github.budgetcore.reactive;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A stream of values delivered to observers registered under caller-chosen ids.
 * <ul>
 *   <li>Two states, open and closed; closing is one-way and may be repeated.</li>
 *   <li>Subscribing under an id that is already taken replaces the previous observer.</li>
 *   <li>Values pushed after close are dropped silently.</li>
 *   <li>Each observer gets the values of one stream in push order.</li>
 * </ul>
 * <p>
 * The lock only guards the stream's state. A push enqueues a delivery under the lock and then drains the queue
 * with the lock released. One thread drains at a time: a push that arrives while another thread (or an
 * observer callback on this thread) is draining is left in the queue for the draining thread. Observers are
 * therefore never called concurrently for one stream, and never with a stream lock held, so streams that push
 * into each other cannot deadlock. A slow observer still slows its stream down.
 * <p>
 * Only {@link Subject}s can be pushed to from the outside.
 */
@ThreadSafe
public class Observable<T> {
    private final static Logger logger = LoggerFactory.getLogger(Observable.class);

    protected final ReentrantLock lock = new ReentrantLock();
    @GuardedBy("lock")
    private final Map<String, Observer<? super T>> observers = new LinkedHashMap<>();
    @GuardedBy("lock")
    private final ArrayDeque<Delivery<T>> pending = new ArrayDeque<>();
    @GuardedBy("lock")
    private boolean draining = false;
    @GuardedBy("lock")
    private boolean closed = false;

    /**
     * Registers {@code observer} under {@code id}, replacing any observer already registered under it.
     *
     * @return false if the stream is closed and nothing was registered
     */
    public boolean subscribe(@NotNull String id, @NotNull Observer<? super T> observer) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(observer, "observer");
        lock.lock();
        try {
            if (closed) {
                logger.debug("Subscribe of '{}' ignored, {} is closed", id, this);
                return false;
            }
            observers.put(id, observer);
            logger.debug("Observer '{}' subscribed to {}", id, this);
            onSubscribeLocked(id, observer);
        } finally {
            lock.unlock();
        }
        drain();
        return true;
    }

    public void unsubscribe(@NotNull String id) {
        lock.lock();
        try {
            if (observers.remove(id) != null) {
                logger.debug("Observer '{}' unsubscribed from {}", id, this);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the stream and drops every observer along with the deliveries still queued for them.
     */
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            observers.clear();
            pending.clear();
            logger.debug("{} closed", this);
        } finally {
            lock.unlock();
        }
        onClosed();
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int observerCount() {
        lock.lock();
        try {
            return observers.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pushes {@code value} to every observer unless the stream is closed or {@link #onPushLocked} vetoes it.
     */
    protected final void emit(T value) {
        lock.lock();
        try {
            if (closed) return;
            if (!onPushLocked(value)) return;
            enqueueLocked(value);
        } finally {
            lock.unlock();
        }
        drain();
    }

    /**
     * Queues {@code value} for every observer registered right now. Caller holds {@link #lock} and calls
     * {@link #drain()} once it has released it.
     */
    @GuardedBy("lock")
    protected final void enqueueLocked(T value) {
        if (observers.isEmpty()) return;
        // snapshot: an observer may (un)subscribe from inside its callback
        pending.addLast(new Delivery<>(new ArrayList<>(observers.entrySet()), Collections.singletonList(value)));
    }

    /**
     * Queues {@code values}, in order, for the single observer registered under {@code id}. Used for replay.
     */
    @GuardedBy("lock")
    protected final void enqueueLocked(String id, Observer<? super T> observer, List<T> values) {
        if (values.isEmpty()) return;
        Map.Entry<String, Observer<? super T>> target = new AbstractMap.SimpleImmutableEntry<>(id, observer);
        pending.addLast(new Delivery<>(Collections.singletonList(target), new ArrayList<>(values)));
    }

    /**
     * Delivers queued values until the queue is empty, unless another call is already doing so.
     * Must be called without {@link #lock} held.
     */
    protected final void drain() {
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("drain() called while holding the lock of " + this);
        }
        lock.lock();
        try {
            if (draining) return;
            draining = true;
        } finally {
            lock.unlock();
        }
        while (true) {
            Delivery<T> next;
            lock.lock();
            try {
                next = pending.pollFirst();
                if (next == null) {
                    draining = false;
                    return;
                }
            } finally {
                lock.unlock();
            }
            for (T value : next.values) {
                for (Map.Entry<String, Observer<? super T>> e : next.targets) {
                    deliverTo(e.getKey(), e.getValue(), value);
                }
            }
        }
    }

    private void deliverTo(String id, Observer<? super T> observer, T value) {
        try {
            observer.onNext(value);
        } catch (Throwable t) {
            logger.warn("Observer '{}' of {} failed: {}", id, this, t.toString());
        }
    }

    @GuardedBy("lock")
    protected final boolean isClosedLocked() {
        return closed;
    }

    /**
     * Hook run under the lock when a value is pushed, before it is queued. Returning false withholds the value.
     */
    @GuardedBy("lock")
    protected boolean onPushLocked(T value) {
        return true;
    }

    /**
     * Hook run under the lock right after an observer was registered; replaying streams queue their values here.
     */
    @GuardedBy("lock")
    protected void onSubscribeLocked(String id, Observer<? super T> observer) {
    }

    /**
     * Hook run once, without the lock, after the stream was closed.
     */
    protected void onClosed() {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(this));
    }

    private static final class Delivery<T> {
        final List<Map.Entry<String, Observer<? super T>>> targets;
        final List<T> values;

        Delivery(List<Map.Entry<String, Observer<? super T>>> targets, List<T> values) {
            this.targets = targets;
            this.values = values;
        }
    }
}
