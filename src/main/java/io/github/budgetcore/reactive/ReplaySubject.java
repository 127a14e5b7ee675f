package io.github.budgetcore.reactive;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the last {@code bufferSize} values and replays them, oldest first, to every new observer.
 */
@ThreadSafe
public class ReplaySubject<T> extends Subject<T> {
    private final int bufferSize;
    @GuardedBy("lock")
    private final ArrayDeque<T> buffer;

    public ReplaySubject(int bufferSize) {
        if (bufferSize < 1) throw new IllegalArgumentException("bufferSize must be >= 1");
        this.bufferSize = bufferSize;
        this.buffer = new ArrayDeque<>(bufferSize);
    }

    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * Copy of the replay buffer, oldest first.
     */
    public @NotNull List<T> getBuffer() {
        lock.lock();
        try {
            return new ArrayList<>(buffer);
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected boolean onPushLocked(T value) {
        buffer.addLast(value);
        while (buffer.size() > bufferSize) buffer.pollFirst();
        return true;
    }

    @Override
    protected void onSubscribeLocked(String id, Observer<? super T> observer) {
        enqueueLocked(id, observer, new ArrayList<>(buffer));
    }
}
