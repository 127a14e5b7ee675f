package io.github.budgetcore.reactive;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;

import java.util.Collections;

/**
 * Withholds every value until {@link #complete()}, then delivers only the last one: to the observers
 * present at completion and to anyone subscribing later. Pushes after completion are ignored.
 */
@ThreadSafe
public class AsyncSubject<T> extends Subject<T> {
    @GuardedBy("lock")
    private T last;
    @GuardedBy("lock")
    private boolean hasLast = false;
    @GuardedBy("lock")
    private boolean completed = false;

    public void complete() {
        lock.lock();
        try {
            if (isClosedLocked() || completed) return;
            completed = true;
            if (hasLast) enqueueLocked(last);
        } finally {
            lock.unlock();
        }
        drain();
    }

    public boolean isCompleted() {
        lock.lock();
        try {
            return completed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected boolean onPushLocked(T value) {
        if (completed) return false;
        last = value;
        hasLast = true;
        return false;
    }

    @Override
    protected void onSubscribeLocked(String id, Observer<? super T> observer) {
        if (completed && hasLast) enqueueLocked(id, observer, Collections.singletonList(last));
    }
}
