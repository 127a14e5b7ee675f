package io.github.budgetcore.reactive;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;

/**
 * Remembers the latest value and hands it to every new observer at subscribe time, before any later push.
 */
@ThreadSafe
public class BehaviorSubject<T> extends Subject<T> {
    @GuardedBy("lock")
    private T value;
    @GuardedBy("lock")
    private boolean hasValue;

    /**
     * Starts without a current value; late observers get nothing until the first push.
     */
    public BehaviorSubject() {
        this.hasValue = false;
    }

    public BehaviorSubject(T initialValue) {
        this.value = initialValue;
        this.hasValue = true;
    }

    /**
     * @return the current value, {@code null} when none has been pushed yet
     */
    public @Nullable T getValue() {
        lock.lock();
        try {
            return value;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasValue() {
        lock.lock();
        try {
            return hasValue;
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected boolean onPushLocked(T newValue) {
        this.value = newValue;
        this.hasValue = true;
        return true;
    }

    @Override
    protected void onSubscribeLocked(String id, Observer<? super T> observer) {
        if (hasValue) enqueueLocked(id, observer, Collections.singletonList(value));
    }
}
