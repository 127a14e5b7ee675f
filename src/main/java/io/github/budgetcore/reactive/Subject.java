package io.github.budgetcore.reactive;

import com.google.errorprone.annotations.ThreadSafe;

/**
 * An {@link Observable} that can be pushed to.
 */
@ThreadSafe
public class Subject<T> extends Observable<T> {

    /**
     * Delivers {@code value} to all observers. A no-op once the subject is closed.
     */
    public void next(T value) {
        emit(value);
    }
}
