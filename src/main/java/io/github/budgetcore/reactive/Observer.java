package io.github.budgetcore.reactive;

/**
 * Callback receiving the values of a stream. A thrown exception is logged by the stream and does not
 * affect other observers.
 */
@FunctionalInterface
public interface Observer<T> {
    void onNext(T value) throws Exception;
}
