package io.github.budgetcore.token_bucket_limiter;

/**
 * Non-blocking permit check. {@link io.github.budgetcore.reactive.Operators#throttle} asks it once per pushed
 * value and drops the value when no permit is left.
 */
public interface Limiter {
    /**
     * Takes one permit if available. Never waits.
     *
     * @return {@code false} if the caller should skip this unit of work
     */
    boolean tryAcquire();
}
