package io.github.budgetcore.token_bucket_limiter;

import java.time.Duration;

/**
 * A lightweight, thread-safe token-bucket rate limiter.
 * <p>
 * Refills at the configured {@code ratePerSecond} and allows bursts up to the bucket capacity.
 * Uses {@code System.nanoTime()} for time measurement and a floating-point token counter for smooth refill.
 * The bucket starts full.
 *
 * <h3>Algorithm</h3>
 * <ul>
 *   <li>On each {@link #tryAcquire()} call, computes the elapsed time since the previous call
 *       and refills the internal token counter by {@code elapsedSeconds * ratePerSecond},
 *       clamped to {@code capacity}.</li>
 *   <li>If at least one token is available, consumes one and returns {@code true};
 *       otherwise returns {@code false} immediately.</li>
 * </ul>
 *
 * <h3>One permit per window</h3>
 * {@link #oncePer(Duration)} builds a bucket of capacity one that refills over {@code window}.
 * A permit taken at {@code t} makes the next one available at {@code t + window}; rejected calls
 * do not consume anything. This is leading-edge throttling.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Limiter limiter = new SimpleTokenBucketLimiter(5.0); // ~5 permits/sec, burst ~5
 * if (limiter.tryAcquire()) {
 *     // do work
 * } else {
 *     // skip
 * }
 * }</pre>
 */
public final class SimpleTokenBucketLimiter implements Limiter {
    private final double ratePerSecond;
    private final double maxBurst;
    private double tokens;
    private long lastNanos;

    /**
     * Capacity defaults to {@code max(1, ratePerSecond)}.
     *
     * @param ratePerSecond average permits per second, must be &gt; 0
     */
    public SimpleTokenBucketLimiter(double ratePerSecond) {
        this(ratePerSecond, Math.max(1.0, ratePerSecond));
    }

    /**
     * @param ratePerSecond average permits per second, must be &gt; 0
     * @param burstCapacity bucket size, must be &gt;= 1
     */
    public SimpleTokenBucketLimiter(double ratePerSecond, double burstCapacity) {
        if (ratePerSecond <= 0) {
            throw new IllegalArgumentException("ratePerSecond must be > 0");
        }
        if (burstCapacity < 1.0) {
            throw new IllegalArgumentException("burstCapacity must be >= 1");
        }
        this.ratePerSecond = ratePerSecond;
        this.maxBurst = burstCapacity;
        this.tokens = this.maxBurst;
        this.lastNanos = System.nanoTime();
    }

    /**
     * At most one permit per {@code window}.
     */
    public static SimpleTokenBucketLimiter oncePer(Duration window) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be > 0");
        }
        return new SimpleTokenBucketLimiter(1_000_000_000.0 / window.toNanos(), 1.0);
    }


    /** {@inheritDoc} */
    @Override
    public synchronized boolean tryAcquire() {
        long now = System.nanoTime();
        double elapsedSec = (now - lastNanos) / 1_000_000_000.0;
        lastNanos = now;

        tokens = Math.min(maxBurst, tokens + elapsedSec * ratePerSecond);
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }
}
