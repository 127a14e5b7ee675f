package io.github.budgetcore.aggregator;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.base_exceptions.AggregationTimedOutException;
import io.github.budgetcore.base_exceptions.OperationTimedOutException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fans the sub-fetches of an {@link AggregationPlan} out onto concurrent units and joins them under one deadline.
 * <p>
 * A failing sub-fetch never aborts its siblings: its error lands in {@link AggregateResult#errors()} and the
 * call still returns. Only the deadline (or a stop of the caller's token) fails the whole call, with an
 * {@link AggregationTimedOutException} carrying whatever had finished by then.
 */
@ThreadSafe
public final class ConcurrentAggregator<K> implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(ConcurrentAggregator.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final long BARRIER_SLICE_MILLIS = 50;

    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Duration defaultTimeout;

    public ConcurrentAggregator() {
        this(new Builder<>());
    }

    private ConcurrentAggregator(Builder<K> b) {
        this.defaultTimeout = b.defaultTimeout;
        if (b.executor != null) {
            this.executor = b.executor;
            this.ownsExecutor = false;
        } else {
            int cpus = Runtime.getRuntime().availableProcessors();
            ThreadPoolExecutor tpe = new ThreadPoolExecutor(
                    Math.max(2, cpus),
                    Math.max(2, cpus),
                    60L, TimeUnit.SECONDS,
                    new LinkedBlockingQueue<>(),
                    new ThreadFactoryBuilder()
                            .setNameFormat("aggregator-%d")
                            .setDaemon(true)
                            .setUncaughtExceptionHandler((th, ex) -> logger.error("Uncaught in {}", th.getName(), ex))
                            .build());
            tpe.allowCoreThreadTimeOut(true);
            this.executor = tpe;
            this.ownsExecutor = true;
        }
    }

    public static <K> Builder<K> builder() {
        return new Builder<>();
    }

    public static final class Builder<K> {
        private ExecutorService executor;
        private Duration defaultTimeout = DEFAULT_TIMEOUT;

        /**
         * Runs sub-fetches on a caller-owned executor; {@link #close()} leaves it alone.
         */
        public Builder<K> executor(ExecutorService executor) {
            this.executor = Objects.requireNonNull(executor);
            return this;
        }

        /**
         * Deadline used by {@link ConcurrentAggregator#aggregate(Object, AggregationPlan)}. Default 10s.
         */
        public Builder<K> defaultTimeout(Duration timeout) {
            Objects.requireNonNull(timeout);
            if (timeout.isZero() || timeout.isNegative()) throw new IllegalArgumentException("timeout must be > 0");
            this.defaultTimeout = timeout;
            return this;
        }

        public ConcurrentAggregator<K> build() {
            return new ConcurrentAggregator<>(this);
        }
    }

    public @NotNull Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public @NotNull AggregateResult aggregate(@NotNull K key, @NotNull AggregationPlan<K> plan)
            throws AggregationTimedOutException, InterruptedException {
        return aggregate(key, plan, CancellationToken.withTimeout(defaultTimeout));
    }

    /**
     * Runs every sub-fetch of {@code plan} concurrently and waits for all of them.
     *
     * @throws AggregationTimedOutException if {@code token} is done before every sub-fetch has finished
     */
    public @NotNull AggregateResult aggregate(@NotNull K key, @NotNull AggregationPlan<K> plan,
                                              @NotNull CancellationToken token)
            throws AggregationTimedOutException, InterruptedException {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(token, "token");

        final Slots slots = new Slots();
        final CancellationToken fetchToken = token.child();
        final CountDownLatch barrier = new CountDownLatch(plan.size());
        final AtomicBoolean skippedOnDeadline = new AtomicBoolean(false);
        final List<Future<?>> running = new ArrayList<>(plan.size());

        for (Map.Entry<String, SubFetch<K>> e : plan.fetches().entrySet()) {
            final String field = e.getKey();
            final SubFetch<K> fetch = e.getValue();
            Runnable unit = () -> {
                try {
                    if (fetchToken.isDone()) {
                        skippedOnDeadline.set(true);
                        slots.fail(field, new OperationTimedOutException("fetch of '" + field + "' not started: " + fetchToken.reason()));
                        return;
                    }
                    slots.put(field, fetch.fetch(key, fetchToken));
                } catch (Throwable t) {
                    if (t instanceof InterruptedException) Thread.currentThread().interrupt();
                    logger.warn("Fetch of '{}' for {} failed: {}", field, key, t.toString());
                    slots.fail(field, t);
                } finally {
                    barrier.countDown();
                }
            };
            try {
                running.add(executor.submit(unit));
            } catch (RejectedExecutionException rex) {
                slots.fail(field, rex);
                barrier.countDown();
            }
        }

        while (!barrier.await(sliceMillis(token), TimeUnit.MILLISECONDS)) {
            if (token.isDone()) {
                throw timedOut(key, plan, token, fetchToken, running, slots);
            }
        }
        if (skippedOnDeadline.get()) {
            throw timedOut(key, plan, token, fetchToken, running, slots);
        }

        AggregateResult result = slots.snapshot();
        if (result.isDegraded()) {
            logger.debug("Aggregation for {} finished degraded: {}", key, result);
        }
        return result;
    }

    @Override
    public void close() {
        if (!ownsExecutor) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException ie) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private AggregationTimedOutException timedOut(K key, AggregationPlan<K> plan, CancellationToken token,
                                                  CancellationToken fetchToken, List<Future<?>> running, Slots slots) {
        fetchToken.requestStop("aggregation abandoned: " + token.reason());
        for (Future<?> f : running) f.cancel(true);
        AggregateResult partial = slots.snapshot();
        logger.warn("Aggregation of {} fields for {} abandoned ({}), finished: {}", plan.size(), key,
                token.reason(), partial.values().keySet());
        return new AggregationTimedOutException("aggregation for " + key + " did not finish: " + token.reason(), partial);
    }

    private static long sliceMillis(CancellationToken token) {
        Duration remaining = token.remaining();
        if (remaining == null) return BARRIER_SLICE_MILLIS;
        return Math.max(1, Math.min(remaining.toMillis(), BARRIER_SLICE_MILLIS));
    }

    /**
     * Per-call result slots, all behind one monitor.
     */
    private static final class Slots {
        @GuardedBy("this")
        private final Map<String, Object> values = new LinkedHashMap<>();
        @GuardedBy("this")
        private final Map<String, Throwable> failures = new LinkedHashMap<>();

        synchronized void put(String field, Object value) {
            values.put(field, value);
        }

        synchronized void fail(String field, Throwable error) {
            failures.put(field, error);
        }

        synchronized AggregateResult snapshot() {
            return new AggregateResult(values, failures);
        }
    }
}
