package io.github.budgetcore.event_bus.middleware;

import com.google.common.util.concurrent.AtomicLongMap;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.budgetcore.event_bus.EventHandler;
import io.github.budgetcore.event_bus.EventMiddleware;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;

/**
 * Counts handler invocations per event type, split into successes and failures, and sums their run time.
 * One instance may be shared by several buses.
 */
@ThreadSafe
public final class MetricsMiddleware implements EventMiddleware {
    private final AtomicLongMap<String> processed = AtomicLongMap.create();
    private final AtomicLongMap<String> succeeded = AtomicLongMap.create();
    private final AtomicLongMap<String> failed = AtomicLongMap.create();
    private final AtomicLongMap<String> nanos = AtomicLongMap.create();

    @Override
    public @NotNull EventHandler apply(@NotNull EventHandler next) {
        return (event, token) -> {
            String type = event.getType();
            processed.incrementAndGet(type);
            long start = System.nanoTime();
            boolean ok = false;
            try {
                next.handle(event, token);
                ok = true;
            } finally {
                nanos.addAndGet(type, System.nanoTime() - start);
                if (ok) {
                    succeeded.incrementAndGet(type);
                } else {
                    failed.incrementAndGet(type);
                }
            }
        };
    }

    public long processed(@NotNull String eventType) {
        return processed.get(eventType);
    }

    public long succeeded(@NotNull String eventType) {
        return succeeded.get(eventType);
    }

    public long failed(@NotNull String eventType) {
        return failed.get(eventType);
    }

    public @NotNull Duration totalTime(@NotNull String eventType) {
        return Duration.ofNanos(nanos.get(eventType));
    }

    /**
     * {@link Duration#ZERO} when no invocation of that type finished yet.
     */
    public @NotNull Duration averageTime(@NotNull String eventType) {
        long done = succeeded.get(eventType) + failed.get(eventType);
        return done == 0 ? Duration.ZERO : Duration.ofNanos(nanos.get(eventType) / done);
    }

    public long totalProcessed() {
        return processed.sum();
    }
}
