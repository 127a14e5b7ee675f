package io.github.budgetcore.event_bus;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.budgetcore.CancellationToken;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process publish/subscribe registry keyed by event type pattern.
 * <p>
 * The subscription list and the metrics each sit behind their own lock, and neither lock is held while a handler runs.
 * Every handler invocation goes through the middleware chain registered with {@link #use}.
 */
@ThreadSafe
public final class EventBus implements EventBusInterface {
    private final static Logger logger = LoggerFactory.getLogger(EventBus.class);

    private final ExecutorService asyncExecutor;
    private final boolean ownsExecutor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final Object registryLock = new Object();
    @GuardedBy("registryLock")
    private final List<Subscription> subscriptions = new ArrayList<>();

    private final List<EventMiddleware> middleware = new CopyOnWriteArrayList<>();

    private final Metrics metrics = new Metrics();

    public EventBus() {
        this(new Builder());
    }

    private EventBus(Builder b) {
        this.middleware.addAll(b.middleware);
        if (b.asyncExecutor != null) {
            this.asyncExecutor = b.asyncExecutor;
            this.ownsExecutor = false;
        } else {
            int cpus = Runtime.getRuntime().availableProcessors();
            ThreadPoolExecutor tpe = new ThreadPoolExecutor(
                    Math.max(2, cpus),
                    Math.max(2, cpus),
                    60L, TimeUnit.SECONDS,
                    new LinkedBlockingQueue<>(),
                    new ThreadFactoryBuilder()
                            .setNameFormat(b.threadNamePrefix + "%d")
                            .setDaemon(true)
                            .setUncaughtExceptionHandler((th, ex) -> logger.error("Uncaught in {}", th.getName(), ex))
                            .build());
            tpe.allowCoreThreadTimeOut(true);
            this.asyncExecutor = tpe;
            this.ownsExecutor = true;
        }
    }

    public static final class Builder {
        private ExecutorService asyncExecutor;
        private String threadNamePrefix = "event-bus-async-";
        private final List<EventMiddleware> middleware = new ArrayList<>();

        /**
         * Executor for {@link EventBus#publishAsync}; a caller-owned executor is not shut down by {@link EventBus#close()}.
         */
        public Builder asyncExecutor(ExecutorService executor) {
            this.asyncExecutor = Objects.requireNonNull(executor);
            return this;
        }

        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix);
            return this;
        }

        /**
         * Same as calling {@link EventBus#use} right after construction.
         */
        public Builder use(EventMiddleware... middleware) {
            for (EventMiddleware m : middleware) {
                this.middleware.add(Objects.requireNonNull(m, "middleware"));
            }
            return this;
        }

        public EventBus build() {
            return new EventBus(this);
        }
    }

    // ======== Subscriptions ========

    @Override
    public @NotNull Subscription subscribe(@NotNull String pattern, @NotNull EventHandler handler) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(handler, "handler");
        if (pattern.isEmpty()) throw new IllegalArgumentException("pattern must not be empty");
        Subscription sub = new Subscription(pattern, handler);
        synchronized (registryLock) {
            subscriptions.add(sub);
        }
        logger.debug("Subscribed {} to '{}'", sub.getId(), pattern);
        return sub;
    }

    @Override
    public boolean unsubscribe(@NotNull String pattern, @NotNull EventHandler handler) {
        Subscription removed = null;
        synchronized (registryLock) {
            Iterator<Subscription> it = subscriptions.iterator();
            while (it.hasNext()) {
                Subscription s = it.next();
                if (s.getPattern().equals(pattern) && s.getHandler() == handler) {
                    it.remove();
                    removed = s;
                    break;
                }
            }
        }
        if (removed == null) return false;
        metrics.forget(removed.getId());
        logger.debug("Unsubscribed {} from '{}'", removed.getId(), pattern);
        return true;
    }

    @Override
    public boolean unsubscribe(@NotNull Subscription subscription) {
        boolean removed;
        synchronized (registryLock) {
            removed = subscriptions.remove(subscription);
        }
        if (removed) {
            metrics.forget(subscription.getId());
            logger.debug("Unsubscribed {}", subscription.getId());
        }
        return removed;
    }

    @Override
    public void use(@NotNull EventMiddleware... middleware) {
        for (EventMiddleware m : middleware) {
            this.middleware.add(Objects.requireNonNull(m, "middleware"));
        }
    }

    @Override
    public int subscriptionCount() {
        synchronized (registryLock) {
            return subscriptions.size();
        }
    }

    // ======== Delivery ========

    /**
     * If {@code token} becomes done part-way, the handlers not yet invoked are skipped.
     */
    @Override
    public void publish(@NotNull Event event, @NotNull CancellationToken token) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(token, "token");
        List<Subscription> targets = matching(event.getType());
        List<EventMiddleware> chain = new ArrayList<>(middleware);
        metrics.recordPublished(event.getType());

        for (int i = 0; i < targets.size(); i++) {
            if (token.isDone()) {
                logger.warn("Delivery of {} stopped after {} of {} handlers: {}", event, i, targets.size(), token.reason());
                return;
            }
            Subscription sub = targets.get(i);
            long start = System.nanoTime();
            boolean failed = false;
            try {
                wrap(sub.getHandler(), chain).handle(event, token);
            } catch (Throwable t) {
                if (t instanceof InterruptedException) Thread.currentThread().interrupt();
                failed = true;
                logger.warn("Handler {} failed on {}: {}", sub.getId(), event, t.toString());
            }
            metrics.recordInvocation(event.getType(), sub.getId(), System.nanoTime() - start, failed);
        }
    }

    @Override
    public @NotNull CompletableFuture<Void> publishAsync(@NotNull Event event, @NotNull CancellationToken token) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(token, "token");
        if (closed.get()) throw new IllegalStateException("event bus is closed");
        try {
            return CompletableFuture.runAsync(() -> publish(event, token), asyncExecutor);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("event bus is closed", e);
        }
    }

    @Override
    public @NotNull EventMetrics getMetrics() {
        Set<String> active = new HashSet<>();
        synchronized (registryLock) {
            for (Subscription s : subscriptions) active.add(s.getId());
        }
        return metrics.snapshot(active);
    }

    /**
     * Rejects further {@link #publishAsync} calls and waits up to 5 seconds for queued deliveries.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        if (ownsExecutor) {
            asyncExecutor.shutdown();
            try {
                if (!asyncExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.warn("Async deliveries still running after 5s, interrupting");
                    asyncExecutor.shutdownNow();
                }
            } catch (InterruptedException ie) {
                asyncExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        logger.info("Event bus closed: {}", getMetrics());
    }

    public boolean isClosed() {
        return closed.get();
    }

    private static EventHandler wrap(EventHandler handler, List<EventMiddleware> chain) {
        EventHandler wrapped = handler;
        for (int i = chain.size() - 1; i >= 0; i--) {
            wrapped = chain.get(i).apply(wrapped);
        }
        return wrapped;
    }

    private List<Subscription> matching(String eventType) {
        List<Subscription> out = new ArrayList<>();
        synchronized (registryLock) {
            for (Subscription s : subscriptions) {
                if (s.matches(eventType)) out.add(s);
            }
        }
        return out;
    }

    @ThreadSafe
    private static final class Metrics {
        @GuardedBy("this")
        private long published = 0;
        @GuardedBy("this")
        private long invocations = 0;
        @GuardedBy("this")
        private long failures = 0;
        @GuardedBy("this")
        private Instant lastEventTime = null;
        @GuardedBy("this")
        private final Map<String, long[]> byType = new LinkedHashMap<>();
        @GuardedBy("this")
        private final Map<String, long[]> bySubscription = new LinkedHashMap<>();

        // byType slots: published, invocations, failures. bySubscription slots: invocations, nanos.

        synchronized void recordPublished(String type) {
            published++;
            lastEventTime = Instant.now();
            byType.computeIfAbsent(type, k -> new long[3])[0]++;
        }

        synchronized void recordInvocation(String type, String subscriptionId, long nanos, boolean failed) {
            invocations++;
            long[] t = byType.computeIfAbsent(type, k -> new long[3]);
            t[1]++;
            if (failed) {
                failures++;
                t[2]++;
            }
            long[] s = bySubscription.computeIfAbsent(subscriptionId, k -> new long[2]);
            s[0]++;
            s[1] += nanos;
        }

        synchronized void forget(String subscriptionId) {
            bySubscription.remove(subscriptionId);
        }

        synchronized EventMetrics snapshot(Set<String> activeSubscriptions) {
            // an invocation still running at unsubscribe time records after forget()
            bySubscription.keySet().retainAll(activeSubscriptions);
            Map<String, EventTypeMetrics> types = new LinkedHashMap<>();
            byType.forEach((k, v) -> types.put(k, new EventTypeMetrics(k, v[0], v[1], v[2])));
            Map<String, HandlerLatency> subs = new LinkedHashMap<>();
            bySubscription.forEach((k, v) -> subs.put(k, new HandlerLatency(k, v[0], Duration.ofNanos(v[1]))));
            return new EventMetrics(published, invocations, failures, activeSubscriptions.size(), lastEventTime, types,
                    subs);
        }
    }
}
