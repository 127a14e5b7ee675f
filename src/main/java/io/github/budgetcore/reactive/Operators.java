package io.github.budgetcore.reactive;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.budgetcore.token_bucket_limiter.Limiter;
import io.github.budgetcore.token_bucket_limiter.SimpleTokenBucketLimiter;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Stream-to-stream transforms. Each operator subscribes to its source(s) under a unique internal id and pushes
 * onto a fresh destination stream. If a source is already closed the destination is returned closed. Closing a
 * destination unsubscribes it from its sources.
 */
public final class Operators {
    private final static Logger logger = LoggerFactory.getLogger(Operators.class);

    private static final AtomicLong OPERATOR_IDS = new AtomicLong();

    private Operators() {
    }

    public static <T, R> @NotNull Observable<R> map(@NotNull Observable<T> source,
                                                     @NotNull Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        OperatorSubject<R> out = new OperatorSubject<>();
        attach(source, "map", out, value -> out.next(mapper.apply(value)));
        return out;
    }

    public static <T> @NotNull Observable<T> filter(@NotNull Observable<T> source, @NotNull Predicate<? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        OperatorSubject<T> out = new OperatorSubject<>();
        attach(source, "filter", out, value -> {
            if (predicate.test(value)) out.next(value);
        });
        return out;
    }

    /**
     * Debounce on the shared reactive scheduler.
     */
    public static <T> @NotNull Observable<T> debounce(@NotNull Observable<T> source, @NotNull Duration quiet) {
        return debounce(source, quiet, SharedScheduler.INSTANCE);
    }

    /**
     * Emits the latest value once {@code quiet} has passed without a newer one. A burst collapses to its last value.
     */
    public static <T> @NotNull Observable<T> debounce(@NotNull Observable<T> source, @NotNull Duration quiet,
                                                      @NotNull ScheduledExecutorService scheduler) {
        requirePositive(quiet, "quiet");
        Objects.requireNonNull(scheduler, "scheduler");
        OperatorSubject<T> out = new OperatorSubject<>();
        Debouncer<T> debouncer = new Debouncer<>(out, quiet.toNanos(), scheduler);
        out.onClose(debouncer::cancel);
        attach(source, "debounce", out, debouncer::offer);
        return out;
    }

    /**
     * Leading-edge throttle: the first value of a window passes, the rest of that window is dropped.
     */
    public static <T> @NotNull Observable<T> throttle(@NotNull Observable<T> source, @NotNull Duration window) {
        requirePositive(window, "window");
        Limiter limiter = SimpleTokenBucketLimiter.oncePer(window);
        OperatorSubject<T> out = new OperatorSubject<>();
        attach(source, "throttle", out, value -> {
            if (limiter.tryAcquire()) out.next(value);
        });
        return out;
    }

    @SafeVarargs
    public static <T> @NotNull Observable<T> merge(@NotNull Observable<? extends T>... sources) {
        return merge(Arrays.asList(sources));
    }

    /**
     * Forwards every value of every source. Order is kept per source only.
     */
    public static <T> @NotNull Observable<T> merge(@NotNull List<? extends Observable<? extends T>> sources) {
        Objects.requireNonNull(sources, "sources");
        OperatorSubject<T> out = new OperatorSubject<>();
        for (Observable<? extends T> source : sources) {
            Objects.requireNonNull(source, "source");
            String id = nextId("merge");
            if (source.subscribe(id, out::next)) {
                out.onClose(() -> source.unsubscribe(id));
            } else {
                logger.debug("merge source {} already closed, skipped", source);
            }
        }
        return out;
    }

    /**
     * Emits {@code combiner(lastA, lastB)} whenever either side pushes, once both sides have pushed at least once.
     */
    public static <A, B, R> @NotNull Observable<R> combineLatest(@NotNull Observable<A> a, @NotNull Observable<B> b,
                                                                 @NotNull BiFunction<? super A, ? super B, ? extends R> combiner) {
        Objects.requireNonNull(combiner, "combiner");
        OperatorSubject<R> out = new OperatorSubject<>();
        Latest<A, B> latest = new Latest<>();
        attach(a, "combine-latest-a", out, value -> {
            Pair<A, B> pair = latest.setA(value);
            if (pair != null) out.next(combiner.apply(pair.a, pair.b));
        });
        attach(b, "combine-latest-b", out, value -> {
            Pair<A, B> pair = latest.setB(value);
            if (pair != null) out.next(combiner.apply(pair.a, pair.b));
        });
        return out;
    }

    // ======== Internals ========

    private static <T> void attach(Observable<T> source, String kind, OperatorSubject<?> out,
                                   Observer<? super T> observer) {
        Objects.requireNonNull(source, "source");
        String id = nextId(kind);
        if (source.subscribe(id, observer)) {
            out.onClose(() -> source.unsubscribe(id));
        } else {
            out.close();
        }
    }

    private static String nextId(String kind) {
        return kind + "-" + OPERATOR_IDS.incrementAndGet();
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be > 0");
    }

    @VisibleForTesting
    static ScheduledExecutorService sharedScheduler() {
        return SharedScheduler.INSTANCE;
    }

    private static final class SharedScheduler {
        static final ScheduledExecutorService INSTANCE = create();

        private static ScheduledExecutorService create() {
            ScheduledThreadPoolExecutor s = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
                    .setNameFormat("reactive-scheduler-%d")
                    .setDaemon(true)
                    .setUncaughtExceptionHandler((th, ex) -> logger.error("Uncaught in {}", th.getName(), ex))
                    .build());
            s.setRemoveOnCancelPolicy(true);
            return s;
        }
    }

    /**
     * Destination of an operator; runs the registered detach actions once it is closed.
     */
    private static final class OperatorSubject<T> extends Subject<T> {
        private final List<Runnable> detachers = new CopyOnWriteArrayList<>();

        void onClose(Runnable action) {
            detachers.add(action);
            // closed before the action was registered
            if (isClosed()) action.run();
        }

        @Override
        protected void onClosed() {
            for (Runnable action : detachers) {
                action.run();
            }
        }
    }

    private static final class Debouncer<T> {
        private final Subject<T> out;
        private final long quietNanos;
        private final ScheduledExecutorService scheduler;

        @GuardedBy("this")
        private long generation = 0;
        @GuardedBy("this")
        private ScheduledFuture<?> pending;

        Debouncer(Subject<T> out, long quietNanos, ScheduledExecutorService scheduler) {
            this.out = out;
            this.quietNanos = quietNanos;
            this.scheduler = scheduler;
        }

        synchronized void offer(T value) {
            if (pending != null) pending.cancel(false);
            final long mine = ++generation;
            pending = scheduler.schedule(() -> fire(mine, value), quietNanos, TimeUnit.NANOSECONDS);
        }

        synchronized void cancel() {
            generation++;
            if (pending != null) pending.cancel(false);
            pending = null;
        }

        private void fire(long mine, T value) {
            synchronized (this) {
                // a newer value was offered after this one was scheduled
                if (mine != generation) return;
                pending = null;
            }
            out.next(value);
        }
    }

    private static final class Latest<A, B> {
        @GuardedBy("this")
        private A a;
        @GuardedBy("this")
        private B b;
        @GuardedBy("this")
        private boolean hasA = false;
        @GuardedBy("this")
        private boolean hasB = false;

        synchronized Pair<A, B> setA(A value) {
            a = value;
            hasA = true;
            return hasB ? new Pair<>(a, b) : null;
        }

        synchronized Pair<A, B> setB(B value) {
            b = value;
            hasB = true;
            return hasA ? new Pair<>(a, b) : null;
        }
    }

    private static final class Pair<A, B> {
        final A a;
        final B b;

        Pair(A a, B b) {
            this.a = a;
            this.b = b;
        }
    }
}
