package io.github.budgetcore.event_bus.handlers;

import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.base_exceptions.CompositeHandlerException;
import io.github.budgetcore.base_exceptions.OperationTimedOutException;
import io.github.budgetcore.event_bus.Event;
import io.github.budgetcore.event_bus.EventHandler;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs several handlers one after another as a single subscription. Each handler is retried up to
 * {@code maxRetries} times with a fixed delay; the delay is cut short when the token is done.
 * <p>
 * By default the first handler that still fails after its retries stops the rest. With
 * {@link Builder#continueOnError(boolean)} every handler runs and all failures are reported together.
 */
public final class CompositeHandler implements EventHandler {
    private final static Logger logger = LoggerFactory.getLogger(CompositeHandler.class);

    private static final long MAX_SLEEP_SLICE_MILLIS = 10;

    private final List<EventHandler> handlers;
    private final boolean continueOnError;
    private final @Nullable Duration timeout;
    private final int maxRetries;
    private final Duration retryDelay;

    private CompositeHandler(Builder b) {
        this.handlers = List.copyOf(b.handlers);
        this.continueOnError = b.continueOnError;
        this.timeout = b.timeout;
        this.maxRetries = b.maxRetries;
        this.retryDelay = b.retryDelay;
    }

    public static final class Builder {
        private final List<EventHandler> handlers = new ArrayList<>();
        private boolean continueOnError = false;
        private Duration timeout = null;
        private int maxRetries = 0;
        private Duration retryDelay = Duration.ofMillis(100);

        public Builder add(@NotNull EventHandler handler) {
            this.handlers.add(Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        /**
         * Per-handler budget, retries included. Unset means the caller's token alone bounds each handler.
         */
        public Builder timeout(@NotNull Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isZero() || timeout.isNegative()) throw new IllegalArgumentException("timeout must be > 0");
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(@NotNull Duration retryDelay) {
            Objects.requireNonNull(retryDelay, "retryDelay");
            if (retryDelay.isNegative()) throw new IllegalArgumentException("retryDelay must be >= 0");
            this.retryDelay = retryDelay;
            return this;
        }

        public CompositeHandler build() {
            if (handlers.isEmpty()) throw new IllegalArgumentException("at least one handler is required");
            return new CompositeHandler(this);
        }
    }

    public int size() {
        return handlers.size();
    }

    @Override
    public void handle(Event event, CancellationToken token) throws Exception {
        List<Exception> failures = new ArrayList<>();
        for (EventHandler handler : handlers) {
            CancellationToken handlerToken = timeout != null ? token.child(timeout) : token;
            Exception failure = executeWithRetry(handler, event, handlerToken);
            if (failure != null) {
                failures.add(failure);
                if (!continueOnError) break;
            }
        }
        if (!failures.isEmpty()) {
            throw new CompositeHandlerException(failures.size() + " of " + handlers.size() + " handlers failed on "
                    + event.getType(), failures);
        }
    }

    /**
     * @return null on success, otherwise the last failure
     */
    private @Nullable Exception executeWithRetry(EventHandler handler, Event event, CancellationToken token)
            throws InterruptedException {
        Exception last = null;
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (token.isDone()) {
                return new OperationTimedOutException("gave up on " + event.getType() + " before attempt "
                        + (attempt + 1) + ": " + token.reason(), last);
            }
            try {
                handler.handle(event, token);
                return null;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                last = e;
                logger.debug("Attempt {} of {} failed on {}: {}", attempt + 1, maxRetries + 1, event, e.toString());
            }
            if (attempt < maxRetries) pause(token);
        }
        logger.warn("Handler failed on {} after {} attempts: {}", event, maxRetries + 1, String.valueOf(last));
        return last;
    }

    private void pause(CancellationToken token) throws InterruptedException {
        long until = System.nanoTime() + retryDelay.toNanos();
        while (!token.isDone()) {
            long left = until - System.nanoTime();
            if (left <= 0) return;
            Thread.sleep(Math.min(MAX_SLEEP_SLICE_MILLIS, Math.max(1, left / 1_000_000)));
        }
    }
}
