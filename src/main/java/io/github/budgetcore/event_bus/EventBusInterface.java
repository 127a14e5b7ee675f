package io.github.budgetcore.event_bus;

import io.github.budgetcore.CancellationToken;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

public interface EventBusInterface extends AutoCloseable {

    /**
     * Adds {@code handler} for every event whose type matches {@code pattern}. The same handler may be
     * subscribed several times; each subscription is invoked.
     */
    @NotNull Subscription subscribe(@NotNull String pattern, @NotNull EventHandler handler);

    /**
     * Removes the first subscription of {@code handler} (by identity) under {@code pattern}.
     *
     * @return false if there was none
     */
    boolean unsubscribe(@NotNull String pattern, @NotNull EventHandler handler);

    boolean unsubscribe(@NotNull Subscription subscription);

    /**
     * Appends middleware to the chain wrapped around every handler invocation. The first middleware added is
     * the outermost one. Applies to subscriptions old and new, from the next delivery on.
     */
    void use(@NotNull EventMiddleware... middleware);

    /**
     * Invokes every matching handler on the calling thread, in subscription order. Handler failures are
     * recorded in the metrics and never reach the publisher.
     */
    void publish(@NotNull Event event, @NotNull CancellationToken token);

    default void publish(@NotNull Event event) {
        publish(event, CancellationToken.none());
    }

    /**
     * Runs {@link #publish} on the bus executor and returns at once. The future completes when every handler
     * has run; it does not complete exceptionally because of handler failures.
     *
     * @throws IllegalStateException if the bus is closed
     */
    @NotNull CompletableFuture<Void> publishAsync(@NotNull Event event, @NotNull CancellationToken token);

    default @NotNull CompletableFuture<Void> publishAsync(@NotNull Event event) {
        return publishAsync(event, CancellationToken.none());
    }

    @NotNull EventMetrics getMetrics();

    int subscriptionCount();

    @Override
    void close();
}
