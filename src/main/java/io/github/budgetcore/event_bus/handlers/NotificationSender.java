package io.github.budgetcore.event_bus.handlers;

/**
 * Delivery channel behind {@link NotificationHandler}. A thrown exception fails the handler invocation.
 */
@FunctionalInterface
public interface NotificationSender {
    void send(Notification notification) throws Exception;
}
