package io.github.budgetcore.event_bus.middleware;

import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.event_bus.BaseEvent;
import io.github.budgetcore.event_bus.EventBus;
import io.github.budgetcore.event_bus.EventTypes;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class ErrorHandlingMiddlewareTest {

    @Test
    void reportsFailures_andBusStillCountsThem() {
        List<String> reported = new CopyOnWriteArrayList<>();
        try (EventBus bus = new EventBus.Builder()
                .use(new ErrorHandlingMiddleware((event, error) -> reported.add(event.getType() + ":" + error.getMessage())))
                .build()) {
            bus.subscribe(EventTypes.SYSTEM_HEALTH, (e, t) -> {
                throw new Exception("checked");
            });
            bus.subscribe(EventTypes.SYSTEM_HEALTH, (e, t) -> {
                throw new AssertionError("error");
            });
            bus.subscribe(EventTypes.SYSTEM_HEALTH, (e, t) -> { });

            bus.publish(new BaseEvent(EventTypes.SYSTEM_HEALTH, "test", null));

            assertEquals(List.of("system.health:checked", "system.health:error"), reported);
            assertEquals(2, bus.getMetrics().totalHandlerFailures);
        }
    }

    @Test
    void failingListener_doesNotReplaceHandlerError() {
        ErrorHandlingMiddleware middleware = new ErrorHandlingMiddleware((event, error) -> {
            throw new IllegalStateException("listener bug");
        });
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, () ->
                middleware.apply((e, t) -> {
                    throw new IllegalArgumentException("handler");
                }).handle(new BaseEvent(EventTypes.SYSTEM_HEALTH, "test", null), CancellationToken.none()));
        assertEquals("handler", thrown.getMessage());
    }
}
