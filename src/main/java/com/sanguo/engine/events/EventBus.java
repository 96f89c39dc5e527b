package com.sanguo.engine.events;

import java.util.function.Consumer;

/**
 * Typed, synchronous publish/subscribe.
 */
public interface EventBus {

    /**
     * Register a handler for an event type. The handler also receives events
     * whose class is a subtype of {@code type}.
     */
    <E extends GameEvent> Subscription subscribe(Class<E> type, Consumer<? super E> handler);

    /**
     * Deliver an event to every matching handler, in subscription order,
     * before returning. Handlers may publish further events.
     */
    void publish(GameEvent event);

    /**
     * Number of live subscriptions registered for exactly this type.
     */
    int subscriberCount(Class<? extends GameEvent> type);
}
