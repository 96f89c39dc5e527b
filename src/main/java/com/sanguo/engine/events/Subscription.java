package com.sanguo.engine.events;

/**
 * Handle returned by {@link EventBus#subscribe}. Unsubscribing more than
 * once is harmless.
 */
public interface Subscription {

    void unsubscribe();

    boolean isActive();

    Class<? extends GameEvent> eventType();
}
