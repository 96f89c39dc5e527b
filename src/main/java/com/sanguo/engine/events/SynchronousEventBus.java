package com.sanguo.engine.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Single-threaded event bus. Dispatch happens on the caller's stack.
 *
 * <p>Each subscription tracks the event classes it is currently handling;
 * delivering the same event class to a subscription that has not yet
 * returned raises {@link EventReentrancyException}. Nested publication is
 * also bounded by {@code maxDepth}.
 */
public class SynchronousEventBus implements EventBus {
    private static final Logger log = LoggerFactory.getLogger(SynchronousEventBus.class);

    public static final int DEFAULT_MAX_DEPTH = 64;

    private final List<Registration<?>> registrations = new ArrayList<>();
    private final int maxDepth;
    private int depth;

    public SynchronousEventBus() {
        this(DEFAULT_MAX_DEPTH);
    }

    public SynchronousEventBus(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("Max depth must be positive, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    @Override
    public <E extends GameEvent> Subscription subscribe(Class<E> type, Consumer<? super E> handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        Registration<E> registration = new Registration<>(type, handler);
        registrations.add(registration);
        return registration;
    }

    @Override
    public void publish(GameEvent event) {
        Objects.requireNonNull(event, "event");
        if (depth >= maxDepth) {
            throw new EventReentrancyException("Event publication nested deeper than " + maxDepth
                    + " while publishing " + event.getClass().getSimpleName());
        }

        // Snapshot so handlers may subscribe or unsubscribe while we dispatch
        List<Registration<?>> targets = new ArrayList<>();
        for (Registration<?> registration : registrations) {
            if (registration.type.isInstance(event)) {
                targets.add(registration);
            }
        }
        log.trace("Publishing {} to {} handler(s) at depth {}", event.getClass().getSimpleName(), targets.size(), depth);

        depth++;
        try {
            for (Registration<?> registration : targets) {
                if (registration.active) {
                    registration.dispatch(event);
                }
            }
        } finally {
            depth--;
        }
    }

    @Override
    public int subscriberCount(Class<? extends GameEvent> type) {
        int count = 0;
        for (Registration<?> registration : registrations) {
            if (registration.type == type) {
                count++;
            }
        }
        return count;
    }

    private final class Registration<E extends GameEvent> implements Subscription {
        private final Class<E> type;
        private final Consumer<? super E> handler;
        private final Set<Class<?>> handling = new HashSet<>();
        private boolean active = true;

        private Registration(Class<E> type, Consumer<? super E> handler) {
            this.type = type;
            this.handler = handler;
        }

        private void dispatch(GameEvent event) {
            Class<?> eventClass = event.getClass();
            if (!handling.add(eventClass)) {
                throw new EventReentrancyException("Handler for " + type.getSimpleName()
                        + " re-entered while still handling " + eventClass.getSimpleName());
            }
            try {
                handler.accept(type.cast(event));
            } finally {
                handling.remove(eventClass);
            }
        }

        @Override
        public void unsubscribe() {
            if (active) {
                active = false;
                registrations.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public Class<? extends GameEvent> eventType() {
            return type;
        }
    }
}
