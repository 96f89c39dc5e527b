package com.sanguo.engine.events;

/**
 * Raised when an event handler is re-entered for the same event type while
 * it is still running, or when nested publication exceeds the configured
 * depth.
 */
public class EventReentrancyException extends IllegalStateException {
    public EventReentrancyException(String message) {
        super(message);
    }
}
