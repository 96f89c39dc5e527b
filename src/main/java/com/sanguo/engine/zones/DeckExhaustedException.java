package com.sanguo.engine.zones;

/**
 * Thrown when cards must be taken from the draw pile and neither the draw
 * pile nor the discard pile can supply them.
 */
public class DeckExhaustedException extends Exception {
    public DeckExhaustedException(String message) {
        super(message);
    }

    public DeckExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
