package com.sanguo.engine.choice;

/**
 * The single boundary through which player decisions enter the engine.
 * Called synchronously; the engine waits for the answer.
 */
@FunctionalInterface
public interface ChoiceProvider {
    ChoiceResult choose(ChoiceRequest request);
}
