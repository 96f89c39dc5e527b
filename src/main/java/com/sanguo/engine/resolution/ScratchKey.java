package com.sanguo.engine.resolution;

/**
 * Typed key into a {@link ScratchPad}.
 */
public record ScratchKey<T>(String name, Class<T> type) {
}
