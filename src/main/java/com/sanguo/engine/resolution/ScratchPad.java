package com.sanguo.engine.resolution;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-chain storage through which a resolver hands a value to a resolver
 * that runs later in the same chain.
 */
public class ScratchPad {
    private final Map<ScratchKey<?>, Object> values = new HashMap<>();

    public <T> void put(ScratchKey<T> key, T value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, key.type().cast(value));
        }
    }

    public <T> Optional<T> get(ScratchKey<T> key) {
        return Optional.ofNullable(key.type().cast(values.get(key)));
    }

    /**
     * Remove and return the value, so a stale value is never read twice.
     */
    public <T> Optional<T> remove(ScratchKey<T> key) {
        return Optional.ofNullable(key.type().cast(values.remove(key)));
    }

    public boolean contains(ScratchKey<?> key) {
        return values.containsKey(key);
    }

    public void clear() {
        values.clear();
    }
}
