package com.sanguo.engine.abilities;

public enum AbilityType {
    /** Used at the owner's discretion. */
    ACTIVE,
    /** Fires in reaction to an event. */
    TRIGGER,
    /** Always on. */
    LOCKED
}
