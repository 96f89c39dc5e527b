package com.sanguo.engine.model;

/**
 * Turn phases, in the order a turn runs through them.
 */
public enum Phase {
    NONE,
    START,
    JUDGE,
    DRAW,
    PLAY,
    DISCARD,
    END
}
