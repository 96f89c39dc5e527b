package com.sanguo.engine.zones;

/**
 * Why a set of cards changes zone.
 */
public enum CardMoveReason {
    DRAW,
    DISCARD,
    PLAY,
    JUDGEMENT,
    EQUIP,
    OBTAIN,
    RESHUFFLE
}
