package com.sanguo.engine.game;

/**
 * Who sits where, before the game is built.
 */
public record PlayerSpec(int seat, String heroId, boolean lord) {

    public static PlayerSpec of(int seat, String heroId) {
        return new PlayerSpec(seat, heroId, false);
    }
}
