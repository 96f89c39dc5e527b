package com.sanguo.engine.events;

import com.sanguo.engine.model.Game;

/**
 * @param killerSeat seat of the damage source, or null when unknown
 */
public record PlayerDiedEvent(Game game, int seat, Integer killerSeat) implements GameEvent {
}
