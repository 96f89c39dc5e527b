package com.sanguo.engine.events;

import com.sanguo.engine.model.Game;

public record TurnEndEvent(Game game, int seat, int turnNumber) implements GameEvent {
}
