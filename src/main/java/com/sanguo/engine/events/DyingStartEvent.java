package com.sanguo.engine.events;

import com.sanguo.engine.model.Game;

public record DyingStartEvent(Game game, int dyingSeat) implements GameEvent {
}
