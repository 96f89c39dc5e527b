package com.sanguo.engine.events;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.resolution.DamageDescriptor;

public record DamageCreatedEvent(Game game, DamageDescriptor damage) implements GameEvent {
}
