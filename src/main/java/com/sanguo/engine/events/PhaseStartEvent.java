package com.sanguo.engine.events;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Phase;

public record PhaseStartEvent(Game game, int seat, Phase phase) implements GameEvent {
}
