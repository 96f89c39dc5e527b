package com.sanguo.engine.events;

import com.sanguo.engine.judgement.JudgementResult;
import com.sanguo.engine.model.Game;

public record JudgementCompletedEvent(Game game, JudgementResult result) implements GameEvent {
}
