package com.sanguo.engine.events;

import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.rules.ResponseType;

/**
 * A card was played inside a response window.
 */
public record CardPlayedEvent(Game game, int seat, Card card, ResponseType responseType) implements GameEvent {
}
