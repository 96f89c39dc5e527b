package com.sanguo.engine.events;

import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;

import java.util.List;

/**
 * A card was used actively (as opposed to played in response).
 */
public record CardUsedEvent(Game game, int seat, Card card, List<Integer> targetSeats) implements GameEvent {
}
