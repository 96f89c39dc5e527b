package com.sanguo.engine.events;

import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;

public record AfterSlashDodgedEvent(Game game, int attackerSeat, int defenderSeat, Card slashCard) implements GameEvent {
}
