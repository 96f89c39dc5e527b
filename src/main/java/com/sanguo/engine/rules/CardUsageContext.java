package com.sanguo.engine.rules;

import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

public record CardUsageContext(Game game, Player user, Card card) {
}
