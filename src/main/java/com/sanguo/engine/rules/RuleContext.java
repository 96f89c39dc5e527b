package com.sanguo.engine.rules;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

public record RuleContext(Game game, Player player) {
}
