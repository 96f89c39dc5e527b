package com.sanguo.engine.rules;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Phase;
import com.sanguo.engine.model.Player;

/**
 * Only the current player, during their play phase, may use cards actively.
 */
public final class PhaseRules {

    private PhaseRules() {
        // Utility class - prevent instantiation
    }

    public static RuleResult canAct(Game game, Player player) {
        if (game.getCurrentSeat() != player.getSeat()) {
            return RuleResult.deny("rules.phase.notCurrentPlayer");
        }
        if (game.getPhase() != Phase.PLAY) {
            return RuleResult.deny("rules.phase.notPlayPhase");
        }
        return RuleResult.ALLOWED;
    }
}
