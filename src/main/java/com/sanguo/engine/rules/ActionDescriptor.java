package com.sanguo.engine.rules;

import com.sanguo.engine.choice.TargetConstraints;
import com.sanguo.engine.model.Card;

import java.util.List;

/**
 * An action a player may take, with the cards that can pay for it.
 *
 * @param targetConstraints null when the action needs no targets
 */
public record ActionDescriptor(String actionId, List<Card> cardCandidates, TargetConstraints targetConstraints) {
    public ActionDescriptor {
        cardCandidates = List.copyOf(cardCandidates);
    }

    public static ActionDescriptor endPlayPhase() {
        return new ActionDescriptor(ActionIds.END_PLAY_PHASE, List.of(), null);
    }

    public boolean requiresTargets() {
        return targetConstraints != null && targetConstraints.minTargets() > 0;
    }
}
