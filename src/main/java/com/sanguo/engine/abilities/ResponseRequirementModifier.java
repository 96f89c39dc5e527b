package com.sanguo.engine.abilities;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.rules.ResponseType;

/**
 * Ability of an attacker that changes how many response cards its target
 * must play.
 */
public interface ResponseRequirementModifier {

    int modifyRequiredCount(Game game, Player owner, Player responder, ResponseType type, int current);
}
