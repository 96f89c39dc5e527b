package com.sanguo.engine.abilities;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.List;

/**
 * Lets its owner ask other players to answer a dodge request on their behalf.
 */
public interface ResponseAssistanceAbility {

    /**
     * Players who may answer for the owner, in the order they are asked.
     */
    List<Player> assistants(Game game, Player owner);
}
