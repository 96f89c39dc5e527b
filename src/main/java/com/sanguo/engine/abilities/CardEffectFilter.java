package com.sanguo.engine.abilities;

import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

/**
 * Ability of a card's target that can cancel the card's effect on them.
 */
public interface CardEffectFilter {

    /**
     * @param owner the player holding this ability, who is the card's target
     */
    boolean nullifies(Game game, Player owner, Player user, Card card);
}
