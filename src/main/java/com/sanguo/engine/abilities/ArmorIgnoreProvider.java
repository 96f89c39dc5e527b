package com.sanguo.engine.abilities;

import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

/**
 * Ability of a card's user that disables the target's armor for that card.
 */
public interface ArmorIgnoreProvider {

    boolean ignoresArmor(Game game, Player user, Player target, Card card);
}
