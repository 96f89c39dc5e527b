package com.sanguo.engine.abilities;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.List;

/**
 * Source of live ability lists for rule and event evaluation.
 */
public interface AbilityQueryService {

    /**
     * The player's abilities that are currently active, in registration order.
     */
    List<Ability> activeAbilities(Game game, Player player);

    /**
     * Active abilities of the player that implement the given interface.
     */
    default <T> List<T> activeAbilities(Game game, Player player, Class<T> kind) {
        return activeAbilities(game, player).stream()
                .filter(kind::isInstance)
                .map(kind::cast)
                .toList();
    }
}
