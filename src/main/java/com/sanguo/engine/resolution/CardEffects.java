package com.sanguo.engine.resolution;

import com.sanguo.engine.abilities.Ability;
import com.sanguo.engine.abilities.ArmorAbility;
import com.sanguo.engine.abilities.ArmorIgnoreProvider;
import com.sanguo.engine.abilities.CardEffectFilter;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.Optional;

/**
 * Checks whether a card's effect on a target is cancelled by the target's
 * abilities.
 */
public final class CardEffects {

    private CardEffects() {
        // Utility class - prevent instantiation
    }

    /**
     * Id of the first ability that cancels the card, if any. Armor is
     * skipped when the user ignores armor for this card.
     */
    public static Optional<String> findVeto(ResolutionContext context, Player user, Player target, Card card) {
        Game game = context.getGame();
        boolean armorIgnored = context.abilitiesOf(user, ArmorIgnoreProvider.class).stream()
                .anyMatch(p -> p.ignoresArmor(game, user, target, card));

        for (CardEffectFilter filter : context.abilitiesOf(target, CardEffectFilter.class)) {
            if (armorIgnored && filter instanceof ArmorAbility) {
                continue;
            }
            if (filter.nullifies(game, target, user, card)) {
                return Optional.of(filter instanceof Ability ability ? ability.id() : filter.getClass().getSimpleName());
            }
        }
        return Optional.empty();
    }
}
