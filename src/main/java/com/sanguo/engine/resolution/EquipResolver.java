package com.sanguo.engine.resolution;

import com.sanguo.engine.abilities.AbilityManager;
import com.sanguo.engine.events.CardUsedEvent;
import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.zones.CardMoveDescriptor;
import com.sanguo.engine.zones.CardMoveOrdering;
import com.sanguo.engine.zones.CardMoveReason;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Puts an equipment card into the user's equipment zone, replacing the card
 * in the same slot, and swaps the granted abilities.
 */
public class EquipResolver implements Resolver {
    public static final String KIND = "equip";

    private final Card card;

    public EquipResolver(Card card) {
        if (!card.subType().isEquipment()) {
            throw new IllegalArgumentException("Not an equipment card: " + card);
        }
        this.card = card;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        Game game = context.getGame();
        Player user = context.getActingPlayer();
        if (!user.getHand().contains(card)) {
            return ResolutionResult.failure(ResolutionErrorCode.CARD_NOT_FOUND, "resolution.equip.cardNotInHand");
        }
        AbilityManager abilities = context.getAbilityManager();

        List<Card> replaced = user.getEquipment().getCards().stream()
                .filter(c -> c.subType() == card.subType())
                .toList();
        for (Card old : replaced) {
            if (abilities != null) {
                abilities.removeEquipmentAbility(game, user, old);
            }
            context.getCardMoveService().move(CardMoveDescriptor.of(game, user.getEquipment(), game.getDiscardPile(),
                    old, CardMoveReason.DISCARD, CardMoveOrdering.TO_TOP));
        }

        context.getCardMoveService().move(CardMoveDescriptor.of(game, user.getHand(), user.getEquipment(), card,
                CardMoveReason.EQUIP, CardMoveOrdering.TO_BOTTOM));
        if (abilities != null) {
            abilities.addEquipmentAbility(game, user, card);
        }
        context.publish(new CardUsedEvent(game, user.getSeat(), card, List.of()));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seat", user.getSeat());
        data.put("card", card.definitionId());
        data.put("replaced", replaced.stream().map(Card::definitionId).toList());
        context.log(LogEntry.info("Equipped", "Equipment put into play", data));
        return ResolutionResult.SUCCESS;
    }
}
