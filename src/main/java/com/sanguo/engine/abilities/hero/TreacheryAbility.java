package com.sanguo.engine.abilities.hero;

import com.sanguo.engine.abilities.AbilityCapability;
import com.sanguo.engine.abilities.AbilityType;
import com.sanguo.engine.abilities.BaseAbility;
import com.sanguo.engine.events.DamageAppliedEvent;
import com.sanguo.engine.events.EventBus;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.zones.CardMoveDescriptor;
import com.sanguo.engine.zones.CardMoveOrdering;
import com.sanguo.engine.zones.CardMoveReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;

/**
 * After taking damage, the owner takes the card that caused it from the
 * discard pile.
 */
public class TreacheryAbility extends BaseAbility {
    private static final Logger log = LoggerFactory.getLogger(TreacheryAbility.class);

    public static final String ID = "treachery";

    public TreacheryAbility() {
        super(ID, "Treachery", AbilityType.TRIGGER, EnumSet.of(AbilityCapability.INTERVENES_RESOLUTION));
    }

    @Override
    protected void onAttach(EventBus eventBus) {
        listen(eventBus, DamageAppliedEvent.class, this::onDamageApplied);
    }

    private void onDamageApplied(DamageAppliedEvent event) {
        Player owner = getOwner();
        Card card = event.damage().causingCard();
        if (!ownerIsActive() || card == null || event.damage().effectiveTargetSeat() != owner.getSeat()) {
            return;
        }
        Game game = event.game();
        if (!game.getDiscardPile().contains(card)) {
            return;
        }
        event.context().getCardMoveService().move(CardMoveDescriptor.of(game, game.getDiscardPile(),
                owner.getHand(), card, CardMoveReason.OBTAIN, CardMoveOrdering.TO_BOTTOM));
        log.debug("Seat {} obtained {} via {}", owner.getSeat(), card, id());
    }
}
