package com.sanguo.engine.resolution;

import com.sanguo.engine.events.AfterSlashDodgedEvent;
import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.response.DodgeRequestContext;
import com.sanguo.engine.response.ManualDodgeProvider;
import com.sanguo.engine.response.ResponseWindowResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a slash was evaded, and if not schedules the context's
 * pending damage.
 */
public class AttackOutcomeResolver implements Resolver {
    public static final String KIND = "attack-outcome";

    private final AttackSource source;

    public AttackOutcomeResolver(AttackSource source) {
        this.source = source;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        DamageDescriptor damage = context.getPendingDamage();
        if (damage == null) {
            return ResolutionResult.failure(ResolutionErrorCode.INVALID_STATE, "resolution.attack.noPendingDamage");
        }
        ScratchPad scratch = context.requireScratchPad();
        Optional<DodgeRequestContext> request = scratch.remove(ScratchKeys.DODGE_REQUEST);
        Optional<ResponseWindowResult> response = scratch.remove(ScratchKeys.LAST_RESPONSE);

        if (request.isPresent() && !request.get().isResolved() && response.isPresent()
                && response.get().isSuccess()) {
            request.get().markResolved(ManualDodgeProvider.ID, response.get().playedCards().get(0));
        }
        String evadedBy = null;
        Card dodgeCard = null;
        if (request.isPresent() && request.get().isResolved()) {
            evadedBy = request.get().getResolvedBy();
            dodgeCard = request.get().getProvidedCard();
        } else if (response.isPresent() && response.get().isSuccess()) {
            evadedBy = "dodge";
            dodgeCard = response.get().playedCards().get(0);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("attacker", source.attackerSeat());
        data.put("defender", source.defenderSeat());
        data.put("card_id", source.card().id());
        if (evadedBy != null) {
            data.put("evaded_by", evadedBy);
            data.put("dodge_card_id", dodgeCard.id());
            context.log(LogEntry.info("SlashDodged", "Slash was dodged", data));
            context.publish(new AfterSlashDodgedEvent(context.getGame(), source.attackerSeat(),
                    source.defenderSeat(), source.card()));
            return ResolutionResult.SUCCESS;
        }

        context.log(LogEntry.info("SlashHit", "Slash was not dodged", data));
        context.getStack().push(new DamageResolver(), context);
        return ResolutionResult.SUCCESS;
    }
}
