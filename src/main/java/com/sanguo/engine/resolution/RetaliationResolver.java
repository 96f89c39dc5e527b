package com.sanguo.engine.resolution;

import com.sanguo.engine.judgement.JudgementReason;
import com.sanguo.engine.judgement.JudgementRequest;
import com.sanguo.engine.judgement.JudgementResult;
import com.sanguo.engine.judgement.JudgementRules;
import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.model.Suit;
import com.sanguo.engine.zones.DeckExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Judges for the acting player after they took the context's pending
 * damage; anything but a heart deals one damage back to its source.
 */
public class RetaliationResolver implements Resolver {
    private static final Logger log = LoggerFactory.getLogger(RetaliationResolver.class);

    public static final String KIND = "retaliation";

    private final String abilityId;

    public RetaliationResolver(String abilityId) {
        this.abilityId = abilityId;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        DamageDescriptor taken = context.getPendingDamage();
        if (taken == null || taken.sourceSeat() == null) {
            return ResolutionResult.failure(ResolutionErrorCode.INVALID_STATE, "resolution.retaliation.noPendingDamage");
        }
        Game game = context.getGame();
        Player owner = context.getActingPlayer();
        int ownerSeat = owner.getSeat();
        int sourceSeat = taken.sourceSeat();
        Player source = game.getPlayer(sourceSeat);
        if (!owner.isAlive() || !source.isAlive()) {
            return ResolutionResult.SUCCESS;
        }
        if (context.getJudgementService() == null) {
            return ResolutionResult.failure(ResolutionErrorCode.INVALID_STATE, "resolution.retaliation.noJudgement");
        }

        JudgementResult result;
        try {
            result = context.getJudgementService().execute(game, owner,
                    new JudgementRequest(abilityId, JudgementReason.RETALIATION, JudgementRules.not(JudgementRules.suit(Suit.HEART))),
                    context.getCardMoveService());
        } catch (DeckExhaustedException e) {
            log.warn("Seat {} could not judge for {}: {}", ownerSeat, abilityId, e.getMessage());
            return ResolutionResult.SUCCESS;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seat", ownerSeat);
        data.put("source", sourceSeat);
        data.put("card_id", result.card().id());
        data.put("success", result.success());
        context.log(LogEntry.info("Retaliation", "Retaliation judged", data));

        if (result.success()) {
            context.getStack().push(new DamageResolver(),
                    context.withPendingDamage(DamageDescriptor.of(ownerSeat, sourceSeat, 1, "Retaliation", null)));
        }
        return ResolutionResult.SUCCESS;
    }
}
