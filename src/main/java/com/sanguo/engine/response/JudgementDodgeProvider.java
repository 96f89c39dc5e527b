package com.sanguo.engine.response;

import com.sanguo.engine.abilities.Ability;
import com.sanguo.engine.abilities.EvadeJudgementAbility;
import com.sanguo.engine.judgement.JudgementReason;
import com.sanguo.engine.judgement.JudgementRequest;
import com.sanguo.engine.judgement.JudgementResult;
import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.resolution.ResolutionContext;
import com.sanguo.engine.zones.DeckExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evades with a judgement, synchronously. A successful judgement resolves
 * the request; a failed one leaves it to lower providers.
 */
public class JudgementDodgeProvider implements DodgeProvider {
    private static final Logger log = LoggerFactory.getLogger(JudgementDodgeProvider.class);

    public static final String ID = "judgement-dodge";

    @Override
    public int priority() {
        return 1;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean canProvide(ResolutionContext context, DodgeRequestContext request) {
        if (context.getJudgementService() == null) {
            return false;
        }
        Player defender = context.getGame().getPlayer(request.getDefenderSeat());
        return !context.abilitiesOf(defender, EvadeJudgementAbility.class).isEmpty();
    }

    @Override
    public void provide(ResolutionContext context, DodgeRequestContext request) {
        Player defender = context.getGame().getPlayer(request.getDefenderSeat());
        List<EvadeJudgementAbility> evaders = context.abilitiesOf(defender, EvadeJudgementAbility.class);
        EvadeJudgementAbility evader = evaders.get(0);
        String sourceId = evader instanceof Ability ability ? ability.id() : ID;

        JudgementResult result;
        try {
            result = context.getJudgementService().execute(context.getGame(), defender,
                    new JudgementRequest(sourceId, JudgementReason.EVADE, evader.evadeRule()),
                    context.getCardMoveService());
        } catch (DeckExhaustedException e) {
            log.warn("Seat {} could not judge for {}: {}", defender.getSeat(), sourceId, e.getMessage());
            return;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seat", defender.getSeat());
        data.put("source", sourceId);
        data.put("card_id", result.card().id());
        data.put("success", result.success());
        context.log(LogEntry.info("EvadeJudgement", "Evade judgement performed", data));

        if (result.success()) {
            request.markResolved(sourceId, result.card());
        }
    }
}
