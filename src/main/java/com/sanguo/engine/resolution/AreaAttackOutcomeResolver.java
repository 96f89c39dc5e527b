package com.sanguo.engine.resolution;

import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.response.ResponseWindowResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Settles one target of an area attack: nothing happens if the target
 * answered or has died meanwhile, otherwise the pending damage is dealt.
 */
public class AreaAttackOutcomeResolver implements Resolver {
    public static final String KIND = "area-attack-outcome";

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        DamageDescriptor damage = context.getPendingDamage();
        if (damage == null) {
            return ResolutionResult.failure(ResolutionErrorCode.INVALID_STATE, "resolution.areaAttack.noPendingDamage");
        }
        Optional<ResponseWindowResult> response = context.requireScratchPad().remove(ScratchKeys.LAST_RESPONSE);
        Player target = context.getGame().getPlayer(damage.targetSeat());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user", damage.sourceSeat());
        data.put("target", target.getSeat());
        data.put("reason", damage.reason());
        if (!target.isAlive()) {
            context.log(LogEntry.info("AreaAttackSkipped", "Target died before its turn", data));
            return ResolutionResult.SUCCESS;
        }
        if (response.isPresent() && response.get().isSuccess()) {
            data.put("answer_card_id", response.get().playedCards().get(0).id());
            context.log(LogEntry.info("AreaAttackAnswered", "Target answered the area attack", data));
            return ResolutionResult.SUCCESS;
        }

        context.log(LogEntry.info("AreaAttackHit", "Target did not answer the area attack", data));
        context.getStack().push(new DamageResolver(), context);
        return ResolutionResult.SUCCESS;
    }
}
