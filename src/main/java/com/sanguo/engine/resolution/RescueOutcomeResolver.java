package com.sanguo.engine.resolution;

import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.response.ResponseWindowResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the peach window: a rescue restores the dying (acting) player to at
 * least one health, otherwise the player dies.
 */
public class RescueOutcomeResolver implements Resolver {
    public static final String KIND = "rescue-outcome";

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        ResponseWindowResult result = context.requireScratchPad().remove(ScratchKeys.LAST_RESPONSE)
                .orElse(ResponseWindowResult.noResponse());
        Player player = context.getActingPlayer();
        int dyingSeat = player.getSeat();
        if (!player.isAlive()) {
            return ResolutionResult.SUCCESS;
        }

        if (result.isSuccess()) {
            player.setCurrentHealth(Math.max(1, player.getCurrentHealth() + 1));
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("seat", dyingSeat);
            data.put("rescuer", result.responderSeat());
            data.put("current_health", player.getCurrentHealth());
            context.log(LogEntry.info("PlayerRescued", "Dying player was rescued", data));
            return ResolutionResult.SUCCESS;
        }

        DamageDescriptor cause = context.getPendingDamage();
        DamageResolver.killPlayer(context, player, cause != null ? cause.sourceSeat() : null);
        return ResolutionResult.SUCCESS;
    }
}
