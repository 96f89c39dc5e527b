package com.sanguo.engine.resolution;

import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Player;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Restores health, up to the player's maximum.
 */
public class HealResolver implements Resolver {
    public static final String KIND = "heal";

    private final int seat;
    private final int amount;

    public HealResolver(int seat, int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Heal amount cannot be negative: " + amount);
        }
        this.seat = seat;
        this.amount = amount;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        Player player = context.getGame().findPlayer(seat).orElse(null);
        if (player == null) {
            return ResolutionResult.failure(ResolutionErrorCode.INVALID_TARGET, "resolution.heal.unknownTarget");
        }
        if (!player.isAlive()) {
            return ResolutionResult.failure(ResolutionErrorCode.TARGET_NOT_ALIVE, "resolution.heal.targetNotAlive");
        }
        int previous = player.getCurrentHealth();
        player.setCurrentHealth(Math.min(player.getMaxHealth(), previous + amount));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seat", seat);
        data.put("previous_health", previous);
        data.put("current_health", player.getCurrentHealth());
        context.log(LogEntry.info("Healed", "Health restored", data));
        return ResolutionResult.SUCCESS;
    }
}
