package com.sanguo.engine.resolution;

import com.sanguo.engine.events.DyingStartEvent;
import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.response.ResponseWindows;

import java.util.Map;

/**
 * The acting player, at zero health, asks everyone for a peach, starting
 * with themselves. The pending damage, if any, is what brought them there.
 */
public class DyingResolver implements Resolver {
    public static final String KIND = "dying";

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        Player player = context.getActingPlayer();
        int dyingSeat = player.getSeat();
        if (!player.isAlive() || player.getCurrentHealth() > 0) {
            return ResolutionResult.SUCCESS;
        }
        ScratchPad scratch = context.requireScratchPad();
        scratch.remove(ScratchKeys.LAST_RESPONSE);

        context.log(LogEntry.info("DyingStart", "Player is dying", Map.of("seat", dyingSeat)));
        DyingStartEvent event = new DyingStartEvent(context.getGame(), dyingSeat);
        context.publish(event);

        context.getStack().push(new RescueOutcomeResolver(), context);
        context.getStack().push(ResponseWindows.peach(context.getGame(), dyingSeat, event), context);
        return ResolutionResult.SUCCESS;
    }
}
