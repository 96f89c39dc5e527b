package com.sanguo.engine.resolution;

import com.sanguo.engine.events.BeforeDamageEvent;
import com.sanguo.engine.events.DamageAppliedEvent;
import com.sanguo.engine.events.DamageCreatedEvent;
import com.sanguo.engine.events.PlayerDiedEvent;
import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the context's pending damage. Health never drops below zero.
 */
public class DamageResolver implements Resolver {
    private static final Logger log = LoggerFactory.getLogger(DamageResolver.class);

    public static final String KIND = "damage";

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        DamageDescriptor damage = context.getPendingDamage();
        if (damage == null) {
            return ResolutionResult.failure(ResolutionErrorCode.INVALID_STATE, "resolution.damage.noPendingDamage");
        }
        Game game = context.getGame();
        Player target = game.findPlayer(damage.effectiveTargetSeat()).orElse(null);
        if (target == null) {
            return ResolutionResult.failure(ResolutionErrorCode.INVALID_TARGET, "resolution.damage.unknownTarget");
        }
        if (!target.isAlive()) {
            return ResolutionResult.failure(ResolutionErrorCode.TARGET_NOT_ALIVE, "resolution.damage.targetNotAlive");
        }

        BeforeDamageEvent before = new BeforeDamageEvent(game, damage);
        context.publish(before);
        if (before.isPrevented() && damage.preventable()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("target", target.getSeat());
            data.put("amount", damage.amount());
            data.put("prevented_by", before.getPreventedBy());
            context.log(LogEntry.info("DamagePrevented", "Damage was prevented", data));
            return ResolutionResult.SUCCESS;
        }

        context.publish(new DamageCreatedEvent(game, damage));

        int previous = target.getCurrentHealth();
        int current = Math.max(0, previous - damage.amount());
        target.setCurrentHealth(current);
        log.debug("Seat {} takes {} damage ({}): {} -> {}", target.getSeat(), damage.amount(), damage.reason(),
                previous, current);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("source", damage.sourceSeat());
        data.put("target", target.getSeat());
        data.put("amount", damage.amount());
        data.put("type", damage.type().name());
        data.put("reason", damage.reason());
        data.put("previous_health", previous);
        data.put("current_health", current);
        context.log(LogEntry.info("DamageApplied", "Damage applied", data));

        context.publish(new DamageAppliedEvent(game, damage, previous, current, context));

        if (current == 0 && target.isAlive()) {
            if (damage.triggersDying()) {
                context.getStack().push(new DyingResolver(), context.withActingPlayer(target));
            } else {
                killPlayer(context, target, damage.sourceSeat());
            }
        }
        return ResolutionResult.SUCCESS;
    }

    static void killPlayer(ResolutionContext context, Player player, Integer killerSeat) {
        player.setAlive(false);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seat", player.getSeat());
        data.put("killer", killerSeat);
        context.log(LogEntry.info("PlayerDied", "Player died", data));
        context.publish(new PlayerDiedEvent(context.getGame(), player.getSeat(), killerSeat));
    }
}
