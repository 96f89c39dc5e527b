package com.sanguo.engine.response;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.resolution.AttackSource;
import com.sanguo.engine.rules.ResponseType;

import java.util.ArrayList;
import java.util.List;

/**
 * Factories for the standard response windows.
 */
public final class ResponseWindows {

    private ResponseWindows() {
        // Utility class - prevent instantiation
    }

    /**
     * Window in which the defender may dodge a slash.
     */
    public static ResponseWindowResolver jink(AttackSource source, int requiredCount) {
        return new ResponseWindowResolver(ResponseType.JINK_AGAINST_SLASH, List.of(source.defenderSeat()),
                source, requiredCount);
    }

    /**
     * Window in which one target of an area attack may answer it.
     */
    public static ResponseWindowResolver areaAttack(ResponseType type, int targetSeat, Object source) {
        return new ResponseWindowResolver(type, List.of(targetSeat), source, 1);
    }

    /**
     * Window in which anyone may save a dying player: the dying player
     * first, then everyone else alive in seat order.
     */
    public static ResponseWindowResolver peach(Game game, int dyingSeat, Object source) {
        return new ResponseWindowResolver(ResponseType.PEACH_FOR_DYING, rescuers(game, dyingSeat), source, 1);
    }

    static List<Integer> rescuers(Game game, int dyingSeat) {
        List<Integer> seats = new ArrayList<>();
        seats.add(dyingSeat);
        for (Player player : game.getAlivePlayers()) {
            if (player.getSeat() != dyingSeat) {
                seats.add(player.getSeat());
            }
        }
        return seats;
    }
}
