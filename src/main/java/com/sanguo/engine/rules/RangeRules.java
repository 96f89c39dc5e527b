package com.sanguo.engine.rules;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.List;

/**
 * Raw seat distance over the ring of living players.
 */
public final class RangeRules {

    private RangeRules() {
        // Utility class - prevent instantiation
    }

    /**
     * The shorter of the clockwise and counter-clockwise walks between two
     * players, counting living players only. Zero for the same player.
     */
    public static int baseSeatDistance(Game game, Player from, Player to) {
        if (from.getSeat() == to.getSeat()) {
            return 0;
        }
        List<Player> ring = game.getPlayers().stream()
                .filter(p -> p.isAlive() || p == from || p == to)
                .toList();
        int a = ring.indexOf(from);
        int b = ring.indexOf(to);
        int clockwise = Math.floorMod(b - a, ring.size());
        return Math.min(clockwise, ring.size() - clockwise);
    }
}
