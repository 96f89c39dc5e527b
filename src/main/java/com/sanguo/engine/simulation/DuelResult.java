package com.sanguo.engine.simulation;

import java.util.List;

/**
 * Result of a single simulated game.
 */
public record DuelResult(
    /**
     * Seed the game was played with.
     */
    long seed,

    /**
     * Seat of the last player standing (null if nobody won by the turn limit).
     */
    Integer winnerSeat,

    /**
     * Hero of the winner (null without a winner).
     */
    String winnerHero,

    /**
     * Number of turns played.
     */
    int turns,

    /**
     * Seats still alive when the game ended.
     */
    List<Integer> survivors
) {
    public DuelResult {
        survivors = List.copyOf(survivors);
    }

    /**
     * Check if the game produced a winner.
     */
    public boolean hasWinner() {
        return winnerSeat != null;
    }
}
