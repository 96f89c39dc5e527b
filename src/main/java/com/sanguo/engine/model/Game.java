package com.sanguo.engine.model;

import com.sanguo.engine.rng.GameRng;
import com.sanguo.engine.zones.Zone;
import com.sanguo.engine.zones.ZoneIds;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Complete game state shared by every resolver of an action chain.
 */
public class Game {
    private final List<Player> players;
    private final Zone drawPile;
    private final Zone discardPile;
    private final GameRng rng;

    private int currentSeat;
    private Phase phase;
    private int turnNumber;
    private boolean finished;
    private int windowSequence;

    // Per-turn card usage, keyed by seat
    private final Map<Integer, Map<CardSubType, Integer>> usageThisTurn;

    public Game(List<Player> players, GameRng rng) {
        if (players.isEmpty()) {
            throw new IllegalArgumentException("A game needs at least one player");
        }
        List<Player> ordered = new ArrayList<>(players);
        ordered.sort(Comparator.comparingInt(Player::getSeat));
        this.players = List.copyOf(ordered);
        this.rng = rng;
        this.drawPile = new Zone(ZoneIds.DRAW_PILE, null, false);
        this.discardPile = new Zone(ZoneIds.DISCARD_PILE, null, true);
        this.currentSeat = this.players.get(0).getSeat();
        this.phase = Phase.NONE;
        this.turnNumber = 1;
        this.usageThisTurn = new HashMap<>();
    }

    // ==================== PLAYERS ====================

    /**
     * All players in seat order, dead ones included.
     */
    public List<Player> getPlayers() {
        return players;
    }

    public Optional<Player> findPlayer(int seat) {
        return players.stream().filter(p -> p.getSeat() == seat).findFirst();
    }

    /**
     * Get a player by seat.
     * @throws IllegalArgumentException if no player sits there
     */
    public Player getPlayer(int seat) {
        return findPlayer(seat)
                .orElseThrow(() -> new IllegalArgumentException("No player at seat " + seat));
    }

    public List<Player> getAlivePlayers() {
        return players.stream().filter(Player::isAlive).toList();
    }

    public Player getCurrentPlayer() {
        return getPlayer(currentSeat);
    }

    /**
     * Seat of the next living player after the given seat, wrapping around.
     */
    public int nextAliveSeat(int seat) {
        int index = players.indexOf(getPlayer(seat));
        for (int step = 1; step <= players.size(); step++) {
            Player candidate = players.get((index + step) % players.size());
            if (candidate.isAlive()) {
                return candidate.getSeat();
            }
        }
        return seat;
    }

    // ==================== PILES ====================

    public Zone getDrawPile() {
        return drawPile;
    }

    public Zone getDiscardPile() {
        return discardPile;
    }

    public GameRng getRng() {
        return rng;
    }

    // ==================== TURN STATE ====================

    public int getCurrentSeat() {
        return currentSeat;
    }

    public void setCurrentSeat(int currentSeat) {
        this.currentSeat = currentSeat;
    }

    public Phase getPhase() {
        return phase;
    }

    public void setPhase(Phase phase) {
        this.phase = phase;
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    public void incrementTurn() {
        turnNumber++;
    }

    public boolean isFinished() {
        return finished;
    }

    public void setFinished(boolean finished) {
        this.finished = finished;
    }

    /**
     * Next response window number, counted from 1 within this game.
     */
    public int nextWindowSequence() {
        return ++windowSequence;
    }

    // ==================== USAGE COUNTERS ====================

    /**
     * How many cards of a kind the player has used this turn.
     */
    public int getUsageThisTurn(int seat, CardSubType subType) {
        return usageThisTurn.getOrDefault(seat, Map.of()).getOrDefault(subType, 0);
    }

    public void recordUsage(int seat, CardSubType subType) {
        usageThisTurn.computeIfAbsent(seat, s -> new EnumMap<>(CardSubType.class))
                .merge(subType, 1, Integer::sum);
    }

    /**
     * Reset per-turn counters at the start of a turn.
     */
    public void resetTurnUsage() {
        usageThisTurn.clear();
    }
}
