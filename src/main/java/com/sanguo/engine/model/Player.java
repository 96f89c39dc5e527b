package com.sanguo.engine.model;

import com.sanguo.engine.zones.Zone;
import com.sanguo.engine.zones.ZoneIds;

import java.util.HashMap;
import java.util.Map;

/**
 * A seated player: health, liveness and personal zones.
 */
public class Player {
    public static final String FLAG_LORD = "lord";

    private final int seat;
    private final String heroId;
    private final String factionId;
    private final int maxHealth;
    private int currentHealth;
    private boolean alive;

    private final Zone hand;
    private final Zone equipment;
    private final Zone judgement;
    private final Map<String, Object> flags;

    public Player(int seat, String heroId, String factionId, int maxHealth) {
        this(seat, heroId, factionId, maxHealth, maxHealth);
    }

    public Player(int seat, String heroId, String factionId, int maxHealth, int currentHealth) {
        if (maxHealth <= 0) {
            throw new IllegalArgumentException("Max health must be positive, got " + maxHealth);
        }
        this.seat = seat;
        this.heroId = heroId;
        this.factionId = factionId;
        this.maxHealth = maxHealth;
        this.currentHealth = currentHealth;
        this.alive = true;
        this.hand = new Zone(ZoneIds.hand(seat), seat, false);
        this.equipment = new Zone(ZoneIds.equipment(seat), seat, true);
        this.judgement = new Zone(ZoneIds.judgement(seat), seat, true);
        this.flags = new HashMap<>();
    }

    public int getSeat() {
        return seat;
    }

    public String getHeroId() {
        return heroId;
    }

    public String getFactionId() {
        return factionId;
    }

    public int getMaxHealth() {
        return maxHealth;
    }

    public int getCurrentHealth() {
        return currentHealth;
    }

    public void setCurrentHealth(int currentHealth) {
        this.currentHealth = currentHealth;
    }

    public boolean isAlive() {
        return alive;
    }

    public void setAlive(boolean alive) {
        this.alive = alive;
    }

    public boolean isInjured() {
        return currentHealth < maxHealth;
    }

    // ---- Zone accessors ----

    public Zone getHand() {
        return hand;
    }

    public Zone getEquipment() {
        return equipment;
    }

    public Zone getJudgementZone() {
        return judgement;
    }

    // ---- Flags ----

    public void setFlag(String name, Object value) {
        flags.put(name, value);
    }

    public boolean hasFlag(String name) {
        return Boolean.TRUE.equals(flags.get(name));
    }

    public boolean isLord() {
        return hasFlag(FLAG_LORD);
    }

    @Override
    public String toString() {
        return "Player[seat=" + seat + ", hero=" + heroId + ", hp=" + currentHealth + "/" + maxHealth
                + (alive ? "" : ", dead") + "]";
    }
}
