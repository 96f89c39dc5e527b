package com.sanguo.engine.events;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.resolution.DamageDescriptor;

/**
 * Published before damage is applied. Handlers may prevent it; prevention
 * only takes effect for preventable damage.
 */
public final class BeforeDamageEvent implements GameEvent {
    private final Game game;
    private final DamageDescriptor damage;
    private String preventedBy;

    public BeforeDamageEvent(Game game, DamageDescriptor damage) {
        this.game = game;
        this.damage = damage;
    }

    @Override
    public Game game() {
        return game;
    }

    public DamageDescriptor damage() {
        return damage;
    }

    /**
     * Mark the damage as prevented.
     * @param sourceId id of the ability or effect preventing it
     */
    public void prevent(String sourceId) {
        this.preventedBy = sourceId;
    }

    public boolean isPrevented() {
        return preventedBy != null;
    }

    public String getPreventedBy() {
        return preventedBy;
    }
}
