package com.sanguo.engine.abilities;

import com.sanguo.engine.events.EventBus;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.Set;

/**
 * A hero- or equipment-granted capability.
 */
public interface Ability {

    String id();

    String name();

    AbilityType type();

    Set<AbilityCapability> capabilities();

    /**
     * Whether the ability currently applies. Inactive abilities are hidden
     * from every query.
     */
    default boolean isActive(Game game, Player owner) {
        return owner.isAlive();
    }

    /**
     * Subscribe to the events this ability reacts to. Called once per
     * instance lifetime.
     */
    void attach(Game game, Player owner, EventBus eventBus);

    /**
     * Release every subscription. Safe without a prior attach and safe to
     * call twice.
     */
    void detach(Game game, Player owner, EventBus eventBus);
}
