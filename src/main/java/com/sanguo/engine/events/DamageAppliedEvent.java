package com.sanguo.engine.events;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.resolution.DamageDescriptor;
import com.sanguo.engine.resolution.ResolutionContext;

/**
 * Health has been reduced. The context is that of the damage step, so
 * handlers can push follow-up resolvers onto the same stack.
 */
public record DamageAppliedEvent(
    Game game,
    DamageDescriptor damage,
    int previousHealth,
    int currentHealth,
    ResolutionContext context
) implements GameEvent {
}
