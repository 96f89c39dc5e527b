package com.sanguo.engine.events;

import com.sanguo.engine.model.Game;

/**
 * Marker for everything published on the {@link EventBus}.
 */
public interface GameEvent {
    Game game();
}
