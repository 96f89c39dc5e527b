package com.sanguo.engine.rules;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

/**
 * @param sourceEvent what is being responded to; may be null
 */
public record ResponseContext(Game game, Player responder, ResponseType responseType, Object sourceEvent) {
}
