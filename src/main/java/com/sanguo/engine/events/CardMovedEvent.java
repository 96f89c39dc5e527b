package com.sanguo.engine.events;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.zones.CardMoveOrdering;
import com.sanguo.engine.zones.CardMoveReason;
import com.sanguo.engine.zones.CardMoveTiming;

import java.util.List;

/**
 * Snapshot of a card move, published once before and once after the move.
 */
public record CardMovedEvent(
    Game game,
    String sourceZoneId,
    Integer sourceOwnerSeat,
    String targetZoneId,
    Integer targetOwnerSeat,
    List<Integer> cardIds,
    CardMoveReason reason,
    CardMoveOrdering ordering,
    CardMoveTiming timing
) implements GameEvent {
}
