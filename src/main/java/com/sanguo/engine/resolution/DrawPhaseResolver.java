package com.sanguo.engine.resolution;

import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.zones.DeckExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Draws the player's draw-phase cards, ability bonuses included.
 */
public class DrawPhaseResolver implements Resolver {
    private static final Logger log = LoggerFactory.getLogger(DrawPhaseResolver.class);

    public static final String KIND = "draw-phase";

    private final int seat;

    public DrawPhaseResolver(int seat) {
        this.seat = seat;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        Player player = context.getGame().getPlayer(seat);
        if (!player.isAlive()) {
            return ResolutionResult.failure(ResolutionErrorCode.TARGET_NOT_ALIVE, "resolution.draw.playerNotAlive");
        }
        int count = context.getRuleService().drawCount(context.getGame(), player);

        List<Card> drawn;
        try {
            drawn = context.getCardMoveService().drawCards(context.getGame(), player, count);
        } catch (DeckExhaustedException e) {
            log.warn("Seat {} could not draw {} cards: {}", seat, count, e.getMessage());
            context.log(LogEntry.warning("DeckExhausted", e.getMessage(), Map.of("seat", seat, "count", count)));
            return ResolutionResult.failure(ResolutionErrorCode.INVALID_STATE, "resolution.draw.deckExhausted");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seat", seat);
        data.put("count", drawn.size());
        context.log(LogEntry.info("CardsDrawn", "Draw phase cards drawn", data));
        return ResolutionResult.SUCCESS;
    }
}
