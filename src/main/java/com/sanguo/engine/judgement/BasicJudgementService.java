package com.sanguo.engine.judgement;

import com.sanguo.engine.events.EventBus;
import com.sanguo.engine.events.JudgementCompletedEvent;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.zones.CardMoveDescriptor;
import com.sanguo.engine.zones.CardMoveOrdering;
import com.sanguo.engine.zones.CardMoveReason;
import com.sanguo.engine.zones.CardMoveService;
import com.sanguo.engine.zones.DeckExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BasicJudgementService implements JudgementService {
    private static final Logger log = LoggerFactory.getLogger(BasicJudgementService.class);

    private final EventBus eventBus;

    /**
     * @param eventBus may be null; completion events are then not published
     */
    public BasicJudgementService(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public JudgementResult execute(Game game, Player owner, JudgementRequest request, CardMoveService moveService)
            throws DeckExhaustedException {
        moveService.ensureDrawable(game, 1);
        Card card = game.getDrawPile().peekTop()
                .orElseThrow(() -> new DeckExhaustedException("No card left to judge"));

        moveService.move(CardMoveDescriptor.of(game, game.getDrawPile(), owner.getJudgementZone(), card,
                CardMoveReason.JUDGEMENT, CardMoveOrdering.TO_TOP));

        boolean success = request.rule().isSuccess(card);
        JudgementResult result = new JudgementResult(owner.getSeat(), request, card, success);
        log.debug("Judgement for seat {} ({}): {} -> {}", owner.getSeat(), request.rule().describe(), card,
                success ? "success" : "failure");

        if (eventBus != null) {
            eventBus.publish(new JudgementCompletedEvent(game, result));
        }

        // A completion handler may already have taken the card
        if (owner.getJudgementZone().contains(card)) {
            moveService.move(CardMoveDescriptor.of(game, owner.getJudgementZone(), game.getDiscardPile(), card,
                    CardMoveReason.DISCARD, CardMoveOrdering.TO_TOP));
        }
        return result;
    }
}
