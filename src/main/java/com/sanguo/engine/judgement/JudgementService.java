package com.sanguo.engine.judgement;

import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.zones.CardMoveService;
import com.sanguo.engine.zones.DeckExhaustedException;

/**
 * Reveals the top card of the draw pile and judges it.
 */
public interface JudgementService {

    /**
     * Perform a judgement for the owner. The revealed card ends in the
     * discard pile.
     * @throws DeckExhaustedException if no card can be revealed
     */
    JudgementResult execute(Game game, Player owner, JudgementRequest request, CardMoveService moveService)
            throws DeckExhaustedException;
}
