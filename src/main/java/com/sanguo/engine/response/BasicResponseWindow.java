package com.sanguo.engine.response;

import com.sanguo.engine.choice.ChoiceRequest;
import com.sanguo.engine.choice.ChoiceResult;
import com.sanguo.engine.events.CardPlayedEvent;
import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.rules.ResponseContext;
import com.sanguo.engine.zones.CardMoveDescriptor;
import com.sanguo.engine.zones.CardMoveOrdering;
import com.sanguo.engine.zones.CardMoveReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default response window. Legal cards are recomputed before every prompt,
 * since earlier plays may change them.
 */
public class BasicResponseWindow implements ResponseWindow {
    private static final Logger log = LoggerFactory.getLogger(BasicResponseWindow.class);

    private final ResponseWindowContext context;
    private final String windowId;
    private ResponseWindowState state = ResponseWindowState.PENDING;

    public BasicResponseWindow(ResponseWindowContext context) {
        this.context = context;
        this.windowId = "window-" + context.game().nextWindowSequence();
    }

    @Override
    public String getWindowId() {
        return windowId;
    }

    @Override
    public ResponseWindowState getState() {
        return state;
    }

    @Override
    public ResponseWindowResult execute() {
        if (state != ResponseWindowState.PENDING) {
            throw new IllegalStateException("Response window " + windowId + " already ran");
        }
        state = ResponseWindowState.POLLING;
        try {
            return poll();
        } finally {
            state = ResponseWindowState.CLOSED;
        }
    }

    private ResponseWindowResult poll() {
        Game game = context.game();
        if (context.choiceProvider() == null) {
            log.debug("Window {} has no choice provider; treating as no response", windowId);
            return ResponseWindowResult.noResponse();
        }

        for (int seat : context.responderSeats()) {
            Player responder = game.findPlayer(seat).orElse(null);
            if (responder == null || !responder.isAlive()) {
                continue;
            }
            List<Card> played = pollResponder(game, responder);
            if (played.size() >= context.requiredResponseCount()) {
                return ResponseWindowResult.success(seat, played);
            }
            if (!played.isEmpty()) {
                return ResponseWindowResult.failed(seat, played);
            }
        }
        return ResponseWindowResult.noResponse();
    }

    private List<Card> pollResponder(Game game, Player responder) {
        List<Card> played = new ArrayList<>();
        ResponseContext responseContext = new ResponseContext(game, responder, context.responseType(),
                context.sourceEvent());

        while (played.size() < context.requiredResponseCount()) {
            List<Card> legal = context.ruleService().legalResponseCards(responseContext);
            if (legal.isEmpty()) {
                break;
            }
            ChoiceRequest request = context.choiceRequestFactory().forResponse(responder.getSeat(), legal, windowId);
            ChoiceResult choice = context.choiceProvider().choose(request);
            if (choice == null || !choice.hasCardSelection()) {
                break;
            }

            int cardId = choice.selectedCardIds().get(0);
            Card card = legal.stream().filter(c -> c.id() == cardId).findFirst().orElse(null);
            if (card == null) {
                log.warn("Seat {} chose card {} which is not a legal response in {}; treating as pass",
                        responder.getSeat(), cardId, windowId);
                logInvalid(responder.getSeat(), cardId);
                break;
            }

            context.cardMoveService().move(CardMoveDescriptor.of(game, responder.getHand(), game.getDiscardPile(),
                    card, CardMoveReason.PLAY, CardMoveOrdering.TO_TOP));
            played.add(card);
            if (context.eventBus() != null) {
                context.eventBus().publish(new CardPlayedEvent(game, responder.getSeat(), card, context.responseType()));
            }
        }
        return played;
    }

    private void logInvalid(int seat, int cardId) {
        if (context.logSink() == null) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("window_id", windowId);
        data.put("seat", seat);
        data.put("card_id", cardId);
        data.put("response_type", context.responseType().name());
        context.logSink().log(LogEntry.warning("ResponseInvalid", "Illegal response card treated as pass", data));
    }
}
