package com.sanguo.engine.response;

import com.sanguo.engine.choice.ChoiceProvider;
import com.sanguo.engine.choice.ChoiceRequestFactory;
import com.sanguo.engine.events.EventBus;
import com.sanguo.engine.logging.LogSink;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.resolution.ResolutionContext;
import com.sanguo.engine.rules.ResponseType;
import com.sanguo.engine.rules.RuleService;
import com.sanguo.engine.zones.CardMoveService;

import java.util.List;
import java.util.Objects;

/**
 * Everything one response window needs.
 *
 * @param responderSeats        seats polled, in order
 * @param sourceEvent           what is being responded to, may be null
 * @param requiredResponseCount cards one responder must play to succeed
 * @param choiceProvider        may be null, in which case everyone passes
 */
public record ResponseWindowContext(
    Game game,
    ResponseType responseType,
    List<Integer> responderSeats,
    Object sourceEvent,
    int requiredResponseCount,
    RuleService ruleService,
    CardMoveService cardMoveService,
    ChoiceProvider choiceProvider,
    ChoiceRequestFactory choiceRequestFactory,
    EventBus eventBus,
    LogSink logSink
) {
    public ResponseWindowContext {
        Objects.requireNonNull(game, "game");
        Objects.requireNonNull(responseType, "responseType");
        Objects.requireNonNull(ruleService, "ruleService");
        Objects.requireNonNull(cardMoveService, "cardMoveService");
        if (requiredResponseCount < 1) {
            throw new IllegalArgumentException("Required response count must be positive, got " + requiredResponseCount);
        }
        responderSeats = List.copyOf(responderSeats);
        if (choiceRequestFactory == null) {
            choiceRequestFactory = new ChoiceRequestFactory();
        }
    }

    /**
     * A window context drawing its services from a resolution context.
     */
    public static ResponseWindowContext from(ResolutionContext context, ResponseType responseType,
                                             List<Integer> responderSeats, Object sourceEvent,
                                             int requiredResponseCount) {
        return new ResponseWindowContext(context.getGame(), responseType, responderSeats, sourceEvent,
                requiredResponseCount, context.getRuleService(), context.getCardMoveService(),
                context.getChoiceProvider(), context.getChoiceRequestFactory(), context.getEventBus(),
                context.getLogSink());
    }
}
