package com.sanguo.engine.response;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.sanguo.engine.Fixtures;
import com.sanguo.engine.choice.ChoiceProvider;
import com.sanguo.engine.choice.ChoiceRequest;
import com.sanguo.engine.choice.ChoiceResult;
import com.sanguo.engine.config.EngineConfig;
import com.sanguo.engine.events.CardPlayedEvent;
import com.sanguo.engine.events.SynchronousEventBus;
import com.sanguo.engine.logging.InMemoryLogSink;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.rules.BasicRuleService;
import com.sanguo.engine.rules.ResponseType;
import com.sanguo.engine.zones.BasicCardMoveService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BasicResponseWindowTest {

    private Game game;
    private SynchronousEventBus bus;
    private InMemoryLogSink sink;
    private ListAppender<ILoggingEvent> appender;
    private Logger windowLogger;
    private List<ChoiceRequest> requests;

    @BeforeEach
    void setUp() {
        game = Fixtures.game(3);
        bus = new SynchronousEventBus();
        sink = new InMemoryLogSink();
        requests = new ArrayList<>();

        windowLogger = (Logger) LoggerFactory.getLogger(BasicResponseWindow.class);
        appender = new ListAppender<>();
        appender.start();
        windowLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        windowLogger.detachAppender(appender);
    }

    private BasicResponseWindow window(ResponseType type, List<Integer> seats, int required, ChoiceProvider provider) {
        ChoiceProvider recording = provider == null ? null : request -> {
            requests.add(request);
            return provider.choose(request);
        };
        return new BasicResponseWindow(new ResponseWindowContext(game, type, seats, null, required,
                new BasicRuleService(EngineConfig.defaults()), new BasicCardMoveService(bus),
                recording, null, bus, sink));
    }

    @Test
    void testPassGivesNoResponse() {
        game.getPlayer(1).getHand().add(Fixtures.dodge(1));

        BasicResponseWindow window = window(ResponseType.JINK_AGAINST_SLASH, List.of(1), 1, ChoiceResult::pass);
        ResponseWindowResult result = window.execute();

        assertEquals(ResponseOutcome.NO_RESPONSE, result.outcome());
        assertNull(result.responderSeat());
        assertEquals(1, game.getPlayer(1).getHand().size(), "Passing keeps the card");
        assertEquals(ResponseWindowState.CLOSED, window.getState());
    }

    @Test
    void testSuccessfulResponseDiscardsCard() {
        Card dodge = Fixtures.dodge(1);
        game.getPlayer(1).getHand().add(dodge);
        List<CardPlayedEvent> played = new ArrayList<>();
        bus.subscribe(CardPlayedEvent.class, played::add);

        ResponseWindowResult result = window(ResponseType.JINK_AGAINST_SLASH, List.of(1), 1,
                request -> ChoiceResult.cards(request, 1)).execute();

        assertTrue(result.isSuccess());
        assertEquals(1, result.responderSeat());
        assertEquals(List.of(dodge), result.playedCards());
        assertTrue(game.getPlayer(1).getHand().isEmpty());
        assertEquals(dodge, game.getDiscardPile().peekTop().orElseThrow(), "Played card lands on top of the discard pile");
        assertEquals(1, played.size());
        assertEquals(ResponseType.JINK_AGAINST_SLASH, played.get(0).responseType());
    }

    @Test
    void testRequestOffersOnlyLegalCards() {
        Card dodge = Fixtures.dodge(1);
        game.getPlayer(1).getHand().add(dodge);
        game.getPlayer(1).getHand().add(Fixtures.slash(2));

        BasicResponseWindow window = window(ResponseType.JINK_AGAINST_SLASH, List.of(1), 1, ChoiceResult::pass);
        window.execute();

        assertEquals(1, requests.size());
        assertEquals(List.of(dodge), requests.get(0).allowedCards());
        assertEquals(window.getWindowId(), requests.get(0).responseWindowId());
    }

    @Test
    void testWindowIdsAreNumberedPerGame() {
        BasicResponseWindow first = window(ResponseType.JINK_AGAINST_SLASH, List.of(1), 1, null);
        BasicResponseWindow second = window(ResponseType.JINK_AGAINST_SLASH, List.of(1), 1, null);

        Game otherGame = Fixtures.game(2);
        BasicResponseWindow other = new BasicResponseWindow(new ResponseWindowContext(otherGame,
                ResponseType.JINK_AGAINST_SLASH, List.of(1), null, 1,
                new BasicRuleService(EngineConfig.defaults()), new BasicCardMoveService(), null, null, null, null));

        assertEquals("window-1", first.getWindowId());
        assertEquals("window-2", second.getWindowId());
        assertEquals("window-1", other.getWindowId(), "Another game starts its own count");
    }

    @Test
    void testIllegalCardIsTreatedAsPass() {
        game.getPlayer(1).getHand().add(Fixtures.dodge(1));
        game.getPlayer(1).getHand().add(Fixtures.slash(2));

        ResponseWindowResult result = window(ResponseType.JINK_AGAINST_SLASH, List.of(1), 1,
                request -> ChoiceResult.cards(request, 2)).execute();

        assertEquals(ResponseOutcome.NO_RESPONSE, result.outcome());
        assertEquals(2, game.getPlayer(1).getHand().size(), "Nothing is moved for an illegal choice");
        assertEquals(1, sink.ofType("ResponseInvalid").size());
        assertEquals(2, sink.ofType("ResponseInvalid").get(0).data().get("card_id"));
        assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN),
                "An illegal choice is logged as a warning");
    }

    @Test
    void testRespondersWithoutLegalCardsAreNotPrompted() {
        Card peach = Fixtures.peach(1);
        game.getPlayer(2).getHand().add(peach);

        ResponseWindowResult result = window(ResponseType.PEACH_FOR_DYING, List.of(0, 1, 2), 1,
                request -> ChoiceResult.cards(request, 1)).execute();

        assertTrue(result.isSuccess());
        assertEquals(2, result.responderSeat(), "The first responder holding a peach answers");
        assertEquals(1, requests.size(), "Seats without legal cards are skipped");
    }

    @Test
    void testDeadRespondersAreSkipped() {
        game.getPlayer(1).getHand().add(Fixtures.peach(1));
        game.getPlayer(1).setAlive(false);
        game.getPlayer(2).getHand().add(Fixtures.peach(2));

        ResponseWindowResult result = window(ResponseType.PEACH_FOR_DYING, List.of(1, 2), 1,
                request -> ChoiceResult.cards(request, request.allowedCards().get(0).id())).execute();

        assertEquals(2, result.responderSeat());
    }

    @Test
    void testPartialResponseFails() {
        Card dodge = Fixtures.dodge(1);
        game.getPlayer(1).getHand().add(dodge);
        game.getPlayer(2).getHand().add(Fixtures.dodge(2));

        ResponseWindowResult result = window(ResponseType.JINK_AGAINST_SLASH, List.of(1, 2), 2,
                request -> ChoiceResult.cards(request, request.allowedCards().get(0).id())).execute();

        assertEquals(ResponseOutcome.RESPONSE_FAILED, result.outcome());
        assertEquals(1, result.responderSeat());
        assertEquals(List.of(dodge), result.playedCards(), "The partial play is still spent");
        assertEquals(1, game.getPlayer(2).getHand().size(), "Polling stops at a failed responder");
    }

    @Test
    void testTwoCardResponseSucceeds() {
        game.getPlayer(1).getHand().add(Fixtures.dodge(1));
        game.getPlayer(1).getHand().add(Fixtures.dodge(2));

        ResponseWindowResult result = window(ResponseType.JINK_AGAINST_SLASH, List.of(1), 2,
                request -> ChoiceResult.cards(request, request.allowedCards().get(0).id())).execute();

        assertTrue(result.isSuccess());
        assertEquals(2, result.playedCards().size());
        assertEquals(2, requests.size(), "The responder is prompted once per card");
    }

    @Test
    void testNoProviderMeansNoResponse() {
        game.getPlayer(1).getHand().add(Fixtures.dodge(1));

        ResponseWindowResult result = window(ResponseType.JINK_AGAINST_SLASH, List.of(1), 1, null).execute();

        assertEquals(ResponseOutcome.NO_RESPONSE, result.outcome());
    }

    @Test
    void testWindowRunsOnce() {
        BasicResponseWindow window = window(ResponseType.JINK_AGAINST_SLASH, List.of(1), 1, ChoiceResult::pass);
        assertEquals(ResponseWindowState.PENDING, window.getState());

        window.execute();

        assertThrows(IllegalStateException.class, window::execute);
    }

    @Test
    void testRequiredCountMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> window(ResponseType.JINK_AGAINST_SLASH, List.of(1), 0, ChoiceResult::pass));
    }
}
