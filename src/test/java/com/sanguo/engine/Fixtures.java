package com.sanguo.engine;

import com.sanguo.engine.abilities.AbilityRegistry;
import com.sanguo.engine.choice.ChoiceProvider;
import com.sanguo.engine.choice.ChoiceResult;
import com.sanguo.engine.config.EngineConfig;
import com.sanguo.engine.game.GameEngine;
import com.sanguo.engine.logging.InMemoryLogSink;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.CardSubType;
import com.sanguo.engine.model.CardType;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Phase;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.model.Suit;
import com.sanguo.engine.resolution.BasicResolutionStack;
import com.sanguo.engine.resolution.ResolutionContext;
import com.sanguo.engine.resolution.ScratchPad;
import com.sanguo.engine.rng.GameRng;
import com.sanguo.engine.rules.BasicRuleService;
import com.sanguo.engine.zones.BasicCardMoveService;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builders for small hand-made games used across the tests.
 */
public final class Fixtures {

    private Fixtures() {
        // Utility class - prevent instantiation
    }

    // ==================== CARDS ====================

    public static Card card(int id, CardSubType subType, Suit suit, int rank) {
        CardType type = subType.isEquipment() ? CardType.EQUIP
                : subType.isAreaAttack() ? CardType.TRICK : CardType.BASIC;
        return new Card(id, subType.getJsonValue(), subType.getJsonValue(), suit, rank, type, subType);
    }

    /** A red slash, which no armor in the catalog stops. */
    public static Card slash(int id) {
        return card(id, CardSubType.SLASH, Suit.DIAMOND, 7);
    }

    public static Card blackSlash(int id) {
        return card(id, CardSubType.SLASH, Suit.SPADE, 7);
    }

    public static Card dodge(int id) {
        return card(id, CardSubType.DODGE, Suit.DIAMOND, 2);
    }

    public static Card peach(int id) {
        return card(id, CardSubType.PEACH, Suit.HEART, 3);
    }

    public static Card arrowVolley(int id) {
        return card(id, CardSubType.ARROW_VOLLEY, Suit.HEART, 1);
    }

    public static Card barbarianInvasion(int id) {
        return card(id, CardSubType.BARBARIAN_INVASION, Suit.SPADE, 7);
    }

    public static Card equipment(int id, String definitionId, CardSubType slot) {
        return new Card(id, definitionId, definitionId, Suit.CLUB, 1, CardType.EQUIP, slot);
    }

    // ==================== GAMES ====================

    /**
     * Players at seats 0..n-1, all in faction "wei" with 4 health.
     */
    public static Game game(int players) {
        List<Player> list = new ArrayList<>();
        for (int seat = 0; seat < players; seat++) {
            list.add(new Player(seat, "hero_" + seat, "wei", 4));
        }
        return new Game(list, new GameRng(42));
    }

    public static Game game(Player... players) {
        return new Game(List.of(players), new GameRng(42));
    }

    /**
     * Put the seat in its play phase.
     */
    public static void playPhaseFor(Game game, int seat) {
        game.setCurrentSeat(seat);
        game.setPhase(Phase.PLAY);
    }

    public static GameEngine engine(Game game, ChoiceProvider provider, InMemoryLogSink sink) {
        return new GameEngine(game, EngineConfig.defaults(), AbilityRegistry.standard(), provider, sink);
    }

    /** Provider that passes on every request. */
    public static ChoiceProvider passing() {
        return ChoiceResult::pass;
    }

    /**
     * Provider under which the given seats play the first card they are
     * offered and everyone else passes.
     */
    public static ChoiceProvider respondingSeats(Integer... seats) {
        Set<Integer> responders = Set.of(seats);
        return request -> {
            if (responders.contains(request.playerSeat())
                    && request.allowedCards() != null && !request.allowedCards().isEmpty()) {
                return ChoiceResult.cards(request, request.allowedCards().get(0).id());
            }
            return ChoiceResult.pass(request);
        };
    }

    /**
     * A bare context with a fresh stack and scratch pad, and no optional
     * services beyond those.
     */
    public static ResolutionContext.Builder context(Game game, int actingSeat) {
        return ResolutionContext.builder()
                .game(game)
                .actingPlayer(game.getPlayer(actingSeat))
                .stack(new BasicResolutionStack())
                .cardMoveService(new BasicCardMoveService())
                .ruleService(new BasicRuleService(EngineConfig.defaults()))
                .scratchPad(new ScratchPad());
    }
}
