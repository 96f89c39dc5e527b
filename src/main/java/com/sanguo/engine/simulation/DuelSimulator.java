package com.sanguo.engine.simulation;

import com.sanguo.engine.abilities.AbilityRegistry;
import com.sanguo.engine.card.CardCatalog;
import com.sanguo.engine.card.CardCatalogException;
import com.sanguo.engine.choice.ChoiceResult;
import com.sanguo.engine.config.EngineConfig;
import com.sanguo.engine.game.ActionOutcome;
import com.sanguo.engine.game.GameEngine;
import com.sanguo.engine.game.GameSetup;
import com.sanguo.engine.game.HeroCatalog;
import com.sanguo.engine.game.PlayerSpec;
import com.sanguo.engine.logging.JsonLinesLogSink;
import com.sanguo.engine.logging.LogSink;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Phase;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.rules.ActionDescriptor;
import com.sanguo.engine.rules.ActionIds;
import com.sanguo.engine.zones.DeckExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Plays complete games between automatic players on the real engine.
 */
public final class DuelSimulator {
    private static final Logger log = LoggerFactory.getLogger(DuelSimulator.class);

    public static final int MAX_TURNS = 200;
    // Guards against a play phase that never ends
    private static final int MAX_ACTIONS_PER_PHASE = 50;

    private DuelSimulator() {
        // Utility class - prevent instantiation
    }

    /**
     * Play one seeded game to completion or to the turn limit.
     *
     * @param verbose print the structured game log to stdout
     */
    public static DuelResult runGame(List<PlayerSpec> specs, HeroCatalog heroes, CardCatalog catalog,
                                     EngineConfig config, long seed, boolean verbose) throws CardCatalogException {
        Game game = GameSetup.createGame(specs, heroes, catalog, seed);
        LogSink sink = verbose ? new JsonLinesLogSink(new PrintWriter(System.out)) : null;
        GameEngine engine = new GameEngine(game, config, AbilityRegistry.standard(),
                new AutoPilotChoiceProvider(game), sink);

        if (verbose) {
            System.out.println("=== Game Start (seed: " + seed + ") ===");
            for (Player player : game.getPlayers()) {
                System.out.println("  Seat " + player.getSeat() + ": " + player.getHeroId()
                        + (player.isLord() ? " (lord)" : ""));
            }
        }

        int turns = 0;
        try {
            engine.start(heroes);
            while (turns < MAX_TURNS && !engine.isOver()) {
                turns++;
                if (!playTurn(engine, game.getCurrentSeat())) {
                    break;
                }
            }
        } catch (DeckExhaustedException e) {
            log.debug("Game {} ended early: {}", seed, e.getMessage());
        } finally {
            engine.shutdown();
        }

        List<Integer> survivors = game.getAlivePlayers().stream().map(Player::getSeat).toList();
        Player winner = survivors.size() == 1 ? game.getPlayer(survivors.get(0)) : null;
        return new DuelResult(seed, winner != null ? winner.getSeat() : null,
                winner != null ? winner.getHeroId() : null, turns, survivors);
    }

    /**
     * @return false when the game cannot continue
     */
    static boolean playTurn(GameEngine engine, int seat) {
        Game game = engine.getGame();
        engine.startTurn(seat);
        engine.enterPhase(Phase.JUDGE);

        engine.enterPhase(Phase.DRAW);
        ActionOutcome draw = engine.runDrawPhase(seat);
        if (!draw.isSuccess()) {
            return false;
        }

        engine.enterPhase(Phase.PLAY);
        playPhase(engine, seat);

        Player player = game.getPlayer(seat);
        if (player.isAlive()) {
            engine.enterPhase(Phase.DISCARD);
            discardExcess(engine, player);
        }
        engine.endTurn();
        return true;
    }

    static void playPhase(GameEngine engine, int seat) {
        Game game = engine.getGame();
        Player player = game.getPlayer(seat);
        for (int i = 0; i < MAX_ACTIONS_PER_PHASE && player.isAlive() && !engine.isOver(); i++) {
            Optional<ChoiceResult> choice = pickAction(engine, player);
            if (choice.isEmpty()) {
                return;
            }
            engine.useCard(choice.get());
        }
    }

    /**
     * Equipment first, then a peach when hurt, then an area attack, then a
     * slash at the weakest target in range.
     */
    static Optional<ChoiceResult> pickAction(GameEngine engine, Player player) {
        List<ActionDescriptor> actions = engine.availableActions(player.getSeat());
        for (String preferred : List.of(ActionIds.USE_EQUIPMENT, ActionIds.USE_PEACH,
                ActionIds.USE_BARBARIAN_INVASION, ActionIds.USE_ARROW_VOLLEY, ActionIds.USE_SLASH)) {
            for (ActionDescriptor action : actions) {
                if (!action.actionId().equals(preferred) || action.cardCandidates().isEmpty()) {
                    continue;
                }
                Card card = action.cardCandidates().get(0);
                if (!action.requiresTargets()) {
                    return Optional.of(ChoiceResult.action(player.getSeat(), card.id()));
                }
                Game game = engine.getGame();
                Optional<Integer> target = action.targetConstraints().allowedSeats().stream()
                        .min(Comparator.comparingInt((Integer s) -> game.getPlayer(s).getCurrentHealth())
                                .thenComparingInt(s -> s));
                if (target.isPresent()) {
                    return Optional.of(ChoiceResult.action(player.getSeat(), card.id(), target.get()));
                }
            }
        }
        return Optional.empty();
    }

    static void discardExcess(GameEngine engine, Player player) {
        int excess = player.getHand().size() - player.getCurrentHealth();
        if (excess <= 0) {
            return;
        }
        List<Card> hand = player.getHand().getCards();
        List<Card> discard = hand.subList(hand.size() - excess, hand.size());
        engine.getCardMoveService().discardFromHand(engine.getGame(), player, discard);
    }
}
