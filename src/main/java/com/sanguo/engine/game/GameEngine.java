package com.sanguo.engine.game;

import com.sanguo.engine.abilities.AbilityManager;
import com.sanguo.engine.abilities.AbilityRegistry;
import com.sanguo.engine.card.CardCatalogException;
import com.sanguo.engine.choice.ChoiceProvider;
import com.sanguo.engine.choice.ChoiceRequestFactory;
import com.sanguo.engine.choice.ChoiceResult;
import com.sanguo.engine.config.EngineConfig;
import com.sanguo.engine.events.EventBus;
import com.sanguo.engine.events.PhaseEndEvent;
import com.sanguo.engine.events.PhaseStartEvent;
import com.sanguo.engine.events.SynchronousEventBus;
import com.sanguo.engine.events.TurnEndEvent;
import com.sanguo.engine.events.TurnStartEvent;
import com.sanguo.engine.judgement.BasicJudgementService;
import com.sanguo.engine.judgement.JudgementService;
import com.sanguo.engine.logging.LogSink;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Phase;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.resolution.BasicResolutionStack;
import com.sanguo.engine.resolution.DrawPhaseResolver;
import com.sanguo.engine.resolution.ResolutionContext;
import com.sanguo.engine.resolution.ResolutionErrorCode;
import com.sanguo.engine.resolution.ResolutionResult;
import com.sanguo.engine.resolution.ResolutionStack;
import com.sanguo.engine.resolution.Resolver;
import com.sanguo.engine.resolution.ScratchPad;
import com.sanguo.engine.resolution.UseCardResolver;
import com.sanguo.engine.rules.ActionDescriptor;
import com.sanguo.engine.rules.BasicRuleService;
import com.sanguo.engine.rules.RuleContext;
import com.sanguo.engine.rules.RuleService;
import com.sanguo.engine.zones.BasicCardMoveService;
import com.sanguo.engine.zones.CardMoveService;
import com.sanguo.engine.zones.DeckExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Wires the engine services around one game and runs top-level actions.
 * Every action gets its own stack and scratch pad.
 */
public class GameEngine {
    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private final Game game;
    private final EngineConfig config;
    private final EventBus eventBus;
    private final AbilityManager abilityManager;
    private final RuleService ruleService;
    private final CardMoveService cardMoveService;
    private final JudgementService judgementService;
    private final ChoiceProvider choiceProvider;
    private final ChoiceRequestFactory choiceRequestFactory;
    private final LogSink logSink;

    public GameEngine(Game game, EngineConfig config, AbilityRegistry registry, ChoiceProvider choiceProvider,
                      LogSink logSink) {
        this.game = game;
        this.config = config;
        this.eventBus = new SynchronousEventBus(config.getMaxEventDepth());
        this.abilityManager = new AbilityManager(registry, eventBus);
        this.ruleService = new BasicRuleService(config, abilityManager);
        this.cardMoveService = new BasicCardMoveService(eventBus);
        this.judgementService = new BasicJudgementService(eventBus);
        this.choiceProvider = choiceProvider;
        this.choiceRequestFactory = new ChoiceRequestFactory();
        this.logSink = logSink;
    }

    /**
     * Load each player's hero abilities and deal opening hands.
     */
    public void start(HeroCatalog heroes) throws CardCatalogException, DeckExhaustedException {
        for (Player player : game.getPlayers()) {
            abilityManager.loadHeroAbilities(game, player, heroes.getHero(player.getHeroId()).abilities());
        }
        for (Player player : game.getPlayers()) {
            cardMoveService.drawCards(game, player, config.getInitialHandSize());
        }
        log.debug("Game started with {} players, {} cards left in draw pile", game.getPlayers().size(),
                game.getDrawPile().size());
    }

    // ==================== TURN FLOW ====================

    public void startTurn(int seat) {
        game.setCurrentSeat(seat);
        game.resetTurnUsage();
        eventBus.publish(new TurnStartEvent(game, seat, game.getTurnNumber()));
        enterPhase(Phase.START);
    }

    /**
     * Leave the current phase and enter the next one.
     */
    public void enterPhase(Phase phase) {
        if (game.getPhase() != Phase.NONE) {
            eventBus.publish(new PhaseEndEvent(game, game.getCurrentSeat(), game.getPhase()));
        }
        game.setPhase(phase);
        eventBus.publish(new PhaseStartEvent(game, game.getCurrentSeat(), phase));
    }

    /**
     * End the current player's turn and pass to the next living seat.
     */
    public void endTurn() {
        int seat = game.getCurrentSeat();
        enterPhase(Phase.END);
        eventBus.publish(new TurnEndEvent(game, seat, game.getTurnNumber()));
        game.setPhase(Phase.NONE);
        game.setCurrentSeat(game.nextAliveSeat(seat));
        game.incrementTurn();
    }

    // ==================== ACTIONS ====================

    public List<ActionDescriptor> availableActions(int seat) {
        return ruleService.availableActions(new RuleContext(game, game.getPlayer(seat)));
    }

    /**
     * Use a card from hand as chosen by the player.
     */
    public ActionOutcome useCard(ChoiceResult choice) {
        Player user = game.getPlayer(choice.playerSeat());
        if (!choice.hasCardSelection()) {
            return new ActionOutcome(ResolutionResult.failure(ResolutionErrorCode.CARD_NOT_FOUND,
                    "resolution.useCard.noCardSelected"), List.of());
        }
        int cardId = choice.selectedCardIds().get(0);
        ActionDescriptor action = availableActions(user.getSeat()).stream()
                .filter(a -> a.cardCandidates().stream().anyMatch(c -> c.id() == cardId))
                .findFirst()
                .orElse(null);
        if (action == null) {
            return new ActionOutcome(ResolutionResult.failure(ResolutionErrorCode.RULE_VALIDATION_FAILED,
                    "rules.validate.noSuchAction"), List.of());
        }
        return run(user, action, choice, new UseCardResolver());
    }

    public ActionOutcome runDrawPhase(int seat) {
        return run(game.getPlayer(seat), null, null, new DrawPhaseResolver(seat));
    }

    private ActionOutcome run(Player actor, ActionDescriptor action, ChoiceResult choice, Resolver entry) {
        ResolutionStack stack = new BasicResolutionStack();
        ResolutionContext context = newContext(actor, stack).withAction(action, choice);
        stack.push(entry, context);
        ResolutionResult result = stack.pop();
        stack.drain();
        return new ActionOutcome(result, stack.history());
    }

    /**
     * A fresh context for the actor, with its own stack and scratch pad.
     */
    public ResolutionContext newContext(Player actor, ResolutionStack stack) {
        return ResolutionContext.builder()
                .game(game)
                .actingPlayer(actor)
                .stack(stack)
                .cardMoveService(cardMoveService)
                .ruleService(ruleService)
                .logSink(logSink)
                .choiceProvider(choiceProvider)
                .choiceRequestFactory(choiceRequestFactory)
                .scratchPad(new ScratchPad())
                .eventBus(eventBus)
                .abilityManager(abilityManager)
                .judgementService(judgementService)
                .build();
    }

    // ==================== STATE ====================

    /**
     * Whether at most one player is still alive.
     */
    public boolean isOver() {
        return game.getAlivePlayers().size() <= 1;
    }

    /**
     * Release every ability subscription.
     */
    public void shutdown() {
        abilityManager.detachAll(game);
    }

    public Game getGame() {
        return game;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public AbilityManager getAbilityManager() {
        return abilityManager;
    }

    public RuleService getRuleService() {
        return ruleService;
    }

    public CardMoveService getCardMoveService() {
        return cardMoveService;
    }
}
