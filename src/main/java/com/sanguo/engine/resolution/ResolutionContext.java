package com.sanguo.engine.resolution;

import com.sanguo.engine.abilities.AbilityManager;
import com.sanguo.engine.abilities.AbilityQueryService;
import com.sanguo.engine.choice.ChoiceProvider;
import com.sanguo.engine.choice.ChoiceRequestFactory;
import com.sanguo.engine.choice.ChoiceResult;
import com.sanguo.engine.config.EngineConfig;
import com.sanguo.engine.events.EventBus;
import com.sanguo.engine.events.GameEvent;
import com.sanguo.engine.judgement.JudgementService;
import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.logging.LogSink;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.rules.ActionDescriptor;
import com.sanguo.engine.rules.RuleService;
import com.sanguo.engine.zones.CardMoveService;

import java.util.List;
import java.util.Objects;

/**
 * Everything a resolver sees. Immutable; derived contexts made with the
 * {@code with*} methods share the stack, services and scratch pad of the
 * context they were derived from.
 */
public final class ResolutionContext {
    private final Game game;
    private final Player actingPlayer;
    private final ActionDescriptor action;
    private final ChoiceResult choice;
    private final ResolutionStack stack;
    private final CardMoveService cardMoveService;
    private final RuleService ruleService;
    private final DamageDescriptor pendingDamage;
    private final LogSink logSink;
    private final ChoiceProvider choiceProvider;
    private final ChoiceRequestFactory choiceRequestFactory;
    private final ScratchPad scratchPad;
    private final EventBus eventBus;
    private final AbilityQueryService abilities;
    private final AbilityManager abilityManager;
    private final JudgementService judgementService;

    private ResolutionContext(Builder b) {
        this.game = Objects.requireNonNull(b.game, "game");
        this.actingPlayer = Objects.requireNonNull(b.actingPlayer, "actingPlayer");
        this.stack = Objects.requireNonNull(b.stack, "stack");
        this.cardMoveService = Objects.requireNonNull(b.cardMoveService, "cardMoveService");
        this.ruleService = Objects.requireNonNull(b.ruleService, "ruleService");
        this.action = b.action;
        this.choice = b.choice;
        this.pendingDamage = b.pendingDamage;
        this.logSink = b.logSink;
        this.choiceProvider = b.choiceProvider;
        this.choiceRequestFactory = b.choiceRequestFactory != null ? b.choiceRequestFactory : new ChoiceRequestFactory();
        this.scratchPad = b.scratchPad;
        this.eventBus = b.eventBus;
        this.abilityManager = b.abilityManager;
        this.abilities = b.abilities != null ? b.abilities : b.abilityManager;
        this.judgementService = b.judgementService;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder pre-filled with this context's values.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.game = game;
        b.actingPlayer = actingPlayer;
        b.action = action;
        b.choice = choice;
        b.stack = stack;
        b.cardMoveService = cardMoveService;
        b.ruleService = ruleService;
        b.pendingDamage = pendingDamage;
        b.logSink = logSink;
        b.choiceProvider = choiceProvider;
        b.choiceRequestFactory = choiceRequestFactory;
        b.scratchPad = scratchPad;
        b.eventBus = eventBus;
        b.abilities = abilities;
        b.abilityManager = abilityManager;
        b.judgementService = judgementService;
        return b;
    }

    // ==================== DERIVED CONTEXTS ====================

    public ResolutionContext withActingPlayer(Player player) {
        return toBuilder().actingPlayer(player).build();
    }

    public ResolutionContext withAction(ActionDescriptor action, ChoiceResult choice) {
        return toBuilder().action(action).choice(choice).build();
    }

    public ResolutionContext withPendingDamage(DamageDescriptor damage) {
        return toBuilder().pendingDamage(damage).build();
    }

    // ==================== ACCESSORS ====================

    public Game getGame() {
        return game;
    }

    public Player getActingPlayer() {
        return actingPlayer;
    }

    /**
     * The action being resolved, or null.
     */
    public ActionDescriptor getAction() {
        return action;
    }

    /**
     * The choice made for the action, or null.
     */
    public ChoiceResult getChoice() {
        return choice;
    }

    public ResolutionStack getStack() {
        return stack;
    }

    public CardMoveService getCardMoveService() {
        return cardMoveService;
    }

    public RuleService getRuleService() {
        return ruleService;
    }

    public EngineConfig getConfig() {
        return ruleService.getConfig();
    }

    public DamageDescriptor getPendingDamage() {
        return pendingDamage;
    }

    public LogSink getLogSink() {
        return logSink;
    }

    public ChoiceProvider getChoiceProvider() {
        return choiceProvider;
    }

    public ChoiceRequestFactory getChoiceRequestFactory() {
        return choiceRequestFactory;
    }

    public ScratchPad getScratchPad() {
        return scratchPad;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public AbilityQueryService getAbilities() {
        return abilities;
    }

    public AbilityManager getAbilityManager() {
        return abilityManager;
    }

    public JudgementService getJudgementService() {
        return judgementService;
    }

    // ==================== HELPERS ====================

    /**
     * The scratch pad, for resolvers that hand results to later resolvers.
     * @throws IllegalStateException if the context has none
     */
    public ScratchPad requireScratchPad() {
        if (scratchPad == null) {
            throw new IllegalStateException("This resolution step needs a scratch pad");
        }
        return scratchPad;
    }

    public void log(LogEntry entry) {
        if (logSink != null) {
            logSink.log(entry);
        }
    }

    public void publish(GameEvent event) {
        if (eventBus != null) {
            eventBus.publish(event);
        }
    }

    /**
     * Active abilities of a player implementing the given interface; empty
     * when no ability service is wired.
     */
    public <T> List<T> abilitiesOf(Player player, Class<T> kind) {
        if (abilities == null) {
            return List.of();
        }
        return abilities.activeAbilities(game, player, kind);
    }

    // ==================== BUILDER ====================

    public static final class Builder {
        private Game game;
        private Player actingPlayer;
        private ActionDescriptor action;
        private ChoiceResult choice;
        private ResolutionStack stack;
        private CardMoveService cardMoveService;
        private RuleService ruleService;
        private DamageDescriptor pendingDamage;
        private LogSink logSink;
        private ChoiceProvider choiceProvider;
        private ChoiceRequestFactory choiceRequestFactory;
        private ScratchPad scratchPad;
        private EventBus eventBus;
        private AbilityQueryService abilities;
        private AbilityManager abilityManager;
        private JudgementService judgementService;

        private Builder() {
        }

        public Builder game(Game game) {
            this.game = game;
            return this;
        }

        public Builder actingPlayer(Player actingPlayer) {
            this.actingPlayer = actingPlayer;
            return this;
        }

        public Builder action(ActionDescriptor action) {
            this.action = action;
            return this;
        }

        public Builder choice(ChoiceResult choice) {
            this.choice = choice;
            return this;
        }

        public Builder stack(ResolutionStack stack) {
            this.stack = stack;
            return this;
        }

        public Builder cardMoveService(CardMoveService cardMoveService) {
            this.cardMoveService = cardMoveService;
            return this;
        }

        public Builder ruleService(RuleService ruleService) {
            this.ruleService = ruleService;
            return this;
        }

        public Builder pendingDamage(DamageDescriptor pendingDamage) {
            this.pendingDamage = pendingDamage;
            return this;
        }

        public Builder logSink(LogSink logSink) {
            this.logSink = logSink;
            return this;
        }

        public Builder choiceProvider(ChoiceProvider choiceProvider) {
            this.choiceProvider = choiceProvider;
            return this;
        }

        public Builder choiceRequestFactory(ChoiceRequestFactory choiceRequestFactory) {
            this.choiceRequestFactory = choiceRequestFactory;
            return this;
        }

        public Builder scratchPad(ScratchPad scratchPad) {
            this.scratchPad = scratchPad;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder abilities(AbilityQueryService abilities) {
            this.abilities = abilities;
            return this;
        }

        /**
         * Also serves as the ability-query service unless one is set explicitly.
         */
        public Builder abilityManager(AbilityManager abilityManager) {
            this.abilityManager = abilityManager;
            return this;
        }

        public Builder judgementService(JudgementService judgementService) {
            this.judgementService = judgementService;
            return this;
        }

        public ResolutionContext build() {
            return new ResolutionContext(this);
        }
    }
}
