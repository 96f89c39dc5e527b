package com.sanguo.engine.abilities;

import com.sanguo.engine.events.EventBus;
import com.sanguo.engine.events.GameEvent;
import com.sanguo.engine.events.Subscription;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Common ability plumbing: identity, owner tracking and subscription
 * bookkeeping. Subclasses subscribe in {@link #onAttach} through
 * {@link #listen}; detach releases everything.
 */
public abstract class BaseAbility implements Ability {
    private final String id;
    private final String name;
    private final AbilityType type;
    private final Set<AbilityCapability> capabilities;
    private final List<Subscription> subscriptions = new ArrayList<>();

    private Game game;
    private Player owner;

    protected BaseAbility(String id, String name, AbilityType type, Set<AbilityCapability> capabilities) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.capabilities = capabilities.isEmpty()
                ? EnumSet.noneOf(AbilityCapability.class)
                : EnumSet.copyOf(capabilities);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public AbilityType type() {
        return type;
    }

    @Override
    public Set<AbilityCapability> capabilities() {
        return Set.copyOf(capabilities);
    }

    @Override
    public final void attach(Game game, Player owner, EventBus eventBus) {
        if (this.owner != null) {
            throw new IllegalStateException("Ability " + id + " is already attached to seat " + this.owner.getSeat());
        }
        this.game = game;
        this.owner = owner;
        if (eventBus != null) {
            onAttach(eventBus);
        }
    }

    @Override
    public final void detach(Game game, Player owner, EventBus eventBus) {
        for (Subscription subscription : subscriptions) {
            subscription.unsubscribe();
        }
        subscriptions.clear();
        this.game = null;
        this.owner = null;
    }

    /**
     * Hook for subscribing to events. Default: no subscriptions.
     */
    protected void onAttach(EventBus eventBus) {
    }

    protected <E extends GameEvent> void listen(EventBus eventBus, Class<E> type, Consumer<? super E> handler) {
        subscriptions.add(eventBus.subscribe(type, handler));
    }

    public boolean isAttached() {
        return owner != null;
    }

    /**
     * The game this ability is attached to, or null when detached.
     */
    protected Game getGame() {
        return game;
    }

    /**
     * The owning player, or null when detached.
     */
    protected Player getOwner() {
        return owner;
    }

    /**
     * Whether the given player is this ability's owner.
     */
    protected boolean isOwner(Player player) {
        return owner != null && player != null && player.getSeat() == owner.getSeat();
    }

    protected boolean ownerIsActive() {
        return owner != null && isActive(game, owner);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
