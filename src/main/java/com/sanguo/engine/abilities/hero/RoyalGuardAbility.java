package com.sanguo.engine.abilities.hero;

import com.sanguo.engine.abilities.AbilityCapability;
import com.sanguo.engine.abilities.AbilityType;
import com.sanguo.engine.abilities.BaseAbility;
import com.sanguo.engine.abilities.ResponseAssistanceAbility;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.EnumSet;
import java.util.List;

/**
 * Lord ability: faction allies may play dodges for the lord.
 */
public class RoyalGuardAbility extends BaseAbility implements ResponseAssistanceAbility {
    public static final String ID = "royal_guard";

    public RoyalGuardAbility() {
        super(ID, "Royal Guard", AbilityType.ACTIVE,
                EnumSet.of(AbilityCapability.INTERVENES_RESOLUTION, AbilityCapability.INITIATES_CHOICES));
    }

    @Override
    public boolean isActive(Game game, Player owner) {
        return owner.isAlive() && owner.isLord();
    }

    @Override
    public List<Player> assistants(Game game, Player owner) {
        return game.getAlivePlayers().stream()
                .filter(p -> p.getSeat() != owner.getSeat())
                .filter(p -> p.getFactionId() != null && p.getFactionId().equals(owner.getFactionId()))
                .toList();
    }
}
