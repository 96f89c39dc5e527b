package com.sanguo.engine.abilities.hero;

import com.sanguo.engine.abilities.AbilityCapability;
import com.sanguo.engine.abilities.AbilityType;
import com.sanguo.engine.abilities.BaseAbility;
import com.sanguo.engine.abilities.ResponseRequirementModifier;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.rules.ResponseType;

import java.util.EnumSet;

/**
 * The owner's slashes need two dodges to evade.
 */
public class PeerlessAbility extends BaseAbility implements ResponseRequirementModifier {
    public static final String ID = "peerless";

    public PeerlessAbility() {
        super(ID, "Peerless", AbilityType.LOCKED, EnumSet.of(AbilityCapability.INTERVENES_RESOLUTION));
    }

    @Override
    public int modifyRequiredCount(Game game, Player owner, Player responder, ResponseType type, int current) {
        if (type == ResponseType.JINK_AGAINST_SLASH) {
            return Math.max(current, 2);
        }
        return current;
    }
}
