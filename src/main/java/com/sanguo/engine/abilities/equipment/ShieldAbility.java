package com.sanguo.engine.abilities.equipment;

import com.sanguo.engine.abilities.AbilityCapability;
import com.sanguo.engine.abilities.AbilityType;
import com.sanguo.engine.abilities.ArmorAbility;
import com.sanguo.engine.abilities.BaseAbility;
import com.sanguo.engine.abilities.CardEffectFilter;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.CardSubType;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

import java.util.EnumSet;

/**
 * Armor: black slashes have no effect on the owner.
 */
public class ShieldAbility extends BaseAbility implements CardEffectFilter, ArmorAbility {
    public static final String ID = "renwang_shield";

    public ShieldAbility() {
        super(ID, "Renwang Shield", AbilityType.LOCKED, EnumSet.of(AbilityCapability.INTERVENES_RESOLUTION));
    }

    @Override
    public boolean nullifies(Game game, Player owner, Player user, Card card) {
        return card.is(CardSubType.SLASH) && card.isBlack();
    }
}
