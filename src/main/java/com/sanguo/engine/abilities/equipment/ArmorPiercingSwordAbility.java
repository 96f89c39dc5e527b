package com.sanguo.engine.abilities.equipment;

import com.sanguo.engine.abilities.ArmorIgnoreProvider;
import com.sanguo.engine.model.Card;
import com.sanguo.engine.model.CardSubType;
import com.sanguo.engine.model.Game;
import com.sanguo.engine.model.Player;

/**
 * Range-two sword whose slashes ignore the target's armor.
 */
public class ArmorPiercingSwordAbility extends LongWeaponAbility implements ArmorIgnoreProvider {
    public static final String ID = "qinggang_sword";

    public ArmorPiercingSwordAbility() {
        super(ID, "Qinggang Sword", 2);
    }

    @Override
    public boolean ignoresArmor(Game game, Player user, Player target, Card card) {
        return isOwner(user) && card.is(CardSubType.SLASH);
    }
}
