package com.sanguo.engine.abilities.hero;

import com.sanguo.engine.abilities.AbilityCapability;
import com.sanguo.engine.abilities.AbilityType;
import com.sanguo.engine.abilities.BaseAbility;
import com.sanguo.engine.events.DamageAppliedEvent;
import com.sanguo.engine.events.EventBus;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.resolution.ResolutionContext;
import com.sanguo.engine.resolution.RetaliationResolver;

import java.util.EnumSet;

/**
 * After taking damage from another player, the owner judges; anything but a
 * heart deals one damage back to the source.
 */
public class RetaliationAbility extends BaseAbility {
    public static final String ID = "retaliation";

    public RetaliationAbility() {
        super(ID, "Retaliation", AbilityType.TRIGGER, EnumSet.of(AbilityCapability.INTERVENES_RESOLUTION));
    }

    @Override
    protected void onAttach(EventBus eventBus) {
        listen(eventBus, DamageAppliedEvent.class, this::onDamageApplied);
    }

    private void onDamageApplied(DamageAppliedEvent event) {
        Player owner = getOwner();
        Integer sourceSeat = event.damage().sourceSeat();
        if (!ownerIsActive() || sourceSeat == null || event.damage().effectiveTargetSeat() != owner.getSeat()
                || sourceSeat == owner.getSeat() || event.context() == null) {
            return;
        }
        ResolutionContext context = event.context();
        context.getStack().push(new RetaliationResolver(id()), context.withActingPlayer(owner));
    }
}
