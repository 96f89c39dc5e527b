package com.sanguo.engine.response;

import com.sanguo.engine.abilities.ResponseAssistanceAbility;
import com.sanguo.engine.model.Player;
import com.sanguo.engine.resolution.ResolutionContext;

import java.util.List;

/**
 * Asks the defender's allies to dodge on the defender's behalf. Takes over
 * the request: lower providers wait until the allies have answered.
 */
public class ResponseAssistanceProvider implements DodgeProvider {
    public static final String ID = "response-assistance";

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean canProvide(ResolutionContext context, DodgeRequestContext request) {
        if (request.isAssistanceAttempted()) {
            return false;
        }
        Player defender = context.getGame().getPlayer(request.getDefenderSeat());
        return !assistants(context, defender).isEmpty();
    }

    @Override
    public void provide(ResolutionContext context, DodgeRequestContext request) {
        Player defender = context.getGame().getPlayer(request.getDefenderSeat());
        List<Integer> seats = assistants(context, defender).stream().map(Player::getSeat).toList();
        context.getStack().push(new ResponseAssistanceResolver(request, seats), context);
        request.setHighPriorityActivated(true);
    }

    private List<Player> assistants(ResolutionContext context, Player defender) {
        return context.abilitiesOf(defender, ResponseAssistanceAbility.class).stream()
                .flatMap(a -> a.assistants(context.getGame(), defender).stream())
                .distinct()
                .toList();
    }
}
