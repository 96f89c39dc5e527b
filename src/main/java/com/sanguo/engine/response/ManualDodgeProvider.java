package com.sanguo.engine.response;

import com.sanguo.engine.resolution.ResolutionContext;

/**
 * Lets the defender play dodge cards from hand.
 */
public class ManualDodgeProvider implements DodgeProvider {
    public static final String ID = "manual-dodge";

    @Override
    public int priority() {
        return 2;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean canProvide(ResolutionContext context, DodgeRequestContext request) {
        return true;
    }

    @Override
    public void provide(ResolutionContext context, DodgeRequestContext request) {
        context.getStack().push(ResponseWindows.jink(request.getSource(), request.getRequiredCount()), context);
    }
}
