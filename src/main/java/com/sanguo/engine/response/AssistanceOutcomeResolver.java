package com.sanguo.engine.response;

import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.resolution.ResolutionContext;
import com.sanguo.engine.resolution.ResolutionResult;
import com.sanguo.engine.resolution.Resolver;
import com.sanguo.engine.resolution.ScratchKeys;
import com.sanguo.engine.resolution.ScratchPad;

import java.util.Map;

/**
 * Reads the allies' answer. On success the request is resolved; otherwise
 * the remaining providers get their turn.
 */
public class AssistanceOutcomeResolver implements Resolver {
    public static final String KIND = "assistance-outcome";

    private final DodgeRequestContext request;

    public AssistanceOutcomeResolver(DodgeRequestContext request) {
        this.request = request;
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        ScratchPad scratch = context.requireScratchPad();
        ResponseWindowResult result = scratch.remove(ScratchKeys.LAST_RESPONSE)
                .orElse(ResponseWindowResult.noResponse());

        request.setAssistanceAttempted(true);
        if (result.isSuccess()) {
            request.markResolved(ResponseAssistanceProvider.ID, result.playedCards().get(0));
            context.log(LogEntry.info("AssistanceGiven", "An ally dodged on the defender's behalf",
                    Map.of("defender", request.getDefenderSeat(), "assistant", result.responderSeat())));
            return ResolutionResult.SUCCESS;
        }

        request.setHighPriorityActivated(false);
        context.getStack().push(new DodgeProviderChainResolver(request), context);
        return ResolutionResult.SUCCESS;
    }
}
