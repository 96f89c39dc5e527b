package com.sanguo.engine.response;

import com.sanguo.engine.resolution.ResolutionContext;
import com.sanguo.engine.resolution.ResolutionResult;
import com.sanguo.engine.resolution.Resolver;
import com.sanguo.engine.resolution.ScratchKeys;
import com.sanguo.engine.rules.ResponseType;

import java.util.List;

/**
 * Opens a dodge window for the defender's allies, with the assistance
 * outcome check beneath it.
 */
public class ResponseAssistanceResolver implements Resolver {
    public static final String KIND = "response-assistance";

    private final DodgeRequestContext request;
    private final List<Integer> assistantSeats;

    public ResponseAssistanceResolver(DodgeRequestContext request, List<Integer> assistantSeats) {
        this.request = request;
        this.assistantSeats = List.copyOf(assistantSeats);
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        context.requireScratchPad().remove(ScratchKeys.LAST_RESPONSE);
        context.getStack().push(new AssistanceOutcomeResolver(request), context);
        context.getStack().push(new ResponseWindowResolver(ResponseType.JINK_AGAINST_SLASH, assistantSeats,
                request.getSource(), request.getRequiredCount()), context);
        return ResolutionResult.SUCCESS;
    }
}
