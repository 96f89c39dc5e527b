package com.sanguo.engine.response;

import com.sanguo.engine.logging.LogEntry;
import com.sanguo.engine.resolution.ResolutionContext;
import com.sanguo.engine.resolution.ResolutionResult;
import com.sanguo.engine.resolution.Resolver;
import com.sanguo.engine.resolution.ScratchKeys;
import com.sanguo.engine.resolution.ScratchPad;
import com.sanguo.engine.rules.ResponseType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a response window and stores its result under
 * {@link ScratchKeys#LAST_RESPONSE} for the resolver beneath it.
 */
public class ResponseWindowResolver implements Resolver {
    public static final String KIND = "response-window";

    private final ResponseType responseType;
    private final List<Integer> responderSeats;
    private final Object sourceEvent;
    private final int requiredResponseCount;

    public ResponseWindowResolver(ResponseType responseType, List<Integer> responderSeats, Object sourceEvent,
                                  int requiredResponseCount) {
        this.responseType = responseType;
        this.responderSeats = List.copyOf(responderSeats);
        this.sourceEvent = sourceEvent;
        this.requiredResponseCount = requiredResponseCount;
    }

    @Override
    public String kind() {
        return KIND;
    }

    public ResponseType getResponseType() {
        return responseType;
    }

    public List<Integer> getResponderSeats() {
        return responderSeats;
    }

    public int getRequiredResponseCount() {
        return requiredResponseCount;
    }

    @Override
    public ResolutionResult resolve(ResolutionContext context) {
        ScratchPad scratch = context.requireScratchPad();

        ResponseWindowContext windowContext = ResponseWindowContext.from(context, responseType, responderSeats,
                sourceEvent, requiredResponseCount);
        ResponseWindow window = new BasicResponseWindow(windowContext);
        ResponseWindowResult result = window.execute();
        scratch.put(ScratchKeys.LAST_RESPONSE, result);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("window_id", window.getWindowId());
        data.put("response_type", responseType.name());
        data.put("outcome", result.outcome().name());
        data.put("responder", result.responderSeat());
        data.put("cards", result.playedCards().size());
        context.log(LogEntry.info("ResponseWindowClosed", "Response window closed", data));
        return ResolutionResult.SUCCESS;
    }
}
