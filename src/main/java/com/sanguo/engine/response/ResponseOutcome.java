package com.sanguo.engine.response;

public enum ResponseOutcome {
    /** Everyone passed. */
    NO_RESPONSE,
    /** A responder played every required card. */
    RESPONSE_SUCCESS,
    /** A responder started answering but stopped short of the requirement. */
    RESPONSE_FAILED
}
