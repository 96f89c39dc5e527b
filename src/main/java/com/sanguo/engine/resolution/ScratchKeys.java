package com.sanguo.engine.resolution;

import com.sanguo.engine.response.DodgeRequestContext;
import com.sanguo.engine.response.ResponseWindowResult;

/**
 * Scratch pad keys shared across resolvers.
 */
public final class ScratchKeys {
    /** Result of the most recent response window. */
    public static final ScratchKey<ResponseWindowResult> LAST_RESPONSE =
            new ScratchKey<>("lastResponse", ResponseWindowResult.class);

    /** Dodge request of the attack being resolved, when a provider chain runs. */
    public static final ScratchKey<DodgeRequestContext> DODGE_REQUEST =
            new ScratchKey<>("dodgeRequest", DodgeRequestContext.class);

    private ScratchKeys() {
        // Utility class - prevent instantiation
    }
}
