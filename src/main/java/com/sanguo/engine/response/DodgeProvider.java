package com.sanguo.engine.response;

import com.sanguo.engine.resolution.ResolutionContext;

/**
 * One way of satisfying a dodge request. Providers run in ascending
 * priority order.
 */
public interface DodgeProvider {

    int priority();

    String id();

    boolean canProvide(ResolutionContext context, DodgeRequestContext request);

    /**
     * Try to satisfy the request. May mark it resolved, push resolvers, or
     * set the high-priority flag to stop lower providers from running.
     */
    void provide(ResolutionContext context, DodgeRequestContext request);
}
