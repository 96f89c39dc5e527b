package com.sanguo.engine.resolution;

import java.util.List;

/**
 * LIFO stack of pending resolvers, each paired with the context it runs in.
 */
public interface ResolutionStack {

    /**
     * @throws IllegalArgumentException if either argument is null
     */
    void push(Resolver resolver, ResolutionContext context);

    /**
     * Remove the top frame and run its resolver with the frame's context.
     * @throws IllegalStateException if the stack is empty
     */
    ResolutionResult pop();

    boolean isEmpty();

    /**
     * Every resolver run so far, in the order it ran.
     */
    List<HistoryEntry> history();

    /**
     * Pop until the stack is empty. Exceptions thrown by a resolver stop the
     * drain and propagate.
     */
    default void drain() {
        while (!isEmpty()) {
            pop();
        }
    }
}
