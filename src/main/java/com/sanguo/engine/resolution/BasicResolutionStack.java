package com.sanguo.engine.resolution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class BasicResolutionStack implements ResolutionStack {
    private static final Logger log = LoggerFactory.getLogger(BasicResolutionStack.class);

    private final Deque<Frame> pending = new ArrayDeque<>();
    private final List<HistoryEntry> history = new ArrayList<>();

    @Override
    public void push(Resolver resolver, ResolutionContext context) {
        if (resolver == null) {
            throw new IllegalArgumentException("Cannot push a null resolver");
        }
        if (context == null) {
            throw new IllegalArgumentException("Cannot push " + resolver.kind() + " without a context");
        }
        pending.push(new Frame(resolver, context));
    }

    @Override
    public ResolutionResult pop() {
        Frame frame = pending.poll();
        if (frame == null) {
            throw new IllegalStateException("Resolution stack is empty");
        }
        Resolver resolver = frame.resolver();
        ResolutionResult result = resolver.resolve(frame.context());
        if (result == null) {
            throw new IllegalStateException("Resolver " + resolver.kind() + " returned no result");
        }
        history.add(new HistoryEntry(history.size() + 1, resolver.kind(), result.success()));
        if (!result.success()) {
            log.debug("Resolver {} failed: {} ({})", resolver.kind(), result.errorCode(), result.messageKey());
        }
        return result;
    }

    @Override
    public boolean isEmpty() {
        return pending.isEmpty();
    }

    @Override
    public List<HistoryEntry> history() {
        return List.copyOf(history);
    }

    /**
     * Kinds of the resolvers run so far, in order.
     */
    public List<String> historyKinds() {
        return history.stream().map(HistoryEntry::kind).toList();
    }

    private record Frame(Resolver resolver, ResolutionContext context) {
    }
}
