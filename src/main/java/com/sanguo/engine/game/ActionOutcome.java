package com.sanguo.engine.game;

import com.sanguo.engine.resolution.HistoryEntry;
import com.sanguo.engine.resolution.ResolutionResult;

import java.util.List;

/**
 * Result of one top-level action.
 *
 * @param result  result of the entry resolver
 * @param history every resolver run for the action, in order
 */
public record ActionOutcome(ResolutionResult result, List<HistoryEntry> history) {
    public ActionOutcome {
        history = List.copyOf(history);
    }

    public boolean isSuccess() {
        return result.success();
    }

    public List<String> kinds() {
        return history.stream().map(HistoryEntry::kind).toList();
    }
}
