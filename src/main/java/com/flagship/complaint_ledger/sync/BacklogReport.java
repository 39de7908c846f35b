package com.flagship.complaint_ledger.sync;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Summary of one backlog reconciliation pass.
 */
@Value
public class BacklogReport {
    int candidates;
    Map<MintOutcome, Integer> outcomes;
    boolean skipped;

    public static BacklogReport of(int candidates, Map<MintOutcome, Integer> outcomes) {
        return new BacklogReport(candidates, Collections.unmodifiableMap(new EnumMap<>(outcomes)), false);
    }

    public static BacklogReport empty() {
        return new BacklogReport(0, Collections.emptyMap(), false);
    }

    /**
     * A pass was already running; this one did nothing.
     */
    public static BacklogReport alreadyRunning() {
        return new BacklogReport(0, Collections.emptyMap(), true);
    }

    public int count(MintOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    public int processed() {
        return outcomes.values().stream().mapToInt(Integer::intValue).sum();
    }

    public String summary() {
        if (skipped) {
            return "skipped (already running)";
        }
        if (candidates == 0) {
            return "no complaints waiting";
        }
        return candidates + " candidate(s): " + outcomes.entrySet().stream()
            .map(e -> e.getKey().name().toLowerCase() + "=" + e.getValue())
            .collect(Collectors.joining(", "));
    }
}
