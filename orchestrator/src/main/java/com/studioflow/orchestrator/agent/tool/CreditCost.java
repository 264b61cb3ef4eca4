package com.studioflow.orchestrator.agent.tool;

import java.util.List;

/** Estimated credit spend of an action, itemised per function call. */
public record CreditCost(int total, List<Item> breakdown) {

    public record Item(String functionCallId, String functionName, int credits, String details) {}

    public static CreditCost of(List<Item> items) {
        return new CreditCost(items.stream().mapToInt(Item::credits).sum(), List.copyOf(items));
    }
}
