package io.agentmesh.model;

import java.util.List;

public record RecallEntry(
        String name,
        List<String> statusHistory,
        AgentState state,
        String output
) {
    public RecallEntry {
        statusHistory = statusHistory == null ? List.of() : List.copyOf(statusHistory);
    }
}
