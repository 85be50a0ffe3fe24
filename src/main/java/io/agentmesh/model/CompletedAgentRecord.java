package io.agentmesh.model;

import java.util.List;

public record CompletedAgentRecord(
        String alias,
        List<String> statusHistory,
        String finalOutput,
        long completedAtMs
) {
    public CompletedAgentRecord {
        statusHistory = statusHistory == null ? List.of() : List.copyOf(statusHistory);
        finalOutput = finalOutput == null ? "" : finalOutput;
    }
}
