package io.agentmesh.model;

import java.util.List;

public record ParallelAgent(
        String alias,
        List<String> statusHistory,
        boolean idle
) {
    public ParallelAgent {
        statusHistory = statusHistory == null ? List.of() : List.copyOf(statusHistory);
    }

    public String latestStatus() {
        return statusHistory.isEmpty() ? null : statusHistory.get(statusHistory.size() - 1);
    }
}
