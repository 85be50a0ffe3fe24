package io.agentmesh.model;

public record AgentIdentity(
        String sessionId,
        String alias,
        String rootId
) {
}
