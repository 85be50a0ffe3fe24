package io.agentmesh.model;

public record SessionState(
        String sessionId,
        String alias,
        SessionStatus status,
        long lastActivityAtMs
) {
    public boolean idle() {
        return status == SessionStatus.IDLE;
    }
}
