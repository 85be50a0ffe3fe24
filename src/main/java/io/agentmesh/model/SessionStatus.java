package io.agentmesh.model;

public enum SessionStatus {
    ACTIVE,
    IDLE
}
