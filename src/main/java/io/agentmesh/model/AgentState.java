package io.agentmesh.model;

import java.util.Locale;

public enum AgentState {
    ACTIVE,
    IDLE,
    COMPLETED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
