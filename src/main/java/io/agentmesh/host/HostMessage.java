package io.agentmesh.host;

import java.util.List;

public record HostMessage(
        String id,
        String role,
        List<HostPart> parts
) {
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public HostMessage {
        parts = parts == null ? List.of() : List.copyOf(parts);
    }

    public boolean fromAssistant() {
        return ROLE_ASSISTANT.equals(role);
    }
}
