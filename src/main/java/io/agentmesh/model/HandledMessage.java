package io.agentmesh.model;

public record HandledMessage(
        long seq,
        String from,
        String body
) {
}
