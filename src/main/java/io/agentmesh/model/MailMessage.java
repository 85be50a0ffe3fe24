package io.agentmesh.model;

public record MailMessage(
        String id,
        long seq,
        String from,
        String to,
        String body,
        long createdAtMs,
        boolean handled
) {
}
