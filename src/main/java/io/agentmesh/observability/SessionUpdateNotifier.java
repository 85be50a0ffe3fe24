package io.agentmesh.observability;

import io.agentmesh.config.AgentMeshConfig.SessionUpdates;
import io.agentmesh.host.HostException;
import io.agentmesh.host.SessionDirectory;
import io.agentmesh.registry.IdentityRegistry;
import io.agentmesh.security.SensitiveDataMasker;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;

/**
 * One-line notes about agent events, written into the root session of the agent concerned.
 * Each event kind is switched on separately in the settings; all are off by default.
 */
public final class SessionUpdateNotifier {
    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneId.systemDefault());

    private final SessionDirectory directory;
    private final IdentityRegistry registry;
    private final SessionUpdates enabled;
    private final AuditLogger auditLogger;

    public SessionUpdateNotifier(
            SessionDirectory directory,
            IdentityRegistry registry,
            SessionUpdates enabled,
            AuditLogger auditLogger
    ) {
        this.directory = directory;
        this.registry = registry;
        this.enabled = enabled == null ? SessionUpdates.none() : enabled;
        this.auditLogger = auditLogger;
    }

    public boolean statusUpdate(String sessionId, String status) {
        if (!enabled.statusUpdate()) {
            return false;
        }
        return send(rootOf(sessionId), "status_update", "[" + registry.alias(sessionId) + "] status: " + status);
    }

    public boolean messageSent(String sessionId, String recipientAlias, String body) {
        if (!enabled.messageSent()) {
            return false;
        }
        return send(rootOf(sessionId), "message_sent",
                "[" + registry.alias(sessionId) + "] -> [" + recipientAlias + "]: " + SensitiveDataMasker.preview(body));
    }

    public boolean subagentSpawned(String sessionId, String childAlias, String description) {
        if (!enabled.subagentCreation()) {
            return false;
        }
        String task = description == null || description.isBlank() ? "no description" : description;
        return send(rootOf(sessionId), "subagent_spawned",
                "[" + registry.alias(sessionId) + "] spawned " + childAlias + ": " + task);
    }

    public boolean subagentCompleted(String childSessionId, String childAlias) {
        if (!enabled.subagentCompletion()) {
            return false;
        }
        return send(rootOf(childSessionId), "subagent_completed", "[" + childAlias + "] idle");
    }

    public boolean sessionResumed(String sessionId, String resumedBy, String reason) {
        if (!enabled.sessionResumption()) {
            return false;
        }
        StringBuilder line = new StringBuilder("[").append(registry.alias(sessionId)).append("] resumed");
        if (resumedBy != null && !resumedBy.isBlank()) {
            line.append(" by ").append(resumedBy);
        }
        if (reason != null && !reason.isBlank()) {
            line.append(" (").append(reason).append(')');
        }
        return send(rootOf(sessionId), "session_resumed", line.toString());
    }

    public boolean userMessageSent(String rootSessionId, String targetAlias, String text) {
        if (!enabled.userMessage()) {
            return false;
        }
        return send(Optional.ofNullable(rootSessionId), "user_message_sent",
                "[user] -> [" + targetAlias + "]: " + SensitiveDataMasker.preview(text));
    }

    /**
     * Delivers an agent's reply to a user message. Not gated by the settings: this note is the
     * only place the reply lands.
     */
    public boolean userReply(String sessionId, String body) {
        return send(rootOf(sessionId), "user_reply", "[" + registry.alias(sessionId) + "] -> [user]: " + body);
    }

    private Optional<String> rootOf(String sessionId) {
        return registry.rootOf(sessionId);
    }

    private boolean send(Optional<String> rootSessionId, String event, String line) {
        if (rootSessionId.isEmpty()) {
            return false;
        }
        String text = "[" + CLOCK.format(Instant.now()) + "] " + line;
        try {
            directory.note(rootSessionId.get(), text);
            return true;
        } catch (HostException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "session.update",
                    "system",
                    "session/" + rootSessionId.get(),
                    "error",
                    Map.of("event", event, "error", String.valueOf(e.getMessage()))
            ));
            return false;
        }
    }
}
