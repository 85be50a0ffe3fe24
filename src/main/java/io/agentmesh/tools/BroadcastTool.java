package io.agentmesh.tools;

import io.agentmesh.bus.MailboxStore;
import io.agentmesh.context.PeerView;
import io.agentmesh.ledger.StatusLedger;
import io.agentmesh.model.HandledMessage;
import io.agentmesh.model.MailMessage;
import io.agentmesh.model.ParallelAgent;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.observability.SessionUpdateNotifier;
import io.agentmesh.prompt.Prompts;
import io.agentmesh.registry.IdentityRegistry;
import io.agentmesh.security.SensitiveDataMasker;
import io.agentmesh.session.ResumeCoordinator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code broadcast}: status updates, direct messages and replies between agents.
 *
 * <p>Without {@code send_to} the message only becomes the sender's latest status; nobody is
 * messaged or woken. With {@code reply_to} the answered message is marked handled and the reply
 * goes to its sender regardless of {@code send_to}.
 */
public final class BroadcastTool {
    public static final String NAME = "broadcast";

    private final IdentityRegistry registry;
    private final MailboxStore mailbox;
    private final StatusLedger ledger;
    private final PeerView peerView;
    private final ResumeCoordinator resumeCoordinator;
    private final SessionUpdateNotifier notifier;
    private final AuditLogger auditLogger;

    public BroadcastTool(
            IdentityRegistry registry,
            MailboxStore mailbox,
            StatusLedger ledger,
            PeerView peerView,
            ResumeCoordinator resumeCoordinator,
            SessionUpdateNotifier notifier,
            AuditLogger auditLogger
    ) {
        this.registry = registry;
        this.mailbox = mailbox;
        this.ledger = ledger;
        this.peerView = peerView;
        this.resumeCoordinator = resumeCoordinator;
        this.notifier = notifier;
        this.auditLogger = auditLogger;
    }

    public ToolResult execute(String sessionId, BroadcastArgs args) {
        String alias = registry.alias(sessionId);
        if (args == null || args.message() == null || args.message().isBlank()) {
            return ToolResult.error(Prompts.BROADCAST_MISSING_MESSAGE);
        }
        String body = mailbox.truncate(args.message());
        List<ParallelAgent> peers = peerView.peersOf(sessionId);

        HandledMessage handled = null;
        if (args.replyTo() != null) {
            registry.markAnnounced(sessionId);
            List<HandledMessage> marked = mailbox.markHandled(sessionId, List.of(args.replyTo()));
            if (!marked.isEmpty()) {
                handled = marked.get(0);
            }
        }

        String target;
        if (handled != null && Prompts.USER_SENDER.equals(handled.from())) {
            return replyToUser(sessionId, alias, body, peers, handled);
        } else if (handled != null) {
            target = handled.from();
        } else if (args.sendTo() == null || args.sendTo().isBlank()) {
            registry.markAnnounced(sessionId);
            ledger.appendStatus(alias, body);
            notifier.statusUpdate(sessionId, body);
            audit(alias, "broadcast.status", "agent/" + alias, "ok", Map.of("status", SensitiveDataMasker.preview(body)));
            return ToolResult.ok(Prompts.broadcastResult(alias, List.of(), peers, null));
        } else {
            target = args.sendTo().trim();
        }

        Optional<String> recipient = registry.resolve(target);
        if (recipient.isEmpty()) {
            audit(alias, "broadcast.send", "agent/" + target, "unknown_recipient", Map.of());
            return ToolResult.error(Prompts.unknownRecipient(target, registry.knownAliases(sessionId)));
        }
        String recipientId = recipient.get();
        if (recipientId.equals(sessionId)) {
            return ToolResult.error(Prompts.BROADCAST_SELF_MESSAGE);
        }
        String recipientAlias = registry.alias(recipientId);
        MailMessage sent = mailbox.send(alias, recipientId, body);
        notifier.messageSent(sessionId, recipientAlias, body);
        boolean woke = !ResumeCoordinator.refused(resumeCoordinator.wakeFor(sent));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("seq", sent.seq());
        details.put("reply_to", handled == null ? null : handled.seq());
        details.put("woke", woke);
        details.put("preview", SensitiveDataMasker.preview(body));
        audit(alias, "mailbox.send", "agent/" + recipientAlias, "ok", details);
        return ToolResult.ok(Prompts.broadcastResult(alias, List.of(recipientAlias), peers, handled));
    }

    /**
     * The user has no mailbox; the reply goes into the root session the user typed from.
     */
    private ToolResult replyToUser(
            String sessionId,
            String alias,
            String body,
            List<ParallelAgent> peers,
            HandledMessage handled
    ) {
        boolean delivered = notifier.userReply(sessionId, body);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reply_to", handled.seq());
        details.put("preview", SensitiveDataMasker.preview(body));
        audit(alias, "mailbox.reply_user", "session/" + registry.rootOf(sessionId).orElse(sessionId),
                delivered ? "ok" : "error", details);
        if (!delivered) {
            return ToolResult.error(Prompts.USER_REPLY_FAILED);
        }
        return ToolResult.ok(Prompts.broadcastResult(alias, List.of(Prompts.USER_SENDER), peers, handled));
    }

    private void audit(String actor, String action, String resource, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(action, actor, resource, result, details));
    }
}
