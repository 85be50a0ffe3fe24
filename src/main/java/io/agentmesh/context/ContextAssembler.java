package io.agentmesh.context;

import io.agentmesh.bus.MailboxStore;
import io.agentmesh.host.HostMessage;
import io.agentmesh.model.MailMessage;
import io.agentmesh.model.ParallelAgent;
import io.agentmesh.prompt.Prompts;
import io.agentmesh.registry.IdentityRegistry;
import io.agentmesh.session.PendingOutputStore;
import io.agentmesh.tools.BroadcastTool;
import io.agentmesh.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the per-turn inbox view of a registered agent: who it is, who else is around, and
 * every unhandled message. Messages included here are marked presented, so they no longer
 * count as needing a wake.
 */
public final class ContextAssembler {
    private final IdentityRegistry registry;
    private final MailboxStore mailbox;
    private final PeerView peerView;
    private final PendingOutputStore pendingOutputs;

    public ContextAssembler(
            IdentityRegistry registry,
            MailboxStore mailbox,
            PeerView peerView,
            PendingOutputStore pendingOutputs
    ) {
        this.registry = registry;
        this.mailbox = mailbox;
        this.peerView = peerView;
        this.pendingOutputs = pendingOutputs;
    }

    public Optional<SyntheticTurn> assemble(String sessionId, List<HostMessage> history) {
        if (!registry.isLive(sessionId) || !hasUserMessage(history)) {
            return Optional.empty();
        }
        List<MailMessage> unhandled = mailbox.unhandled(sessionId);
        List<ParallelAgent> peers = peerView.peersOf(sessionId);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("you_are", registry.alias(sessionId));
        if (!registry.hasAnnounced(sessionId)) {
            output.put("hint", Prompts.ANNOUNCE_HINT);
        }
        if (!peers.isEmpty()) {
            List<Map<String, Object>> agents = new ArrayList<>();
            for (ParallelAgent peer : peers) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("name", peer.alias());
                row.put("status", peer.statusHistory());
                agents.add(row);
            }
            output.put("agents", agents);
        }
        if (!unhandled.isEmpty()) {
            List<Map<String, Object>> messages = new ArrayList<>();
            List<Long> seqs = new ArrayList<>();
            for (MailMessage message : unhandled) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("id", message.seq());
                row.put("from", message.from());
                row.put("content", message.body());
                messages.add(row);
                seqs.add(message.seq());
            }
            output.put("messages", messages);
            mailbox.markPresented(sessionId, seqs);
        }
        String userText = pendingOutputs.take(sessionId).map(PendingOutputStore.PendingOutput::text).orElse(null);
        return Optional.of(new SyntheticTurn(
                BroadcastTool.NAME,
                title(peers.size(), unhandled.size()),
                Jsons.toCompactJson(output),
                userText,
                unhandled.size(),
                peers.size()
        ));
    }

    private static boolean hasUserMessage(List<HostMessage> history) {
        if (history == null) {
            return false;
        }
        for (HostMessage message : history) {
            if (HostMessage.ROLE_USER.equals(message.role())) {
                return true;
            }
        }
        return false;
    }

    static String title(int agents, int messages) {
        List<String> parts = new ArrayList<>();
        if (agents > 0) {
            parts.add(agents + " agent(s)");
        }
        if (messages > 0) {
            parts.add(messages + " message(s)");
        }
        return parts.isEmpty() ? "Inbox" : String.join(", ", parts);
    }
}
