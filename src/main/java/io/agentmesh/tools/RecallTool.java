package io.agentmesh.tools;

import io.agentmesh.context.PeerView;
import io.agentmesh.ledger.StatusLedger;
import io.agentmesh.model.RecallEntry;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.prompt.Prompts;
import io.agentmesh.registry.IdentityRegistry;
import io.agentmesh.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code recall}: status history of completed and live agents as a JSON document.
 */
public final class RecallTool {
    public static final String NAME = "recall";

    private final IdentityRegistry registry;
    private final StatusLedger ledger;
    private final PeerView peerView;
    private final AuditLogger auditLogger;

    public RecallTool(IdentityRegistry registry, StatusLedger ledger, PeerView peerView, AuditLogger auditLogger) {
        this.registry = registry;
        this.ledger = ledger;
        this.peerView = peerView;
        this.auditLogger = auditLogger;
    }

    public ToolResult execute(String sessionId, RecallArgs args) {
        RecallArgs safeArgs = args == null ? new RecallArgs(null, false) : args;
        String target = safeArgs.agentName() == null ? null : safeArgs.agentName().trim();
        List<RecallEntry> entries = ledger.query(target, safeArgs.showOutput(), peerView.liveStates(sessionId));
        auditLogger.log(AuditLogger.AuditEvent.of(
                "recall.query",
                registry.alias(sessionId),
                target == null ? "agents/*" : "agent/" + target,
                entries.isEmpty() ? "empty" : "ok",
                Map.of("count", entries.size(), "show_output", safeArgs.showOutput())
        ));
        if (entries.isEmpty()) {
            return ToolResult.ok(target == null ? Prompts.RECALL_EMPTY : Prompts.recallNotFound(target));
        }
        return ToolResult.ok(Jsons.toJson(render(entries)));
    }

    static Map<String, Object> render(List<RecallEntry> entries) {
        List<Map<String, Object>> agents = new ArrayList<>();
        for (RecallEntry entry : entries) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("name", entry.name());
            row.put("status_history", entry.statusHistory());
            row.put("state", entry.state().wireName());
            if (entry.output() != null) {
                row.put("output", entry.output());
            }
            agents.add(row);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("agents", agents);
        return out;
    }
}
