package io.agentmesh.tools;

import io.agentmesh.barrier.CompletionBarrier;
import io.agentmesh.host.HostException;
import io.agentmesh.host.ParentLookup;
import io.agentmesh.host.SessionDirectory;
import io.agentmesh.ledger.StatusLedger;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.observability.SessionUpdateNotifier;
import io.agentmesh.prompt.Prompts;
import io.agentmesh.registry.IdentityRegistry;
import io.agentmesh.session.SessionStateTracker;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@code subagent}: spawns a sibling session that runs in parallel with its caller.
 *
 * <p>The new session is created under the caller's parent, registered under the caller's root
 * one level deeper than the caller, and added to the caller's pending children so the caller
 * cannot complete before it drains. The call returns as soon as the child is launched.
 */
public final class SubagentTool {
    public static final String NAME = "subagent";

    private final SessionDirectory directory;
    private final ParentLookup parentLookup;
    private final IdentityRegistry registry;
    private final SessionStateTracker tracker;
    private final CompletionBarrier barrier;
    private final StatusLedger ledger;
    private final ChildLauncher launcher;
    private final SessionUpdateNotifier notifier;
    private final AuditLogger auditLogger;
    private final int maxDepth;

    public SubagentTool(
            SessionDirectory directory,
            ParentLookup parentLookup,
            IdentityRegistry registry,
            SessionStateTracker tracker,
            CompletionBarrier barrier,
            StatusLedger ledger,
            ChildLauncher launcher,
            SessionUpdateNotifier notifier,
            AuditLogger auditLogger,
            int maxDepth
    ) {
        this.directory = directory;
        this.parentLookup = parentLookup;
        this.registry = registry;
        this.tracker = tracker;
        this.barrier = barrier;
        this.ledger = ledger;
        this.launcher = launcher;
        this.notifier = notifier;
        this.auditLogger = auditLogger;
        this.maxDepth = maxDepth;
    }

    public ToolResult execute(String sessionId, SubagentArgs args) {
        if (args == null || args.prompt() == null || args.prompt().isBlank()) {
            return ToolResult.error(Prompts.SUBAGENT_MISSING_PROMPT);
        }
        Optional<String> parentId = parentLookup.parentOf(sessionId);
        if (parentId.isEmpty()) {
            return ToolResult.error(Prompts.SUBAGENT_NOT_CHILD_SESSION);
        }
        int depth = registry.depthOf(sessionId);
        if (depth >= maxDepth) {
            audit(sessionId, "max_depth", Map.of("depth", depth, "max_depth", maxDepth));
            return ToolResult.error(Prompts.subagentMaxDepth(depth, maxDepth));
        }
        String callerAlias = registry.alias(sessionId);
        String description = args.effectiveDescription();

        Optional<String> created;
        try {
            created = directory.createSession(parentId.get(), description + " (subagent from " + callerAlias + ")");
        } catch (HostException e) {
            audit(sessionId, "error", Map.of("error", String.valueOf(e.getMessage())));
            return ToolResult.error(Prompts.subagentError(String.valueOf(e.getMessage())));
        }
        if (created.isEmpty()) {
            audit(sessionId, "create_failed", Map.of());
            return ToolResult.error(Prompts.SUBAGENT_CREATE_FAILED);
        }
        String childId = created.get();
        String root = registry.rootOf(sessionId).orElseGet(() -> parentLookup.rootOf(sessionId));
        String childAlias = registry.register(childId, root).orElse(childId);
        registry.setDepth(childId, depth + 1);
        tracker.markActive(childId);
        ledger.appendStatus(childAlias, description);
        barrier.addPending(sessionId, childId);
        notifier.subagentSpawned(sessionId, childAlias, description);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("child", childAlias);
        details.put("child_session", childId);
        details.put("depth", depth + 1);
        details.put("description", description);
        audit(sessionId, "ok", details);

        launcher.launch(sessionId, childId, childAlias, args.prompt());
        return ToolResult.ok(Prompts.subagentResult(childAlias, childId, description));
    }

    private void audit(String sessionId, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                "subagent.spawn",
                registry.alias(sessionId),
                "agent/" + registry.alias(sessionId),
                result,
                details
        ));
    }
}
