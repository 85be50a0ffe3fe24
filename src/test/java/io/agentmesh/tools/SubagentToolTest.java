package io.agentmesh.tools;

import io.agentmesh.barrier.CompletionBarrier;
import io.agentmesh.bus.MailboxStore;
import io.agentmesh.config.AgentMeshConfig;
import io.agentmesh.host.LocalSessionDirectory;
import io.agentmesh.host.ParentLookup;
import io.agentmesh.ledger.StatusLedger;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.observability.SessionUpdateNotifier;
import io.agentmesh.prompt.Prompts;
import io.agentmesh.registry.IdentityRegistry;
import io.agentmesh.session.PendingOutputStore;
import io.agentmesh.session.SessionStateTracker;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

final class SubagentToolTest {
    private final LocalSessionDirectory directory = new LocalSessionDirectory();
    private final IdentityRegistry registry = new IdentityRegistry();
    private final SessionStateTracker tracker = new SessionStateTracker(registry);
    private final MailboxStore mailbox = new MailboxStore(100, 10_000);
    private final StatusLedger ledger = new StatusLedger(50, 300);
    private final AuditLogger audit = AuditLogger.inMemory(100);
    private final CompletionBarrier barrier = new CompletionBarrier(
            tracker, mailbox, new PendingOutputStore(), registry, audit, 10, 100L, 10L);
    private final List<List<String>> launched = new ArrayList<>();
    private final SubagentTool tool = new SubagentTool(
            directory,
            new ParentLookup(directory, audit, 60_000L),
            registry,
            tracker,
            barrier,
            ledger,
            (caller, childId, childAlias, prompt) -> launched.add(List.of(caller, childId, childAlias, prompt)),
            new SessionUpdateNotifier(directory, registry, AgentMeshConfig.SessionUpdates.none(), audit),
            audit,
            3
    );

    private final String root = directory.addSession(null, "root");
    private final String caller = directory.addSession(root, "caller");

    @Test
    void promptIsRequired() {
        ToolResult result = tool.execute(caller, new SubagentArgs(null, "desc"));
        Assertions.assertTrue(result.error());
        Assertions.assertEquals(Prompts.SUBAGENT_MISSING_PROMPT, result.text());
    }

    @Test
    void onlyChildSessionsMaySpawn() {
        ToolResult result = tool.execute(root, new SubagentArgs("do work", null));
        Assertions.assertEquals(Prompts.SUBAGENT_NOT_CHILD_SESSION, result.text());
        Assertions.assertTrue(launched.isEmpty());
    }

    @Test
    void depthLimitIsEnforced() {
        registry.register(caller, root);
        registry.setDepth(caller, 3);

        ToolResult result = tool.execute(caller, new SubagentArgs("do work", null));

        Assertions.assertEquals(Prompts.subagentMaxDepth(3, 3), result.text());
        Assertions.assertEquals("max_depth", audit.rows("subagent.spawn").get(0).path("result").asText());
    }

    @Test
    void hostWithoutSessionIdIsAnError() {
        registry.register(caller, root);
        directory.failCreate(true);

        ToolResult result = tool.execute(caller, new SubagentArgs("do work", null));

        Assertions.assertEquals(Prompts.SUBAGENT_CREATE_FAILED, result.text());
        Assertions.assertTrue(launched.isEmpty());
    }

    @Test
    void spawnsSiblingAndLaunchesIt() {
        registry.register(caller, root);

        ToolResult result = tool.execute(caller, new SubagentArgs("read the docs", "research"));

        Assertions.assertFalse(result.error());
        List<String> children = directory.children(root);
        Assertions.assertEquals(2, children.size());
        String child = children.get(1);
        Assertions.assertEquals("research (subagent from agentA)", directory.title(child).orElseThrow());
        Assertions.assertEquals("agentB", registry.alias(child));
        Assertions.assertEquals(root, registry.rootOf(child).orElseThrow());
        Assertions.assertEquals(2, registry.depthOf(child));
        Assertions.assertFalse(tracker.isIdle(child));
        Assertions.assertEquals(List.of("research"), ledger.statusHistory("agentB"));
        Assertions.assertEquals(Set.of(child), barrier.pending(caller));
        Assertions.assertEquals(List.of(List.of(caller, child, "agentB", "read the docs")), launched);
        Assertions.assertEquals(Prompts.subagentResult("agentB", child, "research"), result.text());
    }

    @Test
    void descriptionDefaultsToStartOfPrompt() {
        String prompt = "x".repeat(80);
        Assertions.assertEquals(50, new SubagentArgs(prompt, null).effectiveDescription().length());
        Assertions.assertEquals("short", new SubagentArgs("short", " ").effectiveDescription());
        Assertions.assertEquals("given", new SubagentArgs(prompt, " given ").effectiveDescription());
    }
}
