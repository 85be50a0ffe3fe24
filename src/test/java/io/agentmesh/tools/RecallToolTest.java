package io.agentmesh.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.context.PeerView;
import io.agentmesh.ledger.StatusLedger;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.prompt.Prompts;
import io.agentmesh.registry.IdentityRegistry;
import io.agentmesh.session.SessionStateTracker;
import io.agentmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RecallToolTest {
    private final IdentityRegistry registry = new IdentityRegistry();
    private final SessionStateTracker tracker = new SessionStateTracker(registry);
    private final StatusLedger ledger = new StatusLedger(50, 300);
    private final AuditLogger audit = AuditLogger.inMemory(50);
    private final RecallTool tool = new RecallTool(registry, ledger, new PeerView(registry, ledger, tracker), audit);

    @Test
    void emptyHistory() {
        ToolResult result = tool.execute("ses_x", new RecallArgs(null, false));
        Assertions.assertEquals(Prompts.RECALL_EMPTY, result.text());
        Assertions.assertEquals("empty", audit.rows("recall.query").get(0).path("result").asText());
    }

    @Test
    void unknownName() {
        registry.register("ses_a", "root");
        ToolResult result = tool.execute("ses_a", new RecallArgs(" agentZ ", true));
        Assertions.assertEquals(Prompts.recallNotFound("agentZ"), result.text());
    }

    @Test
    void listsAgentsAsJsonWithOutputOnRequest() {
        registry.register("ses_a", "root");
        registry.register("ses_b", "root");
        tracker.markActive("ses_a");
        ledger.appendStatus("agentA", "indexing");
        ledger.archive("agentB", "B final");

        JsonNode all = Jsons.readTree(tool.execute("ses_a", new RecallArgs(null, false)).text());
        Assertions.assertEquals(2, all.path("agents").size());
        Assertions.assertEquals("agentB", all.path("agents").get(0).path("name").asText());
        Assertions.assertEquals("completed", all.path("agents").get(0).path("state").asText());
        Assertions.assertTrue(all.path("agents").get(0).path("output").isMissingNode());
        Assertions.assertEquals("active", all.path("agents").get(1).path("state").asText());
        Assertions.assertEquals("indexing", all.path("agents").get(1).path("status_history").get(0).asText());

        JsonNode one = Jsons.readTree(tool.execute("ses_a", new RecallArgs("agentB", true)).text());
        Assertions.assertEquals("B final", one.path("agents").get(0).path("output").asText());
    }
}
