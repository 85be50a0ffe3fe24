package io.agentmesh.runtime;

import io.agentmesh.barrier.BarrierOutcome;
import io.agentmesh.config.AgentMeshConfig;
import io.agentmesh.host.HostException;
import io.agentmesh.host.LocalSessionDirectory;
import io.agentmesh.host.ToolCompletion;
import io.agentmesh.model.MailMessage;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.prompt.Prompts;
import io.agentmesh.session.DeliveryMode;
import io.agentmesh.tools.BroadcastArgs;
import io.agentmesh.tools.SubagentArgs;
import io.agentmesh.tools.ToolResult;
import io.agentmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class AgentMeshRuntimeTest {

    @Test
    void helloAndGoodbyeEndsWithSummaryAndReset() throws Exception {
        LocalSessionDirectory directory = new LocalSessionDirectory();
        AuditLogger audit = AuditLogger.inMemory(500);
        try (AgentMeshRuntime runtime = new AgentMeshRuntime(config(DeliveryMode.INBOX), directory, audit)) {
            String root = directory.addSession(null, "root");
            String a = spawn(runtime, directory, root, "Write parser");
            String b = spawn(runtime, directory, root, "Review parser");

            AgentMeshRuntime.SessionStart startA = runtime.onSessionStart(a).orElseThrow();
            Assertions.assertEquals("agentA", startA.alias());
            Assertions.assertEquals(1, startA.depth());
            Assertions.assertTrue(startA.allowSubagent());
            Assertions.assertTrue(startA.systemPrompt().contains("You are agentA."));
            Assertions.assertTrue(runtime.onSessionStart(root).isEmpty());

            ToolResult hi = runtime.broadcast(a, new BroadcastArgs("agentB", "hi", null));
            Assertions.assertFalse(hi.error());
            MailMessage received = runtime.mailbox().unhandled(b).get(0);
            ToolResult bye = runtime.broadcast(b, new BroadcastArgs(null, "bye", received.seq()));
            Assertions.assertTrue(bye.text().contains("Replied to #" + received.seq() + " from agentA"));

            runtime.onSessionIdle(a);
            runtime.onSessionIdle(b);

            BarrierOutcome first = runtime.onBeforeComplete(a);
            Assertions.assertEquals(BarrierOutcome.Kind.RESUME, first.kind());
            Assertions.assertEquals(Prompts.resumeBroadcast("agentB"), first.resumePrompt());
            Assertions.assertEquals(BarrierOutcome.Kind.SATISFIED, runtime.onBeforeComplete(a).kind());
            Assertions.assertTrue(directory.notes(root).isEmpty());

            Assertions.assertEquals(BarrierOutcome.Kind.SATISFIED, runtime.onBeforeComplete(b).kind());

            List<String> notes = directory.notes(root);
            Assertions.assertEquals(1, notes.size());
            Assertions.assertTrue(notes.get(0).startsWith(Prompts.SUMMARY_HEADER));
            Assertions.assertTrue(notes.get(0).contains("## agentA\n- Write parser"));
            Assertions.assertTrue(notes.get(0).contains("## agentB\n- Review parser"));
            Assertions.assertTrue(runtime.registry().liveIdentities().isEmpty());
            Assertions.assertTrue(runtime.registry().isRetired(a));
            Assertions.assertEquals(2, runtime.ledger().archived().size());
            Assertions.assertEquals("ok", audit.rows("mesh.summary").get(0).path("result").asText());
        }
    }

    @Test
    void retiredSessionsAreNotRegisteredAgain() throws Exception {
        LocalSessionDirectory directory = new LocalSessionDirectory();
        AuditLogger audit = AuditLogger.inMemory(500);
        try (AgentMeshRuntime runtime = new AgentMeshRuntime(config(DeliveryMode.INBOX), directory, audit)) {
            String root = directory.addSession(null, "root");
            String a = spawn(runtime, directory, root, null);

            AgentMeshRuntime.ResetOutcome reset = runtime.reset();
            Assertions.assertEquals(1, reset.retiredNow());

            runtime.onToolCompleted(new ToolCompletion(ToolCompletion.TASK_TOOL, root, a, "done"));
            Assertions.assertTrue(runtime.onSessionStart(a).isEmpty());

            Assertions.assertFalse(runtime.registry().isLive(a));
            Assertions.assertEquals("retired", audit.rows("tool.completed").get(0).path("result").asText());
            Assertions.assertEquals("retired", audit.rows("registry.register").get(1).path("result").asText());

            String c = spawn(runtime, directory, root, null);
            Assertions.assertEquals("agentB", runtime.registry().alias(c));
        }
    }

    @Test
    void inboxDeliveryHoldsCallerUntilChildOutputArrives() throws Exception {
        LocalSessionDirectory directory = new LocalSessionDirectory();
        directory.defaultResponder(turn -> "child result");
        AuditLogger audit = AuditLogger.inMemory(500);
        try (AgentMeshRuntime runtime = new AgentMeshRuntime(config(DeliveryMode.INBOX), directory, audit)) {
            String root = directory.addSession(null, "root");
            String a = spawn(runtime, directory, root, "Coordinate");

            ToolResult spawned = runtime.subagent(a, Jsons.readTree("{\"prompt\":\"compute\",\"description\":\"calc\"}"));
            Assertions.assertFalse(spawned.error());
            String child = directory.children(root).get(1);

            BarrierOutcome first = runtime.onBeforeComplete(a);
            Assertions.assertEquals(BarrierOutcome.Kind.RESUME, first.kind());
            Assertions.assertEquals(Prompts.resumeBroadcast("agentB"), first.resumePrompt());
            MailMessage output = runtime.mailbox().unhandled(a).get(0);
            Assertions.assertEquals("agentB", output.from());
            Assertions.assertTrue(output.body().startsWith("[Received agentB completed task]\nchild result"));
            Assertions.assertTrue(runtime.tracker().isIdle(child));

            Assertions.assertEquals(BarrierOutcome.Kind.SATISFIED, runtime.onBeforeComplete(a).kind());
            Assertions.assertTrue(runtime.awaitQuiescence(5_000L));
            String summary = directory.notes(root).get(0);
            Assertions.assertTrue(summary.contains("## agentB\n- calc"));
            Assertions.assertEquals("ok", audit.rows("subagent.complete").get(0).path("result").asText());
        }
    }

    @Test
    void userMessageDeliveryHandsOutputToWaitingCaller() throws Exception {
        LocalSessionDirectory directory = new LocalSessionDirectory();
        AuditLogger audit = AuditLogger.inMemory(500);
        try (AgentMeshRuntime runtime = new AgentMeshRuntime(config(DeliveryMode.USER_MESSAGE), directory, audit)) {
            String root = directory.addSession(null, "root");
            String a = spawn(runtime, directory, root, "Coordinate");
            directory.defaultResponder(turn -> {
                waitUntilAwaiting(runtime, a);
                return "child result";
            });

            Assertions.assertFalse(runtime.subagent(a, new SubagentArgs("compute", "calc")).error());

            BarrierOutcome outcome = runtime.onBeforeComplete(a);

            Assertions.assertEquals(BarrierOutcome.Kind.RESUME, outcome.kind());
            Assertions.assertTrue(outcome.resumePrompt().startsWith("[agentB completed]\n\n<output=agentB>\nchild result"));
            Assertions.assertTrue(runtime.mailbox().unhandled(a).isEmpty());
            Assertions.assertTrue(directory.notes(a).isEmpty());
            Assertions.assertTrue(runtime.awaitQuiescence(5_000L));
        }
    }

    @Test
    void userMessagesReachCoordinatorOrNamedAgent() throws Exception {
        LocalSessionDirectory directory = new LocalSessionDirectory();
        AuditLogger audit = AuditLogger.inMemory(500);
        try (AgentMeshRuntime runtime = new AgentMeshRuntime(config(DeliveryMode.INBOX), directory, audit)) {
            String root = directory.addSession(null, "root");
            Assertions.assertEquals(Prompts.USER_MESSAGE_NO_MESH, runtime.sendUserMessage(root, "hello").message());

            String a = spawn(runtime, directory, root, null);
            String b = spawn(runtime, directory, root, null);

            AgentMeshRuntime.UserMessageOutcome toCoordinator = runtime.sendUserMessage(root, "please summarize");
            Assertions.assertTrue(toCoordinator.success());
            Assertions.assertEquals("agentA", toCoordinator.targetAlias());
            Assertions.assertEquals(Prompts.userMessageSent("agentA"), toCoordinator.message());
            MailMessage mail = runtime.mailbox().unhandled(a).get(0);
            Assertions.assertEquals(Prompts.USER_SENDER, mail.from());
            Assertions.assertEquals(Prompts.userMessage("please summarize"), mail.body());

            runtime.onSessionIdle(b);
            Assertions.assertTrue(runtime.sendUserMessage(root, "@agentB stop now").success());
            long deadline = System.currentTimeMillis() + 5_000L;
            while (directory.prompts(b).isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(5L);
            }
            Assertions.assertEquals(List.of(Prompts.resumeBroadcast(Prompts.USER_SENDER)), directory.prompts(b));

            Assertions.assertEquals(Prompts.userTargetNotFound("agentZ"), runtime.sendUserMessage(root, "@agentZ hi").message());
            Assertions.assertEquals(Prompts.USER_MESSAGE_EMPTY, runtime.sendUserMessage(root, "  ").message());
        }
    }

    @Test
    void replyToUserMessageLandsInRootSession() throws Exception {
        LocalSessionDirectory directory = new LocalSessionDirectory();
        AuditLogger audit = AuditLogger.inMemory(200);
        try (AgentMeshRuntime runtime = new AgentMeshRuntime(config(DeliveryMode.INBOX), directory, audit)) {
            String root = directory.addSession(null, "root");
            String a = spawn(runtime, directory, root, "Write parser");

            Assertions.assertTrue(runtime.sendUserMessage(root, "@agentA please report").success());
            MailMessage fromUser = runtime.mailbox().unhandled(a).get(0);
            Assertions.assertEquals(Prompts.USER_SENDER, fromUser.from());

            ToolResult reply = runtime.broadcast(a, new BroadcastArgs(null, "parser is done", fromUser.seq()));

            Assertions.assertFalse(reply.error(), reply.text());
            Assertions.assertTrue(reply.text().contains("Replied to #" + fromUser.seq() + " from user"));
            Assertions.assertTrue(runtime.mailbox().unhandled(a).isEmpty());
            Assertions.assertTrue(directory.notes(root).stream()
                    .anyMatch(note -> note.endsWith("[agentA] -> [user]: parser is done")));
            Assertions.assertEquals("ok", audit.rows("mailbox.reply_user").get(0).path("result").asText());
        }
    }

    @Test
    void malformedToolArgumentsBecomeErrorResults() throws Exception {
        LocalSessionDirectory directory = new LocalSessionDirectory();
        try (AgentMeshRuntime runtime = new AgentMeshRuntime(config(DeliveryMode.INBOX), directory, AuditLogger.inMemory(50))) {
            String root = directory.addSession(null, "root");
            String a = spawn(runtime, directory, root, null);

            ToolResult result = runtime.broadcast(a, Jsons.readTree("{\"message\":\"m\",\"reply_to\":\"later\"}"));

            Assertions.assertTrue(result.error());
            Assertions.assertTrue(result.text().startsWith("Error: reply_to must be a message id"));
            Assertions.assertEquals(Prompts.SUBAGENT_NOT_CHILD_SESSION, runtime.subagent(root, new SubagentArgs("x", null)).text());
        }
    }

    private static String spawn(AgentMeshRuntime runtime, LocalSessionDirectory directory, String root, String description) {
        runtime.onToolStarting(root, ToolCompletion.TASK_TOOL, description);
        String id = directory.addSession(root, description == null ? "child" : description);
        Assertions.assertTrue(runtime.onSessionStart(id).isPresent());
        return id;
    }

    private static void waitUntilAwaiting(AgentMeshRuntime runtime, String sessionId) throws HostException {
        long deadline = System.currentTimeMillis() + 5_000L;
        try {
            while (!runtime.barrier().isAwaiting(sessionId) && System.currentTimeMillis() < deadline) {
                Thread.sleep(5L);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HostException("interrupted while waiting for the caller", e);
        }
    }

    private static AgentMeshConfig config(DeliveryMode mode) {
        AgentMeshConfig.Settings d = AgentMeshConfig.Settings.defaults();
        return AgentMeshConfig.of(new AgentMeshConfig.Settings(
                d.maxInboxSize(),
                d.maxMessageLength(),
                d.handledTtlMs(),
                d.unhandledTtlMs(),
                d.parentCacheTtlMs(),
                d.reaperIntervalMs(),
                d.maxStatusHistory(),
                d.maxStatusLength(),
                d.maxResumeChain(),
                d.barrierMaxIterations(),
                2_000L,
                10L,
                5_000L,
                d.maxSubagentDepth(),
                2,
                d.workerQueueCapacity(),
                mode,
                d.sessionUpdates(),
                false
        ));
    }
}
