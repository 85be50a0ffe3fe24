package io.agentmesh.barrier;

import io.agentmesh.bus.MailboxStore;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.prompt.Prompts;
import io.agentmesh.registry.IdentityRegistry;
import io.agentmesh.session.PendingOutputStore;
import io.agentmesh.session.SessionStateTracker;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

final class CompletionBarrierTest {
    private final IdentityRegistry registry = new IdentityRegistry();
    private final SessionStateTracker tracker = new SessionStateTracker(registry);
    private final MailboxStore mailbox = new MailboxStore(100, 10_000);
    private final PendingOutputStore pending = new PendingOutputStore();
    private final AuditLogger audit = AuditLogger.inMemory(100);

    private CompletionBarrier barrier(int maxIterations, long childTimeoutMs) {
        return new CompletionBarrier(tracker, mailbox, pending, registry, audit, maxIterations, childTimeoutMs, 10L);
    }

    @Test
    void satisfiedWithNothingPending() {
        registry.register("caller", "root");
        BarrierOutcome outcome = barrier(100, 1_000L).await("caller");
        Assertions.assertEquals(BarrierOutcome.Kind.SATISFIED, outcome.kind());
        Assertions.assertTrue(outcome.mayComplete());
    }

    @Test
    void waitsForBothChildrenIncludingLateMail() throws Exception {
        registry.register("caller", "root");
        registry.register("c1", "root");
        registry.register("c2", "root");
        tracker.markActive("c1");
        tracker.markActive("c2");
        CompletionBarrier barrier = barrier(100, 5_000L);
        barrier.addPending("caller", "c1");
        barrier.addPending("caller", "c2");

        CompletableFuture<BarrierOutcome> waiting = CompletableFuture.supplyAsync(() -> barrier.await("caller"));

        Thread.sleep(50L);
        tracker.markIdle("c1");
        Thread.sleep(50L);
        Assertions.assertFalse(waiting.isDone());

        // c2 goes idle with mail nobody showed it yet; it stays pending until that mail is presented.
        mailbox.send("agentA", "c2", "late question");
        tracker.markIdle("c2");
        Thread.sleep(80L);
        Assertions.assertFalse(waiting.isDone());
        Assertions.assertTrue(barrier.isAwaiting("caller"));
        Assertions.assertEquals(Set.of("c2"), barrier.pending("caller"));

        mailbox.markPresented("c2", List.of(1L));
        BarrierOutcome outcome = waiting.get(5, TimeUnit.SECONDS);

        Assertions.assertEquals(BarrierOutcome.Kind.SATISFIED, outcome.kind());
        Assertions.assertTrue(barrier.pending("caller").isEmpty());
        Assertions.assertFalse(barrier.isAwaiting("caller"));
    }

    @Test
    void unpresentedCallerMailResumesCaller() {
        registry.register("caller", "root");
        mailbox.send("agentB", "caller", "one");
        mailbox.send("agentC", "caller", "two");

        BarrierOutcome outcome = barrier(100, 1_000L).await("caller");

        Assertions.assertEquals(BarrierOutcome.Kind.RESUME, outcome.kind());
        Assertions.assertEquals(Prompts.resumeBroadcast("agentB"), outcome.resumePrompt());
        Assertions.assertFalse(outcome.mayComplete());
        Assertions.assertTrue(mailbox.isPresented("caller", 1L));
        Assertions.assertFalse(mailbox.isPresented("caller", 2L));
    }

    @Test
    void pendingOutputWinsOverMail() {
        registry.register("caller", "root");
        mailbox.send("agentB", "caller", "one");
        pending.put("caller", "agentC", "output of agentC");

        BarrierOutcome outcome = barrier(100, 1_000L).await("caller");

        Assertions.assertEquals(BarrierOutcome.Kind.RESUME, outcome.kind());
        Assertions.assertEquals("output of agentC", outcome.resumePrompt());
        Assertions.assertFalse(pending.has("caller"));
        Assertions.assertTrue(mailbox.hasNeedingWake("caller"));
    }

    @Test
    void childThatNeverGoesIdleIsGivenUpAfterItsTimeout() {
        registry.register("caller", "root");
        registry.register("stuck", "root");
        tracker.markActive("stuck");
        CompletionBarrier barrier = barrier(100, 50L);
        barrier.addPending("caller", "stuck");

        long started = System.currentTimeMillis();
        BarrierOutcome outcome = barrier.await("caller");
        long tookMs = System.currentTimeMillis() - started;

        Assertions.assertEquals(BarrierOutcome.Kind.SATISFIED, outcome.kind());
        Assertions.assertEquals(2, outcome.iterations());
        Assertions.assertTrue(tookMs < 2_000L, "took " + tookMs + "ms");
        Assertions.assertTrue(barrier.pending("caller").isEmpty());
        Assertions.assertEquals("child_timeout", audit.rows("barrier.await").get(0).path("result").asText());
    }

    @Test
    void abortsAfterIterationCapWhileChildMailStaysUnpresented() {
        registry.register("caller", "root");
        registry.register("busy", "root");
        tracker.markIdle("busy");
        mailbox.send("agentA", "busy", "nobody presents this");
        CompletionBarrier barrier = barrier(3, 20L);
        barrier.addPending("caller", "busy");

        BarrierOutcome outcome = barrier.await("caller");

        Assertions.assertEquals(BarrierOutcome.Kind.ABORTED, outcome.kind());
        Assertions.assertEquals(3, outcome.iterations());
        Assertions.assertTrue(outcome.mayComplete());
        Assertions.assertEquals(Set.of("busy"), barrier.pending("caller"));
        Assertions.assertEquals("aborted", audit.rows("barrier.await").get(0).path("result").asText());
    }

    @Test
    void removePendingAndResetClearState() {
        CompletionBarrier barrier = barrier(100, 1_000L);
        barrier.addPending("caller", "c1");
        barrier.addPending("caller", "c2");
        Assertions.assertTrue(barrier.removePending("caller", "c1"));
        Assertions.assertFalse(barrier.removePending("caller", "c1"));
        barrier.reset();
        Assertions.assertTrue(barrier.pending("caller").isEmpty());
    }
}
