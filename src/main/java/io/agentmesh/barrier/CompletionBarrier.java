package io.agentmesh.barrier;

import io.agentmesh.bus.MailboxStore;
import io.agentmesh.model.MailMessage;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.prompt.Prompts;
import io.agentmesh.registry.IdentityRegistry;
import io.agentmesh.session.PendingOutputStore;
import io.agentmesh.session.SessionStateTracker;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds a session at its completion point until every child it spawned has drained.
 *
 * <p>The check is level-triggered: each iteration re-reads the pending set, child states and
 * mailboxes, so children or mail added between polls are still observed. A child leaves the
 * pending set once it has been waited for, idle or timed out, and has no mail that still needs
 * a wake. A timed-out child is given up on, not treated as an error.
 */
public final class CompletionBarrier {
    private final SessionStateTracker tracker;
    private final MailboxStore mailbox;
    private final PendingOutputStore pendingOutputs;
    private final IdentityRegistry registry;
    private final AuditLogger auditLogger;
    private final int maxIterations;
    private final long childTimeoutMs;
    private final long pollIntervalMs;
    private final Map<String, Set<String>> pending = new HashMap<>();
    private final Set<String> awaiting = new HashSet<>();

    public CompletionBarrier(
            SessionStateTracker tracker,
            MailboxStore mailbox,
            PendingOutputStore pendingOutputs,
            IdentityRegistry registry,
            AuditLogger auditLogger,
            int maxIterations,
            long childTimeoutMs,
            long pollIntervalMs
    ) {
        this.tracker = tracker;
        this.mailbox = mailbox;
        this.pendingOutputs = pendingOutputs;
        this.registry = registry;
        this.auditLogger = auditLogger;
        this.maxIterations = Math.max(1, maxIterations);
        this.childTimeoutMs = Math.max(1L, childTimeoutMs);
        this.pollIntervalMs = Math.max(1L, pollIntervalMs);
    }

    public synchronized void addPending(String callerSessionId, String childSessionId) {
        pending.computeIfAbsent(callerSessionId, ignored -> new LinkedHashSet<>()).add(childSessionId);
    }

    public synchronized boolean removePending(String callerSessionId, String childSessionId) {
        Set<String> children = pending.get(callerSessionId);
        if (children == null) {
            return false;
        }
        boolean removed = children.remove(childSessionId);
        if (children.isEmpty()) {
            pending.remove(callerSessionId);
        }
        return removed;
    }

    public synchronized Set<String> pending(String callerSessionId) {
        Set<String> children = pending.get(callerSessionId);
        return children == null ? Set.of() : Set.copyOf(children);
    }

    public synchronized boolean isAwaiting(String callerSessionId) {
        return awaiting.contains(callerSessionId);
    }

    public BarrierOutcome await(String callerSessionId) {
        synchronized (this) {
            awaiting.add(callerSessionId);
        }
        try {
            return loop(callerSessionId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            audit(callerSessionId, "interrupted", Map.of());
            return BarrierOutcome.aborted(0);
        } finally {
            synchronized (this) {
                awaiting.remove(callerSessionId);
            }
        }
    }

    private BarrierOutcome loop(String callerSessionId) throws InterruptedException {
        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            Set<String> children = pending(callerSessionId);
            if (!children.isEmpty()) {
                Set<String> idle = tracker.awaitIdle(children, childTimeoutMs, pollIntervalMs);
                List<String> drained = new ArrayList<>();
                for (String child : children) {
                    if (!idle.contains(child)) {
                        // Waited the full child timeout; stop holding the caller for it.
                        audit(callerSessionId, "child_timeout", Map.of(
                                "child", registry.alias(child),
                                "timeout_ms", childTimeoutMs
                        ));
                    }
                    if (!mailbox.hasNeedingWake(child)) {
                        drained.add(child);
                    }
                }
                for (String child : drained) {
                    removePending(callerSessionId, child);
                }
                if (drained.isEmpty()) {
                    // Idle children with waiting mail are about to be resumed; give them a poll.
                    Thread.sleep(pollIntervalMs);
                }
                continue;
            }
            Optional<PendingOutputStore.PendingOutput> output = pendingOutputs.take(callerSessionId);
            if (output.isPresent()) {
                return BarrierOutcome.resume(output.get().text(), iteration);
            }
            List<MailMessage> waiting = mailbox.needingWake(callerSessionId);
            if (!waiting.isEmpty()) {
                MailMessage first = waiting.get(0);
                mailbox.markPresented(callerSessionId, List.of(first.seq()));
                return BarrierOutcome.resume(Prompts.resumeBroadcast(first.from()), iteration);
            }
            return BarrierOutcome.satisfied(iteration);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("iterations", maxIterations);
        details.put("pending", pending(callerSessionId).stream().map(registry::alias).toList());
        audit(callerSessionId, "aborted", details);
        return BarrierOutcome.aborted(maxIterations);
    }

    public synchronized void reset() {
        pending.clear();
    }

    private void audit(String callerSessionId, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                "barrier.await",
                "system",
                "agent/" + registry.alias(callerSessionId),
                result,
                details
        ));
    }
}
