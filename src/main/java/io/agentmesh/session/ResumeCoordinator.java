package io.agentmesh.session;

import io.agentmesh.bus.MailboxStore;
import io.agentmesh.host.HostException;
import io.agentmesh.host.SessionDirectory;
import io.agentmesh.model.MailMessage;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.observability.SessionUpdateNotifier;
import io.agentmesh.prompt.Prompts;
import io.agentmesh.registry.IdentityRegistry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Turns mail for an idle session into an active wake.
 *
 * <p>Only the caller that moves the session from idle to active starts a resume, so concurrent
 * senders never prompt the same session twice. After each resumed turn the session is marked
 * idle again and re-checked: if mail that was never presented is waiting, the first such message
 * is marked presented and the session is resumed once more, up to {@code maxResumeChain} turns.
 */
public final class ResumeCoordinator {
    private final SessionDirectory directory;
    private final SessionStateTracker tracker;
    private final MailboxStore mailbox;
    private final IdentityRegistry registry;
    private final SessionUpdateNotifier notifier;
    private final AuditLogger auditLogger;
    private final Executor executor;
    private final int maxResumeChain;
    private final Duration promptTimeout;

    public ResumeCoordinator(
            SessionDirectory directory,
            SessionStateTracker tracker,
            MailboxStore mailbox,
            IdentityRegistry registry,
            SessionUpdateNotifier notifier,
            AuditLogger auditLogger,
            Executor executor,
            int maxResumeChain,
            long promptTimeoutMs
    ) {
        this.directory = directory;
        this.tracker = tracker;
        this.mailbox = mailbox;
        this.registry = registry;
        this.notifier = notifier;
        this.auditLogger = auditLogger;
        this.executor = executor;
        this.maxResumeChain = Math.max(1, maxResumeChain);
        this.promptTimeout = Duration.ofMillis(Math.max(1L, promptTimeoutMs));
    }

    /**
     * Wakes {@code sessionId} with the short broadcast notification if it is idle.
     */
    public CompletableFuture<ResumeOutcome> wake(String sessionId, String senderAlias) {
        return start(sessionId, Prompts.resumeBroadcast(senderAlias), senderAlias, "message");
    }

    /**
     * Wakes the recipient of {@code message} if idle, marking the message presented first.
     * An active recipient is left alone and the message keeps counting as needing a wake.
     */
    public CompletableFuture<ResumeOutcome> wakeFor(MailMessage message) {
        if (!tracker.tryActivate(message.to())) {
            return CompletableFuture.completedFuture(ResumeOutcome.notStarted(message.to()));
        }
        mailbox.markPresented(message.to(), List.of(message.seq()));
        return submit(message.to(), Prompts.resumeBroadcast(message.from()), message.from(), "message");
    }

    /**
     * Resumes an idle session that still has mail nobody presented to it.
     */
    public CompletableFuture<ResumeOutcome> resumePending(String sessionId) {
        List<MailMessage> waiting = mailbox.needingWake(sessionId);
        if (waiting.isEmpty() || !tracker.isIdle(sessionId)) {
            return CompletableFuture.completedFuture(ResumeOutcome.notStarted(sessionId));
        }
        return wakeFor(waiting.get(0));
    }

    /**
     * Resumes an idle session with an arbitrary first prompt; the rest of the chain is the same.
     */
    public CompletableFuture<ResumeOutcome> resumeWith(String sessionId, String prompt, String resumedBy, String reason) {
        return start(sessionId, prompt, resumedBy, reason);
    }

    /**
     * True when the resume never got to prompt the session: it was not idle, or the executor
     * refused the task.
     */
    public static boolean refused(CompletableFuture<ResumeOutcome> resume) {
        if (!resume.isDone() || resume.isCompletedExceptionally()) {
            return false;
        }
        ResumeOutcome outcome = resume.join();
        return outcome.kind() == ResumeOutcome.Kind.NOT_IDLE
                || (outcome.kind() == ResumeOutcome.Kind.FAILED && outcome.turns() == 0);
    }

    private CompletableFuture<ResumeOutcome> start(String sessionId, String prompt, String resumedBy, String reason) {
        if (!tracker.tryActivate(sessionId)) {
            return CompletableFuture.completedFuture(ResumeOutcome.notStarted(sessionId));
        }
        return submit(sessionId, prompt, resumedBy, reason);
    }

    private CompletableFuture<ResumeOutcome> submit(String sessionId, String prompt, String resumedBy, String reason) {
        try {
            return CompletableFuture.supplyAsync(() -> runChain(sessionId, prompt, resumedBy, reason), executor);
        } catch (RejectedExecutionException e) {
            tracker.markIdle(sessionId);
            audit("session.resume", sessionId, "rejected", Map.of("error", String.valueOf(e.getMessage())));
            return CompletableFuture.completedFuture(new ResumeOutcome(sessionId, ResumeOutcome.Kind.FAILED, 0));
        }
    }

    private ResumeOutcome runChain(String sessionId, String firstPrompt, String firstResumedBy, String reason) {
        try {
            return chain(sessionId, firstPrompt, firstResumedBy, reason);
        } catch (RuntimeException e) {
            tracker.markIdle(sessionId);
            audit("session.resume", sessionId, "error", Map.of("error", String.valueOf(e.getMessage())));
            return new ResumeOutcome(sessionId, ResumeOutcome.Kind.FAILED, 0);
        }
    }

    private ResumeOutcome chain(String sessionId, String firstPrompt, String firstResumedBy, String reason) {
        String prompt = firstPrompt;
        String resumedBy = firstResumedBy;
        int turns = 0;
        while (true) {
            turns++;
            notifier.sessionResumed(sessionId, resumedBy, reason);
            try {
                directory.prompt(sessionId, prompt, promptTimeout);
            } catch (HostException | RuntimeException e) {
                tracker.markIdle(sessionId);
                audit("session.resume", sessionId, "error", Map.of(
                        "turn", turns,
                        "error", String.valueOf(e.getMessage())
                ));
                return new ResumeOutcome(sessionId, ResumeOutcome.Kind.FAILED, turns);
            }
            tracker.markIdle(sessionId);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("turn", turns);
            details.put("resumed_by", resumedBy == null ? "" : resumedBy);
            audit("session.resume", sessionId, "ok", details);

            List<MailMessage> waiting = mailbox.needingWake(sessionId);
            if (waiting.isEmpty()) {
                return new ResumeOutcome(sessionId, ResumeOutcome.Kind.COMPLETED, turns);
            }
            if (turns >= maxResumeChain) {
                audit("session.resume", sessionId, "abandoned", Map.of(
                        "turns", turns,
                        "waiting", waiting.size()
                ));
                return new ResumeOutcome(sessionId, ResumeOutcome.Kind.ABANDONED, turns);
            }
            MailMessage next = waiting.get(0);
            mailbox.markPresented(sessionId, List.of(next.seq()));
            if (!tracker.tryActivate(sessionId)) {
                // Someone else resumed it between our idle mark and here.
                return new ResumeOutcome(sessionId, ResumeOutcome.Kind.COMPLETED, turns);
            }
            prompt = Prompts.resumeBroadcast(next.from());
            resumedBy = next.from();
        }
    }

    private void audit(String action, String sessionId, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                action,
                "system",
                "agent/" + registry.alias(sessionId),
                result,
                details
        ));
    }

    public record ResumeOutcome(String sessionId, Kind kind, int turns) {
        public enum Kind {
            NOT_IDLE,
            COMPLETED,
            ABANDONED,
            FAILED
        }

        static ResumeOutcome notStarted(String sessionId) {
            return new ResumeOutcome(sessionId, Kind.NOT_IDLE, 0);
        }

        public boolean started() {
            return kind != Kind.NOT_IDLE;
        }
    }
}
