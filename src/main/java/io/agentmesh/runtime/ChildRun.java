package io.agentmesh.runtime;

import io.agentmesh.host.HostException;
import io.agentmesh.host.SessionDirectory;
import io.agentmesh.host.SessionTranscripts;
import io.agentmesh.ledger.StatusLedger;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.observability.SessionUpdateNotifier;
import io.agentmesh.prompt.Prompts;
import io.agentmesh.session.OutputDelivery;
import io.agentmesh.session.ResumeCoordinator;
import io.agentmesh.session.SessionStateTracker;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One spawned child from first prompt to delivered output.
 *
 * <p>The output is delivered before the child is marked idle, so a caller waiting at its
 * completion barrier sees the output no later than it sees the child drained.
 */
final class ChildRun implements Runnable {
    private final SessionDirectory directory;
    private final SessionStateTracker tracker;
    private final StatusLedger ledger;
    private final OutputDelivery delivery;
    private final ResumeCoordinator resumeCoordinator;
    private final SessionUpdateNotifier notifier;
    private final AuditLogger auditLogger;
    private final Duration promptTimeout;
    private final String callerSessionId;
    private final String childSessionId;
    private final String childAlias;
    private final String prompt;

    ChildRun(
            SessionDirectory directory,
            SessionStateTracker tracker,
            StatusLedger ledger,
            OutputDelivery delivery,
            ResumeCoordinator resumeCoordinator,
            SessionUpdateNotifier notifier,
            AuditLogger auditLogger,
            Duration promptTimeout,
            String callerSessionId,
            String childSessionId,
            String childAlias,
            String prompt
    ) {
        this.directory = directory;
        this.tracker = tracker;
        this.ledger = ledger;
        this.delivery = delivery;
        this.resumeCoordinator = resumeCoordinator;
        this.notifier = notifier;
        this.auditLogger = auditLogger;
        this.promptTimeout = promptTimeout;
        this.callerSessionId = callerSessionId;
        this.childSessionId = childSessionId;
        this.childAlias = childAlias;
        this.prompt = prompt;
    }

    @Override
    public void run() {
        String output;
        String result = "ok";
        try {
            directory.prompt(childSessionId, prompt, promptTimeout);
            output = SessionTranscripts.finalOutput(directory.messages(childSessionId), childSessionId, childAlias);
        } catch (HostException | RuntimeException e) {
            result = "error";
            output = Prompts.subagentError(String.valueOf(e.getMessage()));
        }
        finish(output, result);
    }

    /**
     * Completes the child without running it, as when the worker pool refuses the task.
     */
    void abandon(String reason) {
        finish(Prompts.subagentError(reason), "rejected");
    }

    private void finish(String output, String result) {
        try {
            ledger.archive(childAlias, output);
            delivery.deliver(callerSessionId, childAlias, output);
        } finally {
            tracker.markIdle(childSessionId);
        }
        notifier.subagentCompleted(childSessionId, childAlias);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("child_session", childSessionId);
        details.put("delivery", delivery.mode().wireName());
        details.put("output_chars", output.length());
        auditLogger.log(AuditLogger.AuditEvent.of("subagent.complete", childAlias, "agent/" + childAlias, result, details));

        resumeCoordinator.resumePending(childSessionId);
    }
}
