package io.agentmesh.session;

import io.agentmesh.host.HostException;
import io.agentmesh.host.SessionDirectory;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.prompt.Prompts;

import java.util.Map;
import java.util.function.Predicate;

/**
 * Shows the output as a user message in the caller's transcript.
 *
 * <p>An idle caller is resumed with the output as its prompt. A caller held at its completion
 * barrier gets it as the barrier's resume prompt. Any other active caller receives a visible
 * note; if the host rejects the note the output is kept for the barrier instead.
 */
public final class UserMessageDelivery implements OutputDelivery {
    private final SessionDirectory directory;
    private final SessionStateTracker tracker;
    private final PendingOutputStore pendingOutputs;
    private final ResumeCoordinator resumeCoordinator;
    private final Predicate<String> awaitingBarrier;
    private final AuditLogger auditLogger;

    public UserMessageDelivery(
            SessionDirectory directory,
            SessionStateTracker tracker,
            PendingOutputStore pendingOutputs,
            ResumeCoordinator resumeCoordinator,
            Predicate<String> awaitingBarrier,
            AuditLogger auditLogger
    ) {
        this.directory = directory;
        this.tracker = tracker;
        this.pendingOutputs = pendingOutputs;
        this.resumeCoordinator = resumeCoordinator;
        this.awaitingBarrier = awaitingBarrier;
        this.auditLogger = auditLogger;
    }

    @Override
    public DeliveryMode mode() {
        return DeliveryMode.USER_MESSAGE;
    }

    @Override
    public void deliver(String callerSessionId, String childAlias, String output) {
        String text = Prompts.subagentOutput(childAlias, output);
        if (tracker.isIdle(callerSessionId)
                && !ResumeCoordinator.refused(resumeCoordinator.resumeWith(callerSessionId, text, childAlias, "subagent output"))) {
            return;
        }
        if (awaitingBarrier.test(callerSessionId)) {
            pendingOutputs.put(callerSessionId, childAlias, text);
            return;
        }
        try {
            directory.note(callerSessionId, text);
        } catch (HostException e) {
            pendingOutputs.put(callerSessionId, childAlias, text);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "delivery.note",
                    childAlias,
                    "session/" + callerSessionId,
                    "deferred",
                    Map.of("error", String.valueOf(e.getMessage()))
            ));
        }
    }
}
