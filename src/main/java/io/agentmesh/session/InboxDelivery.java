package io.agentmesh.session;

import io.agentmesh.bus.MailboxStore;
import io.agentmesh.model.MailMessage;
import io.agentmesh.prompt.Prompts;

/**
 * Posts the output as a mailbox message from the child and wakes the caller if it is idle.
 * An active caller finds it in its next inbox turn or at its completion barrier.
 */
public final class InboxDelivery implements OutputDelivery {
    private final MailboxStore mailbox;
    private final ResumeCoordinator resumeCoordinator;

    public InboxDelivery(MailboxStore mailbox, ResumeCoordinator resumeCoordinator) {
        this.mailbox = mailbox;
        this.resumeCoordinator = resumeCoordinator;
    }

    @Override
    public DeliveryMode mode() {
        return DeliveryMode.INBOX;
    }

    @Override
    public void deliver(String callerSessionId, String childAlias, String output) {
        MailMessage message = mailbox.send(childAlias, callerSessionId, Prompts.receivedSubagentOutput(childAlias, output));
        resumeCoordinator.wakeFor(message);
    }
}
