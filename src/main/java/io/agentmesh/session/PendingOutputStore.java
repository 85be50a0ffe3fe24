package io.agentmesh.session;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Child output waiting to be shown to a caller that could not take a visible note.
 * Consumed by the completion barrier or by the caller's next context assembly.
 */
public final class PendingOutputStore {
    private final Map<String, PendingOutput> pending = new HashMap<>();

    public synchronized void put(String callerSessionId, String senderAlias, String text) {
        PendingOutput existing = pending.get(callerSessionId);
        if (existing == null) {
            pending.put(callerSessionId, new PendingOutput(senderAlias, text));
            return;
        }
        pending.put(callerSessionId, new PendingOutput(
                existing.senderAlias() + ", " + senderAlias,
                existing.text() + "\n\n" + text
        ));
    }

    public synchronized Optional<PendingOutput> take(String callerSessionId) {
        return Optional.ofNullable(pending.remove(callerSessionId));
    }

    public synchronized boolean has(String callerSessionId) {
        return pending.containsKey(callerSessionId);
    }

    public synchronized void reset() {
        pending.clear();
    }

    public record PendingOutput(String senderAlias, String text) {
    }
}
