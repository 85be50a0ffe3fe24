package io.agentmesh.session;

import io.agentmesh.model.SessionState;
import io.agentmesh.model.SessionStatus;
import io.agentmesh.registry.IdentityRegistry;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;

public final class SessionStateTracker {
    private final IdentityRegistry registry;
    private final LongSupplier clock;
    private final Map<String, SessionState> states = new HashMap<>();

    public SessionStateTracker(IdentityRegistry registry) {
        this(registry, System::currentTimeMillis);
    }

    public SessionStateTracker(IdentityRegistry registry, LongSupplier clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public void markActive(String sessionId) {
        transition(sessionId, SessionStatus.ACTIVE);
    }

    public void markIdle(String sessionId) {
        transition(sessionId, SessionStatus.IDLE);
    }

    private synchronized void transition(String sessionId, SessionStatus status) {
        if (sessionId == null) {
            return;
        }
        states.put(sessionId, new SessionState(sessionId, registry.alias(sessionId), status, clock.getAsLong()));
        notifyAll();
    }

    /**
     * Moves an idle session to active. Returns false when it is already active or has no state,
     * so at most one caller wins the right to resume it.
     */
    public synchronized boolean tryActivate(String sessionId) {
        SessionState current = states.get(sessionId);
        if (current == null || current.status() != SessionStatus.IDLE) {
            return false;
        }
        states.put(sessionId, new SessionState(sessionId, current.alias(), SessionStatus.ACTIVE, clock.getAsLong()));
        return true;
    }

    public synchronized boolean isIdle(String sessionId) {
        SessionState state = states.get(sessionId);
        return state != null && state.idle();
    }

    public synchronized Optional<SessionState> state(String sessionId) {
        return Optional.ofNullable(states.get(sessionId));
    }

    /**
     * Waits until every session in {@code sessionIds} is idle or its timeout elapsed. All
     * sessions share the same start, so each one gets the full {@code timeoutMs}.
     *
     * @return the sessions observed idle when the wait ended
     */
    public Set<String> awaitIdle(Collection<String> sessionIds, long timeoutMs, long pollIntervalMs)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + Math.max(0L, timeoutMs);
        long poll = Math.max(1L, pollIntervalMs);
        synchronized (this) {
            while (true) {
                Set<String> idle = new LinkedHashSet<>();
                for (String id : sessionIds) {
                    if (isIdle(id)) {
                        idle.add(id);
                    }
                }
                long remaining = deadline - System.currentTimeMillis();
                if (idle.size() == sessionIds.size() || remaining <= 0L) {
                    return idle;
                }
                wait(Math.min(poll, remaining));
            }
        }
    }

    public boolean awaitIdle(String sessionId, long timeoutMs, long pollIntervalMs) throws InterruptedException {
        return awaitIdle(Set.of(sessionId), timeoutMs, pollIntervalMs).contains(sessionId);
    }

    public synchronized void reset() {
        states.clear();
        notifyAll();
    }
}
