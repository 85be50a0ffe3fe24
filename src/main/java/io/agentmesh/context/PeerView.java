package io.agentmesh.context;

import io.agentmesh.ledger.StatusLedger;
import io.agentmesh.model.AgentIdentity;
import io.agentmesh.model.AgentState;
import io.agentmesh.model.ParallelAgent;
import io.agentmesh.registry.IdentityRegistry;
import io.agentmesh.session.SessionStateTracker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What one agent sees of the others: peers under the same root with their status history.
 */
public final class PeerView {
    private final IdentityRegistry registry;
    private final StatusLedger ledger;
    private final SessionStateTracker tracker;

    public PeerView(IdentityRegistry registry, StatusLedger ledger, SessionStateTracker tracker) {
        this.registry = registry;
        this.ledger = ledger;
        this.tracker = tracker;
    }

    public List<ParallelAgent> peersOf(String sessionId) {
        List<ParallelAgent> out = new ArrayList<>();
        for (AgentIdentity peer : registry.peers(sessionId)) {
            out.add(new ParallelAgent(peer.alias(), ledger.statusHistory(peer.alias()), tracker.isIdle(peer.sessionId())));
        }
        return out;
    }

    /**
     * Live agents under the caller's root, the caller included, with their current state.
     */
    public Map<String, AgentState> liveStates(String sessionId) {
        String root = registry.rootOf(sessionId).orElse(null);
        Map<String, AgentState> out = new LinkedHashMap<>();
        for (AgentIdentity identity : registry.liveIdentitiesUnder(root)) {
            out.put(identity.alias(), tracker.isIdle(identity.sessionId()) ? AgentState.IDLE : AgentState.ACTIVE);
        }
        return out;
    }
}
