package io.agentmesh.ledger;

import io.agentmesh.model.AgentState;
import io.agentmesh.model.CompletedAgentRecord;
import io.agentmesh.model.RecallEntry;
import io.agentmesh.prompt.Prompts;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Status history per alias plus the archive of completed agents.
 *
 * <p>Live histories are dropped on reset; archived records are kept for the life of the process
 * so agents of a later batch can still recall what earlier ones did.
 */
public final class StatusLedger {
    private final int maxHistory;
    private final int maxStatusLength;
    private final LongSupplier clock;
    private final Map<String, LinkedList<String>> histories = new HashMap<>();
    private final Map<String, String> outputs = new HashMap<>();
    private final Map<String, CompletedAgentRecord> archive = new LinkedHashMap<>();

    public StatusLedger(int maxHistory, int maxStatusLength) {
        this(maxHistory, maxStatusLength, System::currentTimeMillis);
    }

    public StatusLedger(int maxHistory, int maxStatusLength, LongSupplier clock) {
        this.maxHistory = Math.max(1, maxHistory);
        this.maxStatusLength = Math.max(1, maxStatusLength);
        this.clock = clock;
    }

    public synchronized void appendStatus(String alias, String text) {
        if (alias == null || text == null || text.isBlank()) {
            return;
        }
        String entry = text.length() > maxStatusLength ? text.substring(0, maxStatusLength) : text;
        LinkedList<String> history = histories.computeIfAbsent(alias, ignored -> new LinkedList<>());
        history.addLast(entry);
        while (history.size() > maxHistory) {
            history.removeFirst();
        }
    }

    public synchronized List<String> statusHistory(String alias) {
        LinkedList<String> history = histories.get(alias);
        return history == null ? List.of() : List.copyOf(history);
    }

    public synchronized void recordOutput(String alias, String output) {
        if (alias != null && output != null) {
            outputs.put(alias, output);
        }
    }

    /**
     * Archives {@code alias} with its current history. Archiving the same alias again updates
     * the record in place.
     */
    public synchronized CompletedAgentRecord archive(String alias, String finalOutput) {
        outputs.put(alias, finalOutput == null ? "" : finalOutput);
        CompletedAgentRecord record = new CompletedAgentRecord(
                alias,
                statusHistory(alias),
                finalOutput,
                clock.getAsLong()
        );
        archive.put(alias, record);
        return record;
    }

    public synchronized Optional<CompletedAgentRecord> archived(String alias) {
        return Optional.ofNullable(archive.get(alias));
    }

    public synchronized List<CompletedAgentRecord> archived() {
        return List.copyOf(archive.values());
    }

    /**
     * Archived agents first, then live ones not archived. With {@code alias} set, only that agent;
     * its output is included when {@code includeOutput} is set.
     *
     * @param liveAgents live aliases with their current state, in display order
     */
    public synchronized List<RecallEntry> query(String alias, boolean includeOutput, Map<String, AgentState> liveAgents) {
        Map<String, AgentState> live = liveAgents == null ? Map.of() : liveAgents;
        boolean withOutput = alias != null && includeOutput;
        List<RecallEntry> out = new ArrayList<>();
        for (CompletedAgentRecord record : archive.values()) {
            if (alias != null && !alias.equals(record.alias())) {
                continue;
            }
            out.add(new RecallEntry(
                    record.alias(),
                    record.statusHistory(),
                    AgentState.COMPLETED,
                    withOutput ? record.finalOutput() : null
            ));
        }
        for (Map.Entry<String, AgentState> entry : live.entrySet()) {
            String name = entry.getKey();
            if (archive.containsKey(name) || (alias != null && !alias.equals(name))) {
                continue;
            }
            String output = null;
            if (withOutput) {
                output = outputs.get(name);
                if (output == null) {
                    output = entry.getValue() == AgentState.ACTIVE
                            ? Prompts.RECALL_AGENT_ACTIVE
                            : Prompts.RECALL_AGENT_IDLE_NO_OUTPUT;
                }
            }
            out.add(new RecallEntry(name, statusHistory(name), entry.getValue(), output));
        }
        return out;
    }

    public synchronized int clearLive() {
        int cleared = histories.size();
        histories.clear();
        outputs.clear();
        return cleared;
    }
}
