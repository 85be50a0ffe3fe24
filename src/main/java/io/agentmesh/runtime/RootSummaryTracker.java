package io.agentmesh.runtime;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * First-level children per root session.
 *
 * <p>A root gets its summary once, when the last of its tracked children completes. Tracking a
 * new child after that starts a new batch and allows another summary.
 */
public final class RootSummaryTracker {
    private final Map<String, LinkedHashSet<String>> active = new HashMap<>();
    private final Map<String, Set<String>> completed = new HashMap<>();
    private final Map<String, String> coordinators = new HashMap<>();
    private final Set<String> summarized = new HashSet<>();

    /**
     * @return true when {@code childId} was not tracked before
     */
    public synchronized boolean track(String rootId, String childId) {
        if (rootId == null || childId == null) {
            return false;
        }
        if (completed.getOrDefault(rootId, Set.of()).contains(childId)) {
            return false;
        }
        LinkedHashSet<String> children = active.computeIfAbsent(rootId, ignored -> new LinkedHashSet<>());
        if (!children.add(childId)) {
            return false;
        }
        if (summarized.remove(rootId)) {
            completed.remove(rootId);
            coordinators.remove(rootId);
        }
        coordinators.putIfAbsent(rootId, childId);
        return true;
    }

    /**
     * Marks {@code childId} completed.
     *
     * @return true when this was the last active child and the root has not been summarized yet;
     * the root counts as summarized from here on
     */
    public synchronized boolean complete(String rootId, String childId) {
        if (rootId == null || summarized.contains(rootId)) {
            return false;
        }
        LinkedHashSet<String> children = active.get(rootId);
        if (children != null) {
            children.remove(childId);
            completed.computeIfAbsent(rootId, ignored -> new HashSet<>()).add(childId);
            if (!children.isEmpty()) {
                return false;
            }
        }
        active.remove(rootId);
        summarized.add(rootId);
        return true;
    }

    /**
     * The first child tracked for {@code rootId} in the current batch.
     */
    public synchronized Optional<String> coordinatorOf(String rootId) {
        return Optional.ofNullable(coordinators.get(rootId));
    }

    public synchronized boolean isSummarized(String rootId) {
        return summarized.contains(rootId);
    }

    public synchronized int activeChildren(String rootId) {
        LinkedHashSet<String> children = active.get(rootId);
        return children == null ? 0 : children.size();
    }

    public synchronized boolean hasActiveBatch() {
        return !active.isEmpty();
    }
}
