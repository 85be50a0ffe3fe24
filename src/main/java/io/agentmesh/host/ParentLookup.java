package io.agentmesh.host;

import io.agentmesh.observability.AuditLogger;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Cached parent-of lookups against the host. A failed lookup is cached as "no parent" for a
 * minute so a flapping host is not queried on every turn.
 */
public final class ParentLookup {
    static final long FAILURE_RETRY_MS = 60_000L;
    private static final int MAX_ANCESTRY = 64;

    private final SessionDirectory directory;
    private final AuditLogger auditLogger;
    private final long ttlMs;
    private final LongSupplier clock;
    private final Map<String, Cached> cache = new HashMap<>();

    public ParentLookup(SessionDirectory directory, AuditLogger auditLogger, long ttlMs) {
        this(directory, auditLogger, ttlMs, System::currentTimeMillis);
    }

    public ParentLookup(SessionDirectory directory, AuditLogger auditLogger, long ttlMs, LongSupplier clock) {
        this.directory = directory;
        this.auditLogger = auditLogger;
        this.ttlMs = Math.max(0L, ttlMs);
        this.clock = clock;
    }

    public Optional<String> parentOf(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        long now = clock.getAsLong();
        synchronized (cache) {
            Cached cached = cache.get(sessionId);
            if (cached != null && now - cached.cachedAtMs() < ttlMs) {
                return Optional.ofNullable(cached.parentId());
            }
        }
        String parent;
        long cachedAt = now;
        try {
            parent = directory.parentOf(sessionId).orElse(null);
        } catch (HostException e) {
            parent = null;
            cachedAt = now - ttlMs + Math.min(ttlMs, FAILURE_RETRY_MS);
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "host.parent_lookup",
                    "system",
                    "session/" + sessionId,
                    "error",
                    Map.of("error", String.valueOf(e.getMessage()))
            ));
        }
        synchronized (cache) {
            cache.put(sessionId, new Cached(parent, cachedAt));
        }
        return Optional.ofNullable(parent);
    }

    public boolean isChild(String sessionId) {
        return parentOf(sessionId).isPresent();
    }

    /**
     * Topmost ancestor of {@code sessionId}; the session itself when it has no parent.
     */
    public String rootOf(String sessionId) {
        String current = sessionId;
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < MAX_ANCESTRY && seen.add(current); i++) {
            Optional<String> parent = parentOf(current);
            if (parent.isEmpty()) {
                return current;
            }
            current = parent.get();
        }
        return current;
    }

    /**
     * A first-level child: has a parent, and that parent has none.
     */
    public boolean isFirstLevelChild(String sessionId) {
        Optional<String> parent = parentOf(sessionId);
        return parent.isPresent() && parentOf(parent.get()).isEmpty();
    }

    /**
     * Drops entries older than the TTL.
     *
     * @return number of entries removed
     */
    public int expire(long nowMs) {
        synchronized (cache) {
            int before = cache.size();
            cache.values().removeIf(cached -> nowMs - cached.cachedAtMs() > ttlMs);
            return before - cache.size();
        }
    }

    public int cachedEntries() {
        synchronized (cache) {
            return cache.size();
        }
    }

    private record Cached(String parentId, long cachedAtMs) {
    }
}
