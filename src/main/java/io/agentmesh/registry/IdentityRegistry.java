package io.agentmesh.registry;

import io.agentmesh.model.AgentIdentity;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Alias to session bijection for the agents of one process.
 *
 * <p>Session ids are either live (registered since the last {@link #reset()}) or retired.
 * Retired ids are never registered again, so a late lifecycle callback for an agent of a
 * previous batch cannot bring it back under a fresh alias.
 */
public final class IdentityRegistry {
    private static final long REGISTRATION_WAIT_MS = 5_000L;

    private final Object lock = new Object();
    private final AliasSequence aliases;
    private final Map<String, AgentIdentity> bySession = new LinkedHashMap<>();
    private final Map<String, String> sessionByAlias = new HashMap<>();
    private final Map<String, Integer> depths = new HashMap<>();
    private final Set<String> announced = new HashSet<>();
    private final Set<String> retired = new HashSet<>();
    private final Map<String, CompletableFuture<Optional<String>>> registering = new HashMap<>();

    public IdentityRegistry() {
        this(new AliasSequence());
    }

    IdentityRegistry(AliasSequence aliases) {
        this.aliases = aliases;
    }

    /**
     * Registers {@code sessionId} under the next alias, or returns its existing alias.
     * Returns empty for retired ids. Concurrent callers for the same id wait for the first
     * one and all observe the alias it allocated.
     */
    public Optional<String> register(String sessionId, String rootId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        CompletableFuture<Optional<String>> inFlight;
        CompletableFuture<Optional<String>> mine = null;
        synchronized (lock) {
            if (retired.contains(sessionId)) {
                return Optional.empty();
            }
            AgentIdentity existing = bySession.get(sessionId);
            if (existing != null) {
                return Optional.of(existing.alias());
            }
            inFlight = registering.get(sessionId);
            if (inFlight == null) {
                mine = new CompletableFuture<>();
                registering.put(sessionId, mine);
            }
        }
        if (mine == null) {
            return awaitRegistration(sessionId, inFlight);
        }
        try {
            Optional<String> alias = allocate(sessionId, rootId);
            mine.complete(alias);
            return alias;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            synchronized (lock) {
                registering.remove(sessionId);
            }
        }
    }

    private Optional<String> allocate(String sessionId, String rootId) {
        synchronized (lock) {
            if (retired.contains(sessionId)) {
                return Optional.empty();
            }
            String alias = aliases.next();
            String root = rootId == null || rootId.isBlank() ? null : rootId;
            bySession.put(sessionId, new AgentIdentity(sessionId, alias, root));
            sessionByAlias.put(alias, sessionId);
            return Optional.of(alias);
        }
    }

    private Optional<String> awaitRegistration(String sessionId, CompletableFuture<Optional<String>> inFlight) {
        try {
            return inFlight.get(REGISTRATION_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return aliasIfLive(sessionId);
        } catch (ExecutionException | TimeoutException e) {
            return aliasIfLive(sessionId);
        }
    }

    private Optional<String> aliasIfLive(String sessionId) {
        return identity(sessionId).map(AgentIdentity::alias);
    }

    /**
     * Alias of {@code sessionId}, or the raw id when it is not registered.
     */
    public String alias(String sessionId) {
        return aliasIfLive(sessionId).orElse(sessionId);
    }

    public Optional<AgentIdentity> identity(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            return Optional.ofNullable(bySession.get(sessionId));
        }
    }

    /**
     * Resolves an alias first, then a live raw session id.
     */
    public Optional<String> resolve(String aliasOrSessionId) {
        if (aliasOrSessionId == null || aliasOrSessionId.isBlank()) {
            return Optional.empty();
        }
        String key = aliasOrSessionId.trim();
        synchronized (lock) {
            String byAlias = sessionByAlias.get(key);
            if (byAlias != null) {
                return Optional.of(byAlias);
            }
            return bySession.containsKey(key) ? Optional.of(key) : Optional.empty();
        }
    }

    public Optional<String> rootOf(String sessionId) {
        return identity(sessionId).map(AgentIdentity::rootId);
    }

    public boolean isLive(String sessionId) {
        return identity(sessionId).isPresent();
    }

    public boolean isRetired(String sessionId) {
        synchronized (lock) {
            return retired.contains(sessionId);
        }
    }

    /**
     * Live identities sharing the root of {@code sessionId}, excluding it, in registration order.
     * An unregistered caller sees every live identity.
     */
    public List<AgentIdentity> peers(String sessionId) {
        synchronized (lock) {
            AgentIdentity self = bySession.get(sessionId);
            String selfRoot = self == null ? null : self.rootId();
            List<AgentIdentity> out = new ArrayList<>();
            for (AgentIdentity identity : bySession.values()) {
                if (identity.sessionId().equals(sessionId)) {
                    continue;
                }
                if (selfRoot != null && identity.rootId() != null && !selfRoot.equals(identity.rootId())) {
                    continue;
                }
                out.add(identity);
            }
            return out;
        }
    }

    public List<String> knownAliases(String sessionId) {
        return peers(sessionId).stream().map(AgentIdentity::alias).toList();
    }

    public List<AgentIdentity> liveIdentities() {
        synchronized (lock) {
            return List.copyOf(bySession.values());
        }
    }

    public List<AgentIdentity> liveIdentitiesUnder(String rootId) {
        synchronized (lock) {
            return bySession.values().stream()
                    .filter(identity -> rootId == null || rootId.equals(identity.rootId()))
                    .toList();
        }
    }

    public int depthOf(String sessionId) {
        synchronized (lock) {
            return depths.getOrDefault(sessionId, 1);
        }
    }

    public void setDepth(String sessionId, int depth) {
        synchronized (lock) {
            depths.put(sessionId, Math.max(1, depth));
        }
    }

    /**
     * Returns true the first time it is called for a session since the last reset.
     */
    public boolean markAnnounced(String sessionId) {
        synchronized (lock) {
            return announced.add(sessionId);
        }
    }

    public boolean hasAnnounced(String sessionId) {
        synchronized (lock) {
            return announced.contains(sessionId);
        }
    }

    public long aliasesIssued() {
        return aliases.issued();
    }

    /**
     * Retires every live id and clears the live tables. The alias counter keeps counting.
     */
    public ResetSummary reset() {
        synchronized (lock) {
            int live = bySession.size();
            retired.addAll(bySession.keySet());
            bySession.clear();
            sessionByAlias.clear();
            depths.clear();
            announced.clear();
            return new ResetSummary(live, retired.size());
        }
    }

    public record ResetSummary(int retiredNow, int retiredTotal) {
    }
}
