package io.agentmesh.host;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * The host's session API as seen by the coordination core.
 */
public interface SessionDirectory {

    Optional<String> createSession(String parentId, String title) throws HostException;

    Optional<String> parentOf(String sessionId) throws HostException;

    List<HostMessage> messages(String sessionId) throws HostException;

    /**
     * Runs one turn of {@code sessionId} with {@code text} as the user message and blocks until
     * the turn completes or {@code timeout} elapses.
     */
    void prompt(String sessionId, String text, Duration timeout) throws HostException;

    /**
     * Persists a visible message in {@code sessionId} without asking the agent to reply.
     */
    void note(String sessionId, String text) throws HostException;
}
