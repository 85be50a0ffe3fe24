package io.agentmesh.host;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process host with scripted agents. Each prompt runs the session's {@link Responder} on the
 * calling thread and appends the exchange to the session transcript.
 */
public final class LocalSessionDirectory implements SessionDirectory {
    private final Object lock = new Object();
    private final AtomicLong ids = new AtomicLong(0L);
    private final Map<String, LocalSession> sessions = new LinkedHashMap<>();
    private final Map<String, Responder> responders = new HashMap<>();
    private final Set<String> failingPrompts = new HashSet<>();
    private volatile Responder defaultResponder = turn -> "done";
    private volatile boolean failCreate;

    /**
     * Produces the assistant reply for one turn. May call back into the coordination runtime.
     */
    @FunctionalInterface
    public interface Responder {
        String respond(Turn turn) throws HostException;
    }

    public record Turn(String sessionId, String prompt, int turnNumber) {
    }

    public String addSession(String parentId, String title) {
        String id = "ses_" + String.format("%04d", ids.incrementAndGet());
        synchronized (lock) {
            sessions.put(id, new LocalSession(parentId, title));
        }
        return id;
    }

    public void respondWith(String sessionId, Responder responder) {
        synchronized (lock) {
            responders.put(sessionId, responder);
        }
    }

    public void defaultResponder(Responder responder) {
        this.defaultResponder = responder == null ? turn -> "done" : responder;
    }

    public void failPrompts(String sessionId, boolean fail) {
        synchronized (lock) {
            if (fail) {
                failingPrompts.add(sessionId);
            } else {
                failingPrompts.remove(sessionId);
            }
        }
    }

    public void failCreate(boolean fail) {
        this.failCreate = fail;
    }

    @Override
    public Optional<String> createSession(String parentId, String title) throws HostException {
        if (failCreate) {
            return Optional.empty();
        }
        if (parentId != null) {
            session(parentId);
        }
        return Optional.of(addSession(parentId, title));
    }

    @Override
    public Optional<String> parentOf(String sessionId) throws HostException {
        return Optional.ofNullable(session(sessionId).parentId);
    }

    @Override
    public List<HostMessage> messages(String sessionId) throws HostException {
        synchronized (lock) {
            return List.copyOf(session(sessionId).messages);
        }
    }

    @Override
    public void prompt(String sessionId, String text, Duration timeout) throws HostException {
        Responder responder;
        int turn;
        synchronized (lock) {
            LocalSession session = session(sessionId);
            if (failingPrompts.contains(sessionId)) {
                throw new HostException("prompt rejected for session " + sessionId);
            }
            session.prompts.add(text);
            session.messages.add(new HostMessage(nextMessageId(), HostMessage.ROLE_USER, List.of(HostPart.text(text))));
            turn = session.prompts.size();
            responder = responders.getOrDefault(sessionId, defaultResponder);
        }
        long started = System.currentTimeMillis();
        String reply = responder.respond(new Turn(sessionId, text, turn));
        if (timeout != null && System.currentTimeMillis() - started > timeout.toMillis()) {
            throw new HostException("prompt timed out after " + timeout.toMillis() + " ms for session " + sessionId);
        }
        synchronized (lock) {
            session(sessionId).messages.add(new HostMessage(
                    nextMessageId(),
                    HostMessage.ROLE_ASSISTANT,
                    reply == null ? List.of() : List.of(HostPart.text(reply))
            ));
        }
    }

    @Override
    public void note(String sessionId, String text) throws HostException {
        synchronized (lock) {
            LocalSession session = session(sessionId);
            session.notes.add(text);
            session.messages.add(new HostMessage(nextMessageId(), HostMessage.ROLE_USER, List.of(HostPart.text(text))));
        }
    }

    public List<String> prompts(String sessionId) {
        synchronized (lock) {
            LocalSession session = sessions.get(sessionId);
            return session == null ? List.of() : List.copyOf(session.prompts);
        }
    }

    public List<String> notes(String sessionId) {
        synchronized (lock) {
            LocalSession session = sessions.get(sessionId);
            return session == null ? List.of() : List.copyOf(session.notes);
        }
    }

    public List<String> children(String parentId) {
        synchronized (lock) {
            List<String> out = new ArrayList<>();
            sessions.forEach((id, session) -> {
                if (parentId.equals(session.parentId)) {
                    out.add(id);
                }
            });
            return out;
        }
    }

    public Optional<String> title(String sessionId) {
        synchronized (lock) {
            LocalSession session = sessions.get(sessionId);
            return session == null ? Optional.empty() : Optional.ofNullable(session.title);
        }
    }

    private LocalSession session(String sessionId) throws HostException {
        synchronized (lock) {
            LocalSession session = sessions.get(sessionId);
            if (session == null) {
                throw new HostException("Unknown session: " + sessionId);
            }
            return session;
        }
    }

    private String nextMessageId() {
        return "msg_" + ids.incrementAndGet();
    }

    private static final class LocalSession {
        private final String parentId;
        private final String title;
        private final List<HostMessage> messages = new ArrayList<>();
        private final List<String> prompts = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();

        private LocalSession(String parentId, String title) {
            this.parentId = parentId;
            this.title = title;
        }
    }
}
