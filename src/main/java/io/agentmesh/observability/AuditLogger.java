package io.agentmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.security.SensitiveDataMasker;
import io.agentmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-lines event log for coordination decisions.
 *
 * <p>Rows are appended to the audit file when one is configured and always kept in a bounded
 * in-memory tail. A failed file write is counted and the row stays in the tail; logging never
 * throws into the caller.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final int tailCapacity;
    private final Deque<String> tail;
    private final AtomicLong writeFailures;
    private long sequence;

    public AuditLogger(Path auditFile, int tailCapacity) {
        this.auditFile = auditFile;
        this.tailCapacity = Math.max(1, tailCapacity);
        this.tail = new ArrayDeque<>();
        this.writeFailures = new AtomicLong(0L);
        this.sequence = 0L;
        if (auditFile != null) {
            try {
                Path parent = auditFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
            } catch (IOException e) {
                throw new IllegalStateException("Failed to initialize audit log file: " + auditFile, e);
            }
        }
    }

    public static AuditLogger inMemory(int tailCapacity) {
        return new AuditLogger(null, tailCapacity);
    }

    public synchronized void log(AuditEvent event) {
        sequence++;
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("seq", sequence);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        String line = Jsons.toCompactJson(row);
        tail.addLast(line);
        while (tail.size() > tailCapacity) {
            tail.removeFirst();
        }
        if (auditFile == null) {
            return;
        }
        try {
            Files.writeString(auditFile, line + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            writeFailures.incrementAndGet();
        }
    }

    public synchronized List<String> tail(int lines) {
        int limit = Math.max(0, lines);
        List<String> all = new ArrayList<>(tail);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    /**
     * Parsed tail rows whose action equals {@code action}, oldest first.
     */
    public synchronized List<JsonNode> rows(String action) {
        List<JsonNode> out = new ArrayList<>();
        for (String line : tail) {
            JsonNode node = Jsons.readTree(line);
            if (action == null || action.equals(node.path("action").asText())) {
                out.add(node);
            }
        }
        return out;
    }

    public long writeFailures() {
        return writeFailures.get();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(
                    action,
                    actor == null || actor.isBlank() ? "system" : actor,
                    resource,
                    result,
                    details == null ? Map.of() : details
            );
        }
    }
}
