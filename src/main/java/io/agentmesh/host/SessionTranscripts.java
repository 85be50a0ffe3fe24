package io.agentmesh.host;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the final output of a finished session from its transcript.
 */
public final class SessionTranscripts {
    private SessionTranscripts() {
    }

    /**
     * Last text part of the last assistant message; falls back to a list of the tool calls in
     * that message, then to a bare completion line.
     */
    public static String finalOutput(List<HostMessage> messages, String sessionId, String alias) {
        HostMessage last = null;
        for (HostMessage message : messages) {
            if (message.fromAssistant()) {
                last = message;
            }
        }
        if (last == null) {
            return "Agent " + alias + " completed.\nSession: " + sessionId;
        }
        String text = null;
        List<String> tools = new ArrayList<>();
        for (HostPart part : last.parts()) {
            if (part.isText()) {
                text = part.text();
            } else if ("tool".equals(part.type())) {
                String title = part.title() == null || part.title().isBlank() ? "completed" : part.title();
                tools.add("- " + part.tool() + ": " + title);
            }
        }
        if (text != null) {
            return text + metadata(sessionId);
        }
        if (!tools.isEmpty()) {
            return "Agent " + alias + " completed:\n" + String.join("\n", tools) + metadata(sessionId);
        }
        return "Agent " + alias + " completed." + metadata(sessionId);
    }

    private static String metadata(String sessionId) {
        return "\n\n<task_metadata>\nsession_id: " + sessionId + "\n</task_metadata>";
    }
}
