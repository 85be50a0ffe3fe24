package io.agentmesh.host;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.util.Jsons;

/**
 * A finished host tool call, converted once from the host payload.
 *
 * @param childSessionId session the tool ran in, for {@code task} calls; may be null
 */
public record ToolCompletion(
        String tool,
        String sessionId,
        String childSessionId,
        String title
) {
    public static final String TASK_TOOL = "task";

    public static ToolCompletion fromHost(String tool, String sessionId, JsonNode output) {
        JsonNode metadata = output == null ? null : output.path("metadata");
        String child = Jsons.text(metadata, "sessionId");
        if (child == null) {
            child = Jsons.text(metadata, "session_id");
        }
        return new ToolCompletion(tool, sessionId, child, Jsons.text(output, "title"));
    }

    public boolean isTask() {
        return TASK_TOOL.equals(tool);
    }
}
