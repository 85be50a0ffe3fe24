package io.agentmesh.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.util.Jsons;

public record RecallArgs(String agentName, boolean showOutput) {

    public static RecallArgs fromJson(JsonNode args) {
        JsonNode show = args == null ? null : args.get("show_output");
        boolean showOutput = show != null && (show.asBoolean(false) || "true".equalsIgnoreCase(show.asText("")));
        return new RecallArgs(Jsons.text(args, "agent_name"), showOutput);
    }
}
