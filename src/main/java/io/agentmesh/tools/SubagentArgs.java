package io.agentmesh.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.util.Jsons;

public record SubagentArgs(String prompt, String description) {

    public static SubagentArgs fromJson(JsonNode args) {
        return new SubagentArgs(Jsons.text(args, "prompt"), Jsons.text(args, "description"));
    }

    static final int DEFAULT_DESCRIPTION_LENGTH = 50;

    /**
     * Description shown in titles and results; the start of the prompt when none was given.
     */
    public String effectiveDescription() {
        if (description != null && !description.isBlank()) {
            return description.trim();
        }
        if (prompt == null) {
            return "";
        }
        return prompt.length() > DEFAULT_DESCRIPTION_LENGTH ? prompt.substring(0, DEFAULT_DESCRIPTION_LENGTH) : prompt;
    }
}
