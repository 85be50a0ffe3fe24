package io.agentmesh.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.util.Jsons;

/**
 * Arguments of the {@code broadcast} tool.
 *
 * @param sendTo  recipient alias; null for a status update
 * @param replyTo seq of the message being answered; null when not replying
 */
public record BroadcastArgs(String sendTo, String message, Long replyTo) {

    public static BroadcastArgs fromJson(JsonNode args) {
        return new BroadcastArgs(
                Jsons.text(args, "send_to"),
                Jsons.text(args, "message"),
                parseReplyTo(args == null ? null : args.get("reply_to"))
        );
    }

    private static Long parseReplyTo(JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return null;
        }
        if (raw.canConvertToLong() && raw.isIntegralNumber()) {
            return raw.asLong();
        }
        String text = raw.asText("").trim();
        if (text.startsWith("#")) {
            text = text.substring(1);
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("reply_to must be a message id, got: " + raw.asText(""), e);
        }
    }
}
