package io.agentmesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentmesh.util.Jsons;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks credentials before audit rows leave the process.
 *
 * <p>Agent messages are free text, so besides key-based masking of structured details the
 * masker also rewrites inline {@code key=value} secrets and bearer tokens inside text values.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final int PREVIEW_LENGTH = 120;
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key", "credential"
    );
    private static final Pattern INLINE_ASSIGNMENT = Pattern.compile(
            "(?i)\\b(password|passwd|secret|token|api[_-]?key|authorization)(\\s*[:=]\\s*)(\"[^\"]*\"|\\S+)"
    );
    private static final Pattern BEARER = Pattern.compile("(?i)\\bbearer\\s+[A-Za-z0-9._~+/=\\-]+");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isObject()) {
            ObjectNode out = Jsons.mapper().createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> it = input.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (isSensitiveKey(entry.getKey())) {
                    out.put(entry.getKey(), MASK);
                } else {
                    out.set(entry.getKey(), masked(entry.getValue()));
                }
            }
            return out;
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            for (JsonNode value : input) {
                out.add(masked(value));
            }
            return out;
        }
        if (input.isTextual()) {
            String text = input.asText("");
            if (likelySecretValue(text)) {
                return Jsons.mapper().getNodeFactory().textNode(MASK);
            }
            String rewritten = maskText(text);
            return rewritten.equals(text) ? input : Jsons.mapper().getNodeFactory().textNode(rewritten);
        }
        return input;
    }

    public static String maskText(String text) {
        if (text == null || text.isEmpty()) {
            return text == null ? "" : text;
        }
        Matcher assignment = INLINE_ASSIGNMENT.matcher(text);
        String out = assignment.replaceAll(match -> Matcher.quoteReplacement(match.group(1) + match.group(2) + MASK));
        return BEARER.matcher(out).replaceAll("Bearer " + MASK);
    }

    /**
     * Short single-line excerpt of a message body for audit details.
     */
    public static String preview(String body) {
        if (body == null) {
            return "";
        }
        String flat = maskText(body).replace('\n', ' ').replace('\r', ' ').trim();
        if (flat.length() <= PREVIEW_LENGTH) {
            return flat;
        }
        return flat.substring(0, PREVIEW_LENGTH) + "...";
    }

    private static boolean isSensitiveKey(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean likelySecretValue(String value) {
        String v = value.trim();
        if (v.length() < 32 || v.contains(" ")) {
            return false;
        }
        // Session ids are long too but always carry the host's "ses_" prefix.
        if (v.startsWith("ses_")) {
            return false;
        }
        return v.matches("^[A-Za-z0-9+/=_\\-]{32,}$") && containsDigitAndLetter(v);
    }

    private static boolean containsDigitAndLetter(String v) {
        boolean digit = false;
        boolean letter = false;
        for (int i = 0; i < v.length(); i++) {
            char ch = v.charAt(i);
            digit |= Character.isDigit(ch);
            letter |= Character.isLetter(ch);
        }
        return digit && letter;
    }
}
