package io.agentmesh.runtime;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A message typed by the user for the agents of a root session: {@code @agentB wrap it up}
 * goes to agentB, {@code wrap it up} goes to the coordinator.
 *
 * @param target alias without the leading {@code @}; null for the coordinator
 */
public record UserCommand(String target, String message) {
    private static final Pattern TARGETED = Pattern.compile("^@(\\w+)\\s+(.+)$", Pattern.DOTALL);

    /**
     * @return null for blank input
     */
    public static UserCommand parse(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String trimmed = input.trim();
        Matcher matcher = TARGETED.matcher(trimmed);
        if (matcher.matches()) {
            return new UserCommand(matcher.group(1), matcher.group(2).trim());
        }
        return new UserCommand(null, trimmed);
    }
}
