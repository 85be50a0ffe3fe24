package io.agentmesh.context;

/**
 * A synthetic tool result the host splices into a session's context before its next LLM call.
 *
 * @param output          JSON document the agent reads as the tool result
 * @param userMessageText child output to append to the last user message; null when none
 */
public record SyntheticTurn(
        String tool,
        String title,
        String output,
        String userMessageText,
        int messageCount,
        int agentCount
) {
    public boolean hasIncomingMessages() {
        return messageCount > 0;
    }
}
