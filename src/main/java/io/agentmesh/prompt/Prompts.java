package io.agentmesh.prompt;

import io.agentmesh.model.HandledMessage;
import io.agentmesh.model.ParallelAgent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Text shown to agents: tool results, resume prompts, summaries.
 */
public final class Prompts {
    public static final String BROADCAST_MISSING_MESSAGE = "Error: 'message' parameter is required.";
    public static final String BROADCAST_SELF_MESSAGE = "Warning: You cannot send a message to yourself. "
            + "The target alias is your own alias. Choose a different recipient.";
    public static final String SUBAGENT_NOT_CHILD_SESSION = "Error: subagent can only be called from a subagent "
            + "session (a session with a parent). Main sessions should use the 'task' tool directly.";
    public static final String SUBAGENT_MISSING_PROMPT = "Error: 'prompt' parameter is required.";
    public static final String SUBAGENT_CREATE_FAILED = "Error: Failed to create session. No session ID returned.";
    public static final String RECALL_EMPTY = "No agents in history yet.";
    public static final String RECALL_AGENT_ACTIVE = "[Agent is still active - no output yet]";
    public static final String RECALL_AGENT_IDLE_NO_OUTPUT = "[Agent is idle but has not produced output yet]";
    public static final String ANNOUNCE_HINT = "Call broadcast(message='what you are working on') to announce yourself first.";
    public static final String SUMMARY_HEADER = "[Agent Mesh Summary]";
    public static final String SUMMARY_INTRO = "The following agents completed their work:";
    public static final String USER_SENDER = "user";
    public static final String USER_MESSAGE_EMPTY = "Usage: [@agent] message";
    public static final String USER_MESSAGE_NO_MESH = "No active agent mesh. Start a task first.";
    public static final String USER_REPLY_FAILED = "Error: Could not deliver the reply to the user.";
    public static final String USER_MESSAGE_NO_COORDINATOR = "No coordinator found. No agents in the current mesh.";

    private static final String BROADCAST_RESULT = """
            You are: %s

            %s
            %s""";

    private static final String SUBAGENT_RESULT = """
            Spawned %s (session: %s)
            Task: %s
            The agent is now running in parallel and can be reached via broadcast.""";

    private static final String SUBAGENT_OUTPUT = """
            [%s completed]

            <output=%s>
            %s
            </output>""";

    private static final String SYSTEM_PROMPT = """
            <instructions tool="agentmesh">
            # Agent Mesh: parallel agent coordination

            You are %s. Use `broadcast` to communicate with other parallel agents.
            %s

            ## Announce yourself first
            Your first action should be `broadcast(message="what you're working on")`.
            Calling `broadcast` without `send_to` updates your status. Status updates do not wake other agents.

            ## Sending messages
            - `broadcast(message="...")` updates your status
            - `broadcast(send_to="agentB", message="...")` sends a message to agentB
            - `broadcast(reply_to=1, message="...")` replies to message #1
            - `recall()` lists agents and their status history; `recall(agent_name="X", show_output=true)` shows X's final output

            ## Receiving messages
            Messages appear as synthetic `broadcast` results with `agents` and `messages` sections.
            Reply with `reply_to` so the sender knows you handled the message.
            </instructions>""";

    private Prompts() {
    }

    public static String resumeBroadcast(String senderAlias) {
        return "[Broadcast from " + senderAlias + "]: New message received. Check your inbox.";
    }

    public static String unknownRecipient(String recipient, List<String> known) {
        String knownList = known == null || known.isEmpty()
                ? "No agents available yet."
                : "Known agents: " + String.join(", ", known);
        return "Error: Unknown recipient \"" + recipient + "\". " + knownList;
    }

    public static String broadcastResult(
            String selfAlias,
            List<String> recipients,
            List<ParallelAgent> agents,
            HandledMessage handled
    ) {
        return BROADCAST_RESULT.formatted(selfAlias, agentsSection(agents), confirmation(recipients, handled));
    }

    static String agentsSection(List<ParallelAgent> agents) {
        if (agents == null || agents.isEmpty()) {
            return "No other agents available yet.";
        }
        List<String> lines = new ArrayList<>();
        lines.add("Available agents:");
        for (ParallelAgent agent : agents) {
            lines.add("  - " + agent.alias());
            for (String status : agent.statusHistory()) {
                lines.add("      → " + status);
            }
        }
        return String.join("\n", lines);
    }

    static String confirmation(List<String> recipients, HandledMessage handled) {
        if (handled != null) {
            return "Replied to #" + handled.seq() + " from " + handled.from() + ":\n  \"" + handled.body() + "\"";
        }
        if (recipients != null && !recipients.isEmpty()) {
            return "Message sent to: " + String.join(", ", recipients);
        }
        return "";
    }

    public static String subagentResult(String alias, String sessionId, String description) {
        return SUBAGENT_RESULT.formatted(alias, sessionId, description);
    }

    public static String subagentMaxDepth(int depth, int maxDepth) {
        return "Error: Maximum subagent depth reached (" + depth + "/" + maxDepth
                + "). This session cannot spawn more subagents.";
    }

    public static String subagentError(String error) {
        return "Error: Failed to create subagent: " + error;
    }

    public static String subagentOutput(String alias, String output) {
        return SUBAGENT_OUTPUT.formatted(alias, alias, output == null ? "" : output.trim());
    }

    public static String receivedSubagentOutput(String alias, String output) {
        return "[Received " + alias + " completed task]\n" + (output == null ? "" : output);
    }

    public static String agentCompleted(String alias) {
        return "[" + alias + " completed]";
    }

    public static String recallNotFound(String name) {
        return "No agent found with name '" + name + "'.";
    }

    public static String userTargetNotFound(String target) {
        return "Agent '" + target + "' not found in current mesh.";
    }

    public static String userTargetRetired(String alias) {
        return "Agent '" + alias + "' is from a previous mesh and has completed.";
    }

    public static String userMessageSent(String alias) {
        return "Message sent to " + alias + ".";
    }

    public static String userMessage(String text) {
        return "**Message from user:**\n\n" + text;
    }

    public static String systemPrompt(String alias, boolean allowSubagent, int depth, int maxDepth) {
        String subagentLine = allowSubagent
                ? "Use `subagent(prompt=\"...\", description=\"...\")` to start a sibling agent; its output arrives as a message when it finishes."
                : "You have reached the maximum subagent depth (" + depth + "/" + maxDepth
                + ") and cannot call `subagent` from this session.";
        return SYSTEM_PROMPT.formatted(alias, subagentLine);
    }

    /**
     * Summary of every agent with its status history, or null when there is nothing to report.
     */
    public static String rootSummary(Map<String, List<String>> historiesByAlias) {
        if (historiesByAlias == null || historiesByAlias.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        sb.append(SUMMARY_HEADER).append("\n\n").append(SUMMARY_INTRO).append('\n');
        for (Map.Entry<String, List<String>> entry : historiesByAlias.entrySet()) {
            sb.append("\n## ").append(entry.getKey()).append('\n');
            List<String> history = entry.getValue();
            if (history == null || history.isEmpty()) {
                sb.append("(no status updates)\n");
                continue;
            }
            for (String status : history) {
                sb.append("- ").append(status).append('\n');
            }
        }
        return sb.toString().stripTrailing();
    }
}
