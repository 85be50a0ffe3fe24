package io.agentmesh.tools;

public record ToolResult(String text, boolean error) {
    public static ToolResult ok(String text) {
        return new ToolResult(text, false);
    }

    public static ToolResult error(String text) {
        return new ToolResult(text, true);
    }
}
