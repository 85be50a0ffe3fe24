package io.agentmesh.host;

public record HostPart(
        String type,
        String text,
        String tool,
        String title
) {
    public static HostPart text(String text) {
        return new HostPart("text", text, null, null);
    }

    public static HostPart tool(String tool, String title) {
        return new HostPart("tool", null, tool, title);
    }

    public boolean isText() {
        return "text".equals(type) && text != null && !text.isBlank();
    }
}
