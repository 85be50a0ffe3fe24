package io.agentmesh.session;

public enum DeliveryMode {
    INBOX("inbox"),
    USER_MESSAGE("user_message");

    private final String wireName;

    DeliveryMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static DeliveryMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return INBOX;
        }
        String normalized = raw.trim().replace('-', '_');
        for (DeliveryMode value : values()) {
            if (value.name().equalsIgnoreCase(normalized) || value.wireName.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown delivery mode: " + raw);
    }
}
