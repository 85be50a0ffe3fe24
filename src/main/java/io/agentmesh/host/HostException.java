package io.agentmesh.host;

/**
 * Failure reported by the host session API.
 */
public class HostException extends Exception {
    public HostException(String message) {
        super(message);
    }

    public HostException(String message, Throwable cause) {
        super(message, cause);
    }
}
