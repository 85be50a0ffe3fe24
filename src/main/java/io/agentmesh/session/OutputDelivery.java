package io.agentmesh.session;

/**
 * How a finished child's output reaches the session that spawned it.
 */
public interface OutputDelivery {

    DeliveryMode mode();

    /**
     * Hands {@code output} of {@code childAlias} to {@code callerSessionId}. Must be called
     * before the child is marked idle so a waiting barrier observes the delivery.
     */
    void deliver(String callerSessionId, String childAlias, String output);
}
