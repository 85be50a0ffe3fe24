package io.agentmesh.tools;

/**
 * Runs a freshly spawned child in the background and hands its output back to the caller.
 */
public interface ChildLauncher {

    void launch(String callerSessionId, String childSessionId, String childAlias, String prompt);
}
