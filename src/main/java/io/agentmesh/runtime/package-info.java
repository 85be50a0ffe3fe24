/**
 * Runtime orchestration package.
 *
 * <p>{@link io.agentmesh.runtime.AgentMeshRuntime} owns cross-cutting behavior:
 * session registration, tool dispatch, background subagent runs, completion
 * barriers, root summaries, and the periodic mailbox sweep.
 */
package io.agentmesh.runtime;
