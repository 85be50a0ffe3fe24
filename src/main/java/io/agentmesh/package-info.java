/**
 * AgentMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentmesh.cli.AgentMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.agentmesh.runtime.AgentMeshRuntime} receives host lifecycle events and tool calls.</li>
 *   <li>{@code io.agentmesh.bus.MailboxStore} holds every message exchanged between agents.</li>
 * </ul>
 */
package io.agentmesh;
