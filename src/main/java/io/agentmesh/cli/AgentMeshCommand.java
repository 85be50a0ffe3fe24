package io.agentmesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.barrier.BarrierOutcome;
import io.agentmesh.config.AgentMeshConfig;
import io.agentmesh.host.HostException;
import io.agentmesh.host.LocalSessionDirectory;
import io.agentmesh.model.CompletedAgentRecord;
import io.agentmesh.runtime.AgentMeshRuntime;
import io.agentmesh.session.DeliveryMode;
import io.agentmesh.tools.BroadcastArgs;
import io.agentmesh.tools.SubagentArgs;
import io.agentmesh.tools.ToolResult;
import io.agentmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "agentmesh",
        mixinStandardHelpOptions = true,
        description = "Parallel agent coordination runtime CLI",
        subcommands = {
                AgentMeshCommand.SettingsCommand.class,
                AgentMeshCommand.SimulateCommand.class
        }
)
public final class AgentMeshCommand implements Runnable {
    private static final int MAX_RESUMES_PER_AGENT = 8;

    @Option(names = {"--root"}, description = "Directory holding agentmesh-settings.json and the audit log", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: settings | simulate");
    }

    AgentMeshConfig config() {
        return AgentMeshConfig.fromRoot(root);
    }

    @Command(name = "settings", description = "Print the resolved settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Override
        public Integer call() {
            AgentMeshConfig config = parent.config();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("rootDir", config.rootDir().map(Object::toString).orElse(null));
            out.put("settingsFile", config.settingsFile().map(Object::toString).orElse(null));
            out.put("auditFile", config.auditFile().map(Object::toString).orElse(null));
            out.put("deliveryMode", config.settings().deliveryMode().wireName());
            out.put("settings", config.settings());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "simulate", description = "Run a scripted multi-agent scenario against the in-process host")
    static final class SimulateCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Option(names = {"--agents"}, defaultValue = "2", description = "Number of first-level agents")
        int agents;

        @Option(names = {"--spawn"}, defaultValue = "true", description = "Let the first agent spawn a subagent")
        boolean spawn;

        @Option(names = {"--delivery"}, description = "Override the delivery mode: inbox | user_message")
        String delivery;

        @Option(names = {"--audit-lines"}, defaultValue = "100", description = "Audit rows to print")
        int auditLines;

        @Option(names = {"--timeout-ms"}, defaultValue = "30000", description = "Wait limit for background work")
        long timeoutMs;

        @Override
        public Integer call() throws Exception {
            AgentMeshConfig config = parent.config();
            if (delivery != null) {
                config = new AgentMeshConfig(
                        config.rootDir().orElse(null),
                        withDelivery(config.settings(), DeliveryMode.fromString(delivery))
                );
            }
            LocalSessionDirectory directory = new LocalSessionDirectory();
            try (AgentMeshRuntime runtime = new AgentMeshRuntime(config, directory)) {
                runtime.init();
                Map<String, Object> out = run(runtime, directory);
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }

        private Map<String, Object> run(AgentMeshRuntime runtime, LocalSessionDirectory directory)
                throws HostException, InterruptedException {
            Duration turnTimeout = Duration.ofMillis(Math.max(1L, timeoutMs));
            String rootId = directory.addSession(null, "simulated root task");
            int count = Math.max(1, agents);
            List<String> children = new ArrayList<>();
            for (int i = 1; i <= count; i++) {
                String description = "part " + i + " of the task";
                runtime.onToolStarting(rootId, "task", description);
                String childId = directory.addSession(rootId, description);
                runtime.onSessionStart(childId);
                directory.prompt(childId, "Work on " + description, turnTimeout);
                children.add(childId);
            }

            List<Map<String, Object>> toolCalls = new ArrayList<>();
            for (int i = 0; i < children.size(); i++) {
                String childId = children.get(i);
                recordCall(toolCalls, childId, "broadcast",
                        runtime.broadcast(childId, new BroadcastArgs(null, "working on part " + (i + 1), null)));
            }
            if (children.size() >= 2) {
                String first = children.get(0);
                String second = children.get(1);
                String secondAlias = runtime.registry().alias(second);
                recordCall(toolCalls, first, "broadcast",
                        runtime.broadcast(first, new BroadcastArgs(secondAlias, "hi", null)));
                long seq = runtime.mailbox().unhandled(second).get(0).seq();
                recordCall(toolCalls, second, "broadcast",
                        runtime.broadcast(second, new BroadcastArgs(null, "bye", seq)));
            }
            if (spawn) {
                String first = children.get(0);
                recordCall(toolCalls, first, "subagent",
                        runtime.subagent(first, new SubagentArgs("Summarize the findings so far", "summarize findings")));
            }

            List<Map<String, Object>> completions = new ArrayList<>();
            for (String childId : children) {
                completions.add(complete(runtime, directory, childId));
                runtime.onSessionIdle(childId);
            }
            boolean quiet = runtime.awaitQuiescence(timeoutMs);

            Map<String, Object> out = new LinkedHashMap<>();
            out.put("root", rootId);
            out.put("deliveryMode", runtime.delivery().mode().wireName());
            out.put("toolCalls", toolCalls);
            out.put("completions", completions);
            out.put("quiescent", quiet);
            out.put("rootNotes", directory.notes(rootId));
            out.put("archive", archive(runtime));
            List<JsonNode> audit = new ArrayList<>();
            for (String row : runtime.auditLogger().tail(auditLines)) {
                audit.add(Jsons.readTree(row));
            }
            out.put("audit", audit);
            return out;
        }

        private Map<String, Object> complete(AgentMeshRuntime runtime, LocalSessionDirectory directory, String childId)
                throws HostException {
            String alias = runtime.registry().alias(childId);
            List<String> outcomes = new ArrayList<>();
            BarrierOutcome outcome = runtime.onBeforeComplete(childId);
            outcomes.add(outcome.kind().name());
            int resumes = 0;
            while (outcome.kind() == BarrierOutcome.Kind.RESUME && resumes < MAX_RESUMES_PER_AGENT) {
                resumes++;
                directory.prompt(childId, outcome.resumePrompt(), Duration.ofMillis(Math.max(1L, timeoutMs)));
                runtime.assembleContext(childId, directory.messages(childId));
                outcome = runtime.onBeforeComplete(childId);
                outcomes.add(outcome.kind().name());
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("agent", alias);
            row.put("barrier", outcomes);
            return row;
        }

        private static void recordCall(List<Map<String, Object>> calls, String sessionId, String tool, ToolResult result) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("session", sessionId);
            row.put("tool", tool);
            row.put("error", result.error());
            row.put("text", result.text());
            calls.add(row);
        }

        private static List<Map<String, Object>> archive(AgentMeshRuntime runtime) {
            List<Map<String, Object>> out = new ArrayList<>();
            for (CompletedAgentRecord record : runtime.ledger().archived()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("name", record.alias());
                row.put("status_history", record.statusHistory());
                row.put("output", record.finalOutput());
                out.add(row);
            }
            return out;
        }

        private static AgentMeshConfig.Settings withDelivery(AgentMeshConfig.Settings s, DeliveryMode mode) {
            return new AgentMeshConfig.Settings(
                    s.maxInboxSize(),
                    s.maxMessageLength(),
                    s.handledTtlMs(),
                    s.unhandledTtlMs(),
                    s.parentCacheTtlMs(),
                    s.reaperIntervalMs(),
                    s.maxStatusHistory(),
                    s.maxStatusLength(),
                    s.maxResumeChain(),
                    s.barrierMaxIterations(),
                    s.barrierChildTimeoutMs(),
                    s.barrierPollIntervalMs(),
                    s.hostPromptTimeoutMs(),
                    s.maxSubagentDepth(),
                    s.childWorkers(),
                    s.workerQueueCapacity(),
                    mode,
                    s.sessionUpdates(),
                    s.auditEnabled()
            );
        }
    }
}
