package io.agentmesh.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.barrier.BarrierOutcome;
import io.agentmesh.barrier.CompletionBarrier;
import io.agentmesh.bus.MailboxStore;
import io.agentmesh.config.AgentMeshConfig;
import io.agentmesh.context.ContextAssembler;
import io.agentmesh.context.PeerView;
import io.agentmesh.context.SyntheticTurn;
import io.agentmesh.host.HostException;
import io.agentmesh.host.HostMessage;
import io.agentmesh.host.ParentLookup;
import io.agentmesh.host.SessionDirectory;
import io.agentmesh.host.SessionTranscripts;
import io.agentmesh.host.ToolCompletion;
import io.agentmesh.ledger.StatusLedger;
import io.agentmesh.model.AgentIdentity;
import io.agentmesh.model.CompletedAgentRecord;
import io.agentmesh.model.MailMessage;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.observability.SessionUpdateNotifier;
import io.agentmesh.prompt.Prompts;
import io.agentmesh.registry.IdentityRegistry;
import io.agentmesh.session.DeliveryMode;
import io.agentmesh.session.InboxDelivery;
import io.agentmesh.session.OutputDelivery;
import io.agentmesh.session.PendingOutputStore;
import io.agentmesh.session.ResumeCoordinator;
import io.agentmesh.session.SessionStateTracker;
import io.agentmesh.session.UserMessageDelivery;
import io.agentmesh.tools.BroadcastArgs;
import io.agentmesh.tools.BroadcastTool;
import io.agentmesh.tools.RecallArgs;
import io.agentmesh.tools.RecallTool;
import io.agentmesh.tools.SubagentArgs;
import io.agentmesh.tools.SubagentTool;
import io.agentmesh.tools.ToolResult;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the mesh together and exposes every host-triggered entry point.
 *
 * <p>Entry points never throw: a {@link RuntimeException} escaping a component is recorded as an
 * audit row with result {@code error} and the caller gets a best-effort value back.
 */
public final class AgentMeshRuntime implements AutoCloseable {
    private static final long WORKER_SHUTDOWN_WAIT_MS = 5_000L;

    private final AgentMeshConfig config;
    private final AgentMeshConfig.Settings settings;
    private final SessionDirectory directory;
    private final AuditLogger auditLogger;
    private final IdentityRegistry registry;
    private final MailboxStore mailbox;
    private final SessionStateTracker tracker;
    private final PendingOutputStore pendingOutputs;
    private final StatusLedger ledger;
    private final ParentLookup parentLookup;
    private final SessionUpdateNotifier notifier;
    private final ThreadPoolExecutor workers;
    private final ResumeCoordinator resumeCoordinator;
    private final CompletionBarrier barrier;
    private final OutputDelivery delivery;
    private final PeerView peerView;
    private final ContextAssembler contextAssembler;
    private final BroadcastTool broadcastTool;
    private final SubagentTool subagentTool;
    private final RecallTool recallTool;
    private final RootSummaryTracker summaryTracker;
    private final MailboxReaper reaper;
    private final ConcurrentMap<String, String> taskDescriptions;
    private final Duration promptTimeout;

    public AgentMeshRuntime(AgentMeshConfig config, SessionDirectory directory) {
        this(config, directory, new AuditLogger(config.auditFile().orElse(null), AgentMeshConfig.DEFAULT_AUDIT_TAIL_SIZE));
    }

    public AgentMeshRuntime(AgentMeshConfig config, SessionDirectory directory, AuditLogger auditLogger) {
        this.config = config;
        this.settings = config.settings();
        this.directory = directory;
        this.auditLogger = auditLogger;
        this.registry = new IdentityRegistry();
        this.mailbox = new MailboxStore(settings.maxInboxSize(), settings.maxMessageLength());
        this.tracker = new SessionStateTracker(registry);
        this.pendingOutputs = new PendingOutputStore();
        this.ledger = new StatusLedger(settings.maxStatusHistory(), settings.maxStatusLength());
        this.parentLookup = new ParentLookup(directory, auditLogger, settings.parentCacheTtlMs());
        this.notifier = new SessionUpdateNotifier(directory, registry, settings.sessionUpdates(), auditLogger);
        this.workers = newWorkerPool(settings.childWorkers(), settings.workerQueueCapacity());
        this.resumeCoordinator = new ResumeCoordinator(
                directory,
                tracker,
                mailbox,
                registry,
                notifier,
                auditLogger,
                workers,
                settings.maxResumeChain(),
                settings.hostPromptTimeoutMs()
        );
        this.barrier = new CompletionBarrier(
                tracker,
                mailbox,
                pendingOutputs,
                registry,
                auditLogger,
                settings.barrierMaxIterations(),
                settings.barrierChildTimeoutMs(),
                settings.barrierPollIntervalMs()
        );
        this.delivery = settings.deliveryMode() == DeliveryMode.USER_MESSAGE
                ? new UserMessageDelivery(directory, tracker, pendingOutputs, resumeCoordinator, barrier::isAwaiting, auditLogger)
                : new InboxDelivery(mailbox, resumeCoordinator);
        this.peerView = new PeerView(registry, ledger, tracker);
        this.contextAssembler = new ContextAssembler(registry, mailbox, peerView, pendingOutputs);
        this.broadcastTool = new BroadcastTool(registry, mailbox, ledger, peerView, resumeCoordinator, notifier, auditLogger);
        this.subagentTool = new SubagentTool(
                directory,
                parentLookup,
                registry,
                tracker,
                barrier,
                ledger,
                this::launchChild,
                notifier,
                auditLogger,
                settings.maxSubagentDepth()
        );
        this.recallTool = new RecallTool(registry, ledger, peerView, auditLogger);
        this.summaryTracker = new RootSummaryTracker();
        this.reaper = new MailboxReaper(
                mailbox,
                parentLookup,
                auditLogger,
                settings.reaperIntervalMs(),
                settings.handledTtlMs(),
                settings.unhandledTtlMs()
        );
        this.taskDescriptions = new ConcurrentHashMap<>();
        this.promptTimeout = Duration.ofMillis(settings.hostPromptTimeoutMs());
    }

    public void init() {
        reaper.start();
    }

    /**
     * System-prompt hook. Registers child sessions, tracks first-level children of their root and
     * returns the agent's identity block; empty for root sessions and retired ids.
     */
    public Optional<SessionStart> onSessionStart(String sessionId) {
        try {
            Optional<String> parentId = parentLookup.parentOf(sessionId);
            if (parentId.isEmpty()) {
                return Optional.empty();
            }
            boolean known = registry.isLive(sessionId);
            String rootId = parentLookup.rootOf(sessionId);
            Optional<String> alias = registry.register(sessionId, rootId);
            if (alias.isEmpty()) {
                audit("registry.register", sessionId, "retired", Map.of("session", sessionId));
                return Optional.empty();
            }
            if (!known) {
                onFirstRegistration(sessionId, alias.get(), parentId.get(), rootId);
            }
            if (rootId.equals(parentId.get())) {
                summaryTracker.track(rootId, sessionId);
            }
            tracker.markActive(sessionId);
            int depth = registry.depthOf(sessionId);
            boolean allowSubagent = depth < settings.maxSubagentDepth();
            return Optional.of(new SessionStart(
                    alias.get(),
                    depth,
                    allowSubagent,
                    Prompts.systemPrompt(alias.get(), allowSubagent, depth, settings.maxSubagentDepth())
            ));
        } catch (RuntimeException e) {
            auditError("session.start", sessionId, e);
            return Optional.empty();
        }
    }

    private void onFirstRegistration(String sessionId, String alias, String parentId, String rootId) {
        if (registry.isLive(parentId)) {
            registry.setDepth(sessionId, registry.depthOf(parentId) + 1);
        }
        String description = taskDescriptions.remove(parentId);
        if (description != null && ledger.statusHistory(alias).isEmpty()) {
            ledger.appendStatus(alias, description);
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("session", sessionId);
        details.put("root", rootId);
        details.put("depth", registry.depthOf(sessionId));
        audit("registry.register", sessionId, "ok", details);
    }

    /**
     * Remembers the description of a host {@code task} call; it becomes the spawned session's first status.
     */
    public void onToolStarting(String sessionId, String tool, String description) {
        try {
            if (ToolCompletion.TASK_TOOL.equals(tool) && description != null && !description.isBlank()) {
                taskDescriptions.put(sessionId, description.trim());
            }
        } catch (RuntimeException e) {
            auditError("tool.starting", sessionId, e);
        }
    }

    /**
     * A host {@code task} call returned: its child session is idle. Mail that arrived while it ran
     * and was never presented resumes it.
     */
    public void onToolCompleted(ToolCompletion completion) {
        if (completion == null || !completion.isTask() || completion.childSessionId() == null) {
            return;
        }
        String childId = completion.childSessionId();
        try {
            if (registry.isRetired(childId)) {
                audit("tool.completed", childId, "retired", Map.of("tool", completion.tool()));
                return;
            }
            if (!registry.isLive(childId) && registry.register(childId, parentLookup.rootOf(childId)).isEmpty()) {
                return;
            }
            tracker.markIdle(childId);
            resumeCoordinator.resumePending(childId);
        } catch (RuntimeException e) {
            auditError("tool.completed", childId, e);
        }
    }

    public void onSessionIdle(String sessionId) {
        try {
            if (registry.isLive(sessionId)) {
                tracker.markIdle(sessionId);
            }
        } catch (RuntimeException e) {
            auditError("session.idle", sessionId, e);
        }
    }

    /**
     * Holds a session at its completion point until its children drained and its mail was seen.
     * A satisfied first-level child is archived; the last one of its root delivers the summary
     * and resets the mesh.
     */
    public BarrierOutcome onBeforeComplete(String sessionId) {
        try {
            if (!registry.isLive(sessionId)) {
                return BarrierOutcome.satisfied(0);
            }
            BarrierOutcome outcome = barrier.await(sessionId);
            if (outcome.kind() == BarrierOutcome.Kind.SATISFIED && parentLookup.isFirstLevelChild(sessionId)) {
                completeFirstLevelChild(sessionId);
            }
            return outcome;
        } catch (RuntimeException e) {
            auditError("barrier.await", sessionId, e);
            return BarrierOutcome.aborted(0);
        }
    }

    private void completeFirstLevelChild(String sessionId) {
        String alias = registry.alias(sessionId);
        ledger.archive(alias, transcriptOutput(sessionId, alias));
        String rootId = parentLookup.parentOf(sessionId).orElse(null);
        if (summaryTracker.complete(rootId, sessionId)) {
            deliverSummary(rootId);
        }
    }

    private void deliverSummary(String rootId) {
        Map<String, List<String>> histories = new LinkedHashMap<>();
        for (AgentIdentity identity : registry.liveIdentitiesUnder(rootId)) {
            String alias = identity.alias();
            CompletedAgentRecord record = ledger.archived(alias)
                    .orElseGet(() -> ledger.archive(alias, transcriptOutput(identity.sessionId(), alias)));
            histories.put(alias, record.statusHistory());
        }
        String summary = Prompts.rootSummary(histories);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("agents", histories.size());
        String result = "empty";
        if (summary != null) {
            try {
                directory.note(rootId, summary);
                result = "ok";
            } catch (HostException e) {
                result = "error";
                details.put("error", String.valueOf(e.getMessage()));
            }
        }
        audit("mesh.summary", rootId, result, details);
        reset();
    }

    private String transcriptOutput(String sessionId, String alias) {
        try {
            return SessionTranscripts.finalOutput(directory.messages(sessionId), sessionId, alias);
        } catch (HostException e) {
            audit("host.messages", sessionId, "error", Map.of("error", String.valueOf(e.getMessage())));
            return Prompts.agentCompleted(alias);
        }
    }

    public ToolResult broadcast(String sessionId, JsonNode args) {
        BroadcastArgs parsed;
        try {
            parsed = BroadcastArgs.fromJson(args);
        } catch (IllegalArgumentException e) {
            return ToolResult.error("Error: " + e.getMessage());
        }
        return broadcast(sessionId, parsed);
    }

    public ToolResult broadcast(String sessionId, BroadcastArgs args) {
        try {
            touch(sessionId);
            return broadcastTool.execute(sessionId, args);
        } catch (RuntimeException e) {
            auditError(BroadcastTool.NAME, sessionId, e);
            return ToolResult.error("Error: " + e.getMessage());
        }
    }

    public ToolResult subagent(String sessionId, JsonNode args) {
        SubagentArgs parsed;
        try {
            parsed = SubagentArgs.fromJson(args);
        } catch (IllegalArgumentException e) {
            return ToolResult.error("Error: " + e.getMessage());
        }
        return subagent(sessionId, parsed);
    }

    public ToolResult subagent(String sessionId, SubagentArgs args) {
        try {
            touch(sessionId);
            return subagentTool.execute(sessionId, args);
        } catch (RuntimeException e) {
            auditError(SubagentTool.NAME, sessionId, e);
            return ToolResult.error(Prompts.subagentError(String.valueOf(e.getMessage())));
        }
    }

    public ToolResult recall(String sessionId, JsonNode args) {
        RecallArgs parsed;
        try {
            parsed = RecallArgs.fromJson(args);
        } catch (IllegalArgumentException e) {
            return ToolResult.error("Error: " + e.getMessage());
        }
        return recall(sessionId, parsed);
    }

    public ToolResult recall(String sessionId, RecallArgs args) {
        try {
            return recallTool.execute(sessionId, args);
        } catch (RuntimeException e) {
            auditError(RecallTool.NAME, sessionId, e);
            return ToolResult.error("Error: " + e.getMessage());
        }
    }

    public Optional<SyntheticTurn> assembleContext(String sessionId, List<HostMessage> history) {
        try {
            return contextAssembler.assemble(sessionId, history);
        } catch (RuntimeException e) {
            auditError("context.assemble", sessionId, e);
            return Optional.empty();
        }
    }

    /**
     * Delivers a user-typed message ({@code [@agent] text}) to an agent of {@code rootSessionId}'s
     * mesh as mail from {@code user}, waking the agent if it is idle.
     */
    public UserMessageOutcome sendUserMessage(String rootSessionId, String input) {
        try {
            UserCommand command = UserCommand.parse(input);
            if (command == null) {
                return UserMessageOutcome.failed(Prompts.USER_MESSAGE_EMPTY);
            }
            String targetId;
            if (command.target() == null) {
                Optional<String> coordinator = summaryTracker.coordinatorOf(rootSessionId);
                if (coordinator.isEmpty()) {
                    return UserMessageOutcome.failed(registry.liveIdentities().isEmpty()
                            ? Prompts.USER_MESSAGE_NO_MESH
                            : Prompts.USER_MESSAGE_NO_COORDINATOR);
                }
                targetId = coordinator.get();
            } else {
                Optional<String> resolved = registry.resolve(command.target());
                if (resolved.isEmpty()) {
                    audit("user.message", rootSessionId, "unknown_recipient", Map.of("target", command.target()));
                    return UserMessageOutcome.failed(Prompts.userTargetNotFound(command.target()));
                }
                targetId = resolved.get();
            }
            if (registry.isRetired(targetId)) {
                String name = command.target() == null ? targetId : command.target();
                return UserMessageOutcome.failed(Prompts.userTargetRetired(name));
            }
            String targetAlias = registry.alias(targetId);
            MailMessage sent = mailbox.send(Prompts.USER_SENDER, targetId, Prompts.userMessage(command.message()));
            notifier.userMessageSent(rootSessionId, targetAlias, command.message());
            boolean woke = !ResumeCoordinator.refused(resumeCoordinator.wakeFor(sent));

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("target", targetAlias);
            details.put("seq", sent.seq());
            details.put("woke", woke);
            audit("user.message", rootSessionId, "ok", details);
            return new UserMessageOutcome(true, targetAlias, Prompts.userMessageSent(targetAlias));
        } catch (RuntimeException e) {
            auditError("user.message", rootSessionId, e);
            return UserMessageOutcome.failed("Error: " + e.getMessage());
        }
    }

    /**
     * Retires every live identity and drops mailboxes, states, pending children and live
     * histories. Archived agents and the alias counter survive.
     */
    public ResetOutcome reset() {
        IdentityRegistry.ResetSummary retired = registry.reset();
        mailbox.reset();
        tracker.reset();
        barrier.reset();
        pendingOutputs.reset();
        int clearedHistories = ledger.clearLive();
        taskDescriptions.clear();
        ResetOutcome outcome = new ResetOutcome(retired.retiredNow(), retired.retiredTotal(), clearedHistories);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("retired_now", outcome.retiredNow());
        details.put("retired_total", outcome.retiredTotal());
        details.put("cleared_histories", outcome.clearedHistories());
        auditLogger.log(AuditLogger.AuditEvent.of("mesh.reset", "system", "mesh", "ok", details));
        return outcome;
    }

    /**
     * Waits until no child run or resume chain is queued or running.
     */
    public boolean awaitQuiescence(long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + Math.max(0L, timeoutMs);
        while (workers.getActiveCount() > 0 || !workers.getQueue().isEmpty()) {
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            Thread.sleep(10L);
        }
        return true;
    }

    private void launchChild(String callerSessionId, String childSessionId, String childAlias, String prompt) {
        ChildRun run = new ChildRun(
                directory,
                tracker,
                ledger,
                delivery,
                resumeCoordinator,
                notifier,
                auditLogger,
                promptTimeout,
                callerSessionId,
                childSessionId,
                childAlias,
                prompt
        );
        try {
            workers.execute(run);
        } catch (RejectedExecutionException e) {
            run.abandon("worker pool is full");
        }
    }

    private void touch(String sessionId) {
        if (registry.isLive(sessionId)) {
            tracker.markActive(sessionId);
        }
    }

    private static ThreadPoolExecutor newWorkerPool(int workers, int queueCapacity) {
        AtomicInteger counter = new AtomicInteger();
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                workers,
                workers,
                60L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "agentmesh-worker-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                }
        );
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }

    private void audit(String action, String sessionId, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(
                action,
                registry.alias(sessionId),
                "session/" + sessionId,
                result,
                details
        ));
    }

    private void auditError(String action, String sessionId, RuntimeException e) {
        audit(action, sessionId, "error", Map.of(
                "error_type", e.getClass().getSimpleName(),
                "error", String.valueOf(e.getMessage())
        ));
    }

    @Override
    public void close() {
        reaper.close();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(WORKER_SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public AgentMeshConfig config() {
        return config;
    }

    public SessionDirectory directory() {
        return directory;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public IdentityRegistry registry() {
        return registry;
    }

    public MailboxStore mailbox() {
        return mailbox;
    }

    public SessionStateTracker tracker() {
        return tracker;
    }

    public CompletionBarrier barrier() {
        return barrier;
    }

    public StatusLedger ledger() {
        return ledger;
    }

    public ParentLookup parentLookup() {
        return parentLookup;
    }

    public RootSummaryTracker summaryTracker() {
        return summaryTracker;
    }

    public MailboxReaper reaper() {
        return reaper;
    }

    public OutputDelivery delivery() {
        return delivery;
    }

    public record SessionStart(String alias, int depth, boolean allowSubagent, String systemPrompt) {
    }

    public record UserMessageOutcome(boolean success, String targetAlias, String message) {
        static UserMessageOutcome failed(String message) {
            return new UserMessageOutcome(false, null, message);
        }
    }

    public record ResetOutcome(int retiredNow, int retiredTotal, int clearedHistories) {
    }
}
