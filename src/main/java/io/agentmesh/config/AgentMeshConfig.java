package io.agentmesh.config;

import io.agentmesh.session.DeliveryMode;
import io.agentmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

public final class AgentMeshConfig {
    public static final String SETTINGS_FILE_NAME = "agentmesh-settings.json";
    public static final int DEFAULT_MAX_INBOX_SIZE = 100;
    public static final int DEFAULT_MAX_MESSAGE_LENGTH = 10_000;
    public static final long DEFAULT_HANDLED_TTL_MS = 30L * 60L * 1000L;
    public static final long DEFAULT_UNHANDLED_TTL_MS = 2L * 60L * 60L * 1000L;
    public static final long DEFAULT_PARENT_CACHE_TTL_MS = 5L * 60L * 1000L;
    public static final long DEFAULT_REAPER_INTERVAL_MS = 60_000L;
    public static final int DEFAULT_MAX_STATUS_HISTORY = 50;
    public static final int DEFAULT_MAX_STATUS_LENGTH = 300;
    public static final int DEFAULT_MAX_RESUME_CHAIN = 16;
    public static final int DEFAULT_BARRIER_MAX_ITERATIONS = 100;
    public static final long DEFAULT_BARRIER_CHILD_TIMEOUT_MS = 5L * 60L * 1000L;
    public static final long DEFAULT_BARRIER_POLL_INTERVAL_MS = 100L;
    public static final long DEFAULT_HOST_PROMPT_TIMEOUT_MS = 10L * 60L * 1000L;
    public static final int DEFAULT_MAX_SUBAGENT_DEPTH = 3;
    public static final int DEFAULT_CHILD_WORKERS = 8;
    public static final int DEFAULT_WORKER_QUEUE_CAPACITY = 256;
    public static final int DEFAULT_AUDIT_TAIL_SIZE = 512;

    private final Path rootDir;
    private final Settings settings;

    public AgentMeshConfig(Path rootDir, Settings settings) {
        this.rootDir = rootDir;
        this.settings = settings == null ? Settings.defaults() : settings;
    }

    /**
     * In-memory configuration: built-in defaults and no audit file.
     */
    public static AgentMeshConfig defaults() {
        return new AgentMeshConfig(null, Settings.defaults());
    }

    public static AgentMeshConfig of(Settings settings) {
        return new AgentMeshConfig(null, settings);
    }

    /**
     * Resolves {@code root} and loads {@value #SETTINGS_FILE_NAME} from it when present.
     */
    public static AgentMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        return new AgentMeshConfig(base, loadSettings(base.resolve(SETTINGS_FILE_NAME)));
    }

    static Settings loadSettings(Path file) {
        if (!Files.isRegularFile(file)) {
            return Settings.defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return Settings.fromFile(raw, Settings.defaults());
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to load settings: " + file, e);
        }
    }

    public Optional<Path> rootDir() {
        return Optional.ofNullable(rootDir);
    }

    public Optional<Path> settingsFile() {
        return rootDir().map(dir -> dir.resolve(SETTINGS_FILE_NAME));
    }

    public Optional<Path> auditFile() {
        if (rootDir == null || !settings.auditEnabled()) {
            return Optional.empty();
        }
        return Optional.of(rootDir.resolve("audit").resolve("audit.log"));
    }

    public Settings settings() {
        return settings;
    }

    public record SessionUpdates(
            boolean statusUpdate,
            boolean messageSent,
            boolean subagentCreation,
            boolean subagentCompletion,
            boolean sessionResumption,
            boolean userMessage
    ) {
        public static SessionUpdates none() {
            return new SessionUpdates(false, false, false, false, false, false);
        }

        public static SessionUpdates all() {
            return new SessionUpdates(true, true, true, true, true, true);
        }

        static SessionUpdates fromFile(SessionUpdatesFile file, SessionUpdates defaults) {
            if (file == null) {
                return defaults;
            }
            return new SessionUpdates(
                    sanitizeBoolean(file.statusUpdate(), defaults.statusUpdate()),
                    sanitizeBoolean(file.messageSent(), defaults.messageSent()),
                    sanitizeBoolean(file.subagentCreation(), defaults.subagentCreation()),
                    sanitizeBoolean(file.subagentCompletion(), defaults.subagentCompletion()),
                    sanitizeBoolean(file.sessionResumption(), defaults.sessionResumption()),
                    sanitizeBoolean(file.userMessage(), defaults.userMessage())
            );
        }
    }

    public record Settings(
            int maxInboxSize,
            int maxMessageLength,
            long handledTtlMs,
            long unhandledTtlMs,
            long parentCacheTtlMs,
            long reaperIntervalMs,
            int maxStatusHistory,
            int maxStatusLength,
            int maxResumeChain,
            int barrierMaxIterations,
            long barrierChildTimeoutMs,
            long barrierPollIntervalMs,
            long hostPromptTimeoutMs,
            int maxSubagentDepth,
            int childWorkers,
            int workerQueueCapacity,
            DeliveryMode deliveryMode,
            SessionUpdates sessionUpdates,
            boolean auditEnabled
    ) {
        public static Settings defaults() {
            return new Settings(
                    DEFAULT_MAX_INBOX_SIZE,
                    DEFAULT_MAX_MESSAGE_LENGTH,
                    DEFAULT_HANDLED_TTL_MS,
                    DEFAULT_UNHANDLED_TTL_MS,
                    DEFAULT_PARENT_CACHE_TTL_MS,
                    DEFAULT_REAPER_INTERVAL_MS,
                    DEFAULT_MAX_STATUS_HISTORY,
                    DEFAULT_MAX_STATUS_LENGTH,
                    DEFAULT_MAX_RESUME_CHAIN,
                    DEFAULT_BARRIER_MAX_ITERATIONS,
                    DEFAULT_BARRIER_CHILD_TIMEOUT_MS,
                    DEFAULT_BARRIER_POLL_INTERVAL_MS,
                    DEFAULT_HOST_PROMPT_TIMEOUT_MS,
                    DEFAULT_MAX_SUBAGENT_DEPTH,
                    DEFAULT_CHILD_WORKERS,
                    DEFAULT_WORKER_QUEUE_CAPACITY,
                    DeliveryMode.INBOX,
                    SessionUpdates.none(),
                    true
            );
        }

        /**
         * Parses a settings document with the same field names as the settings file.
         */
        public static Settings parse(String json) {
            if (json == null || json.isBlank()) {
                return defaults();
            }
            try {
                SettingsFile raw = Jsons.mapper().readValue(json, SettingsFile.class);
                return fromFile(raw, defaults());
            } catch (IOException e) {
                throw new IllegalArgumentException("Invalid settings JSON", e);
            }
        }

        static Settings fromFile(SettingsFile file, Settings defaults) {
            if (file == null) {
                return defaults;
            }
            int maxInboxSize = sanitizeInt(file.maxInboxSize(), defaults.maxInboxSize(), 1);
            int maxMessageLength = sanitizeInt(file.maxMessageLength(), defaults.maxMessageLength(), 16);
            long handledTtl = sanitizeLong(file.handledTtlMs(), defaults.handledTtlMs(), 1_000L);
            long unhandledTtl = sanitizeLong(file.unhandledTtlMs(), defaults.unhandledTtlMs(), handledTtl);
            if (unhandledTtl < handledTtl) {
                unhandledTtl = handledTtl;
            }
            long parentCacheTtl = sanitizeLong(file.parentCacheTtlMs(), defaults.parentCacheTtlMs(), 0L);
            long reaperInterval = sanitizeLong(file.reaperIntervalMs(), defaults.reaperIntervalMs(), 100L);
            int maxStatusHistory = sanitizeInt(file.maxStatusHistory(), defaults.maxStatusHistory(), 1);
            int maxStatusLength = sanitizeInt(file.maxStatusLength(), defaults.maxStatusLength(), 16);
            int maxResumeChain = sanitizeInt(file.maxResumeChain(), defaults.maxResumeChain(), 1);
            int barrierMaxIterations = sanitizeInt(file.barrierMaxIterations(), defaults.barrierMaxIterations(), 1);
            long barrierChildTimeout = sanitizeLong(file.barrierChildTimeoutMs(), defaults.barrierChildTimeoutMs(), 10L);
            long barrierPollInterval = sanitizeLong(file.barrierPollIntervalMs(), defaults.barrierPollIntervalMs(), 1L);
            long hostPromptTimeout = sanitizeLong(file.hostPromptTimeoutMs(), defaults.hostPromptTimeoutMs(), 10L);
            int maxSubagentDepth = sanitizeInt(file.maxSubagentDepth(), defaults.maxSubagentDepth(), 0);
            int childWorkers = sanitizeInt(file.childWorkers(), defaults.childWorkers(), 1);
            int workerQueueCapacity = sanitizeInt(file.workerQueueCapacity(), defaults.workerQueueCapacity(), 1);
            DeliveryMode deliveryMode = file.deliveryMode() == null
                    ? defaults.deliveryMode()
                    : DeliveryMode.fromString(file.deliveryMode());
            return new Settings(
                    maxInboxSize,
                    maxMessageLength,
                    handledTtl,
                    unhandledTtl,
                    parentCacheTtl,
                    reaperInterval,
                    maxStatusHistory,
                    maxStatusLength,
                    maxResumeChain,
                    barrierMaxIterations,
                    barrierChildTimeout,
                    barrierPollInterval,
                    hostPromptTimeout,
                    maxSubagentDepth,
                    childWorkers,
                    workerQueueCapacity,
                    deliveryMode,
                    SessionUpdates.fromFile(file.sessionUpdates(), defaults.sessionUpdates()),
                    sanitizeBoolean(file.auditEnabled(), defaults.auditEnabled())
            );
        }
    }

    record SettingsFile(
            Integer maxInboxSize,
            Integer maxMessageLength,
            Long handledTtlMs,
            Long unhandledTtlMs,
            Long parentCacheTtlMs,
            Long reaperIntervalMs,
            Integer maxStatusHistory,
            Integer maxStatusLength,
            Integer maxResumeChain,
            Integer barrierMaxIterations,
            Long barrierChildTimeoutMs,
            Long barrierPollIntervalMs,
            Long hostPromptTimeoutMs,
            Integer maxSubagentDepth,
            Integer childWorkers,
            Integer workerQueueCapacity,
            String deliveryMode,
            SessionUpdatesFile sessionUpdates,
            Boolean auditEnabled
    ) {
    }

    record SessionUpdatesFile(
            Boolean statusUpdate,
            Boolean messageSent,
            Boolean subagentCreation,
            Boolean subagentCompletion,
            Boolean sessionResumption,
            Boolean userMessage
    ) {
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }
}
