package io.agentmesh.runtime;

import io.agentmesh.bus.MailboxStore;
import io.agentmesh.host.ParentLookup;
import io.agentmesh.observability.AuditLogger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Fixed-interval sweep of stale mail and cached parent lookups on one daemon thread.
 */
public final class MailboxReaper implements AutoCloseable {
    private static final long SHUTDOWN_WAIT_MS = 5_000L;

    private final MailboxStore mailbox;
    private final ParentLookup parentLookup;
    private final AuditLogger auditLogger;
    private final long intervalMs;
    private final long handledTtlMs;
    private final long unhandledTtlMs;
    private final LongSupplier clock;
    private ScheduledExecutorService scheduler;

    public MailboxReaper(
            MailboxStore mailbox,
            ParentLookup parentLookup,
            AuditLogger auditLogger,
            long intervalMs,
            long handledTtlMs,
            long unhandledTtlMs
    ) {
        this(mailbox, parentLookup, auditLogger, intervalMs, handledTtlMs, unhandledTtlMs, System::currentTimeMillis);
    }

    public MailboxReaper(
            MailboxStore mailbox,
            ParentLookup parentLookup,
            AuditLogger auditLogger,
            long intervalMs,
            long handledTtlMs,
            long unhandledTtlMs,
            LongSupplier clock
    ) {
        if (intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.mailbox = mailbox;
        this.parentLookup = parentLookup;
        this.auditLogger = auditLogger;
        this.intervalMs = intervalMs;
        this.handledTtlMs = handledTtlMs;
        this.unhandledTtlMs = unhandledTtlMs;
        this.clock = clock;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "agentmesh-reaper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleAtFixedRate(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    public synchronized boolean running() {
        return scheduler != null && !scheduler.isShutdown();
    }

    public SweepOutcome sweep(long nowMs) {
        int removedMessages = mailbox.expire(nowMs, handledTtlMs, unhandledTtlMs);
        int expiredParents = parentLookup.expire(nowMs);
        SweepOutcome outcome = new SweepOutcome(removedMessages, expiredParents, mailbox.totalSize());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("removed_messages", outcome.removedMessages());
        details.put("expired_parents", outcome.expiredParents());
        details.put("remaining_messages", outcome.remainingMessages());
        auditLogger.log(AuditLogger.AuditEvent.of("reaper.sweep", "system", "mailbox/*", "ok", details));
        return outcome;
    }

    private void sweepSafely() {
        try {
            sweep(clock.getAsLong());
        } catch (RuntimeException e) {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    "reaper.sweep",
                    "system",
                    "mailbox/*",
                    "error",
                    Map.of("error", String.valueOf(e.getMessage()))
            ));
        }
    }

    @Override
    public void close() {
        ScheduledExecutorService current;
        synchronized (this) {
            current = scheduler;
            scheduler = null;
        }
        if (current == null) {
            return;
        }
        current.shutdownNow();
        try {
            current.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public record SweepOutcome(int removedMessages, int expiredParents, int remainingMessages) {
    }
}
