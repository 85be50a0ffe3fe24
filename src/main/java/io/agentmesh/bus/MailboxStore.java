package io.agentmesh.bus;

import io.agentmesh.model.HandledMessage;
import io.agentmesh.model.MailMessage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One bounded, ordered mailbox per recipient session.
 *
 * <p>Sequence numbers are assigned per recipient at enqueue and only grow; eviction can leave
 * gaps. The presented set records which unhandled messages were already shown to the
 * recipient, so {@link #needingWake(String)} never asks for a second wake about them.
 */
public final class MailboxStore {
    public static final String TRUNCATION_SUFFIX = "... [truncated]";

    private final int capacity;
    private final int maxBodyLength;
    private final Map<String, Mailbox> mailboxes = new HashMap<>();
    private final AtomicLong evictedTotal = new AtomicLong(0L);
    private final AtomicLong expiredTotal = new AtomicLong(0L);

    public MailboxStore(int capacity, int maxBodyLength) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        if (maxBodyLength < 1) {
            throw new IllegalArgumentException("maxBodyLength must be >= 1");
        }
        this.capacity = capacity;
        this.maxBodyLength = maxBodyLength;
    }

    public MailMessage send(String from, String to, String body) {
        return send(from, to, body, System.currentTimeMillis());
    }

    public synchronized MailMessage send(String from, String to, String body, long nowMs) {
        if (to == null || to.isBlank()) {
            throw new IllegalArgumentException("recipient is required");
        }
        Mailbox mailbox = mailboxes.computeIfAbsent(to, ignored -> new Mailbox());
        if (mailbox.entries.size() >= capacity) {
            evictOne(mailbox);
        }
        Entry entry = new Entry(newMessageId(), mailbox.nextSeq++, from, to, truncate(body), nowMs);
        mailbox.entries.addLast(entry);
        return entry.snapshot();
    }

    private void evictOne(Mailbox mailbox) {
        Iterator<Entry> it = mailbox.entries.iterator();
        while (it.hasNext()) {
            if (it.next().handled) {
                it.remove();
                evictedTotal.incrementAndGet();
                return;
            }
        }
        Entry oldest = mailbox.entries.removeFirst();
        mailbox.presented.remove(oldest.seq);
        evictedTotal.incrementAndGet();
    }

    public String truncate(String body) {
        String text = body == null ? "" : body;
        if (text.length() <= maxBodyLength) {
            return text;
        }
        return text.substring(0, maxBodyLength) + TRUNCATION_SUFFIX;
    }

    public synchronized List<MailMessage> messages(String sessionId) {
        Mailbox mailbox = mailboxes.get(sessionId);
        if (mailbox == null) {
            return List.of();
        }
        List<MailMessage> out = new ArrayList<>(mailbox.entries.size());
        for (Entry entry : mailbox.entries) {
            out.add(entry.snapshot());
        }
        return out;
    }

    public synchronized List<MailMessage> unhandled(String sessionId) {
        Mailbox mailbox = mailboxes.get(sessionId);
        if (mailbox == null) {
            return List.of();
        }
        List<MailMessage> out = new ArrayList<>();
        for (Entry entry : mailbox.entries) {
            if (!entry.handled) {
                out.add(entry.snapshot());
            }
        }
        return out;
    }

    /**
     * Unhandled messages not yet presented to the recipient. The only source of active wakes.
     */
    public synchronized List<MailMessage> needingWake(String sessionId) {
        Mailbox mailbox = mailboxes.get(sessionId);
        if (mailbox == null) {
            return List.of();
        }
        List<MailMessage> out = new ArrayList<>();
        for (Entry entry : mailbox.entries) {
            if (!entry.handled && !mailbox.presented.contains(entry.seq)) {
                out.add(entry.snapshot());
            }
        }
        return out;
    }

    public synchronized boolean hasNeedingWake(String sessionId) {
        Mailbox mailbox = mailboxes.get(sessionId);
        if (mailbox == null) {
            return false;
        }
        for (Entry entry : mailbox.entries) {
            if (!entry.handled && !mailbox.presented.contains(entry.seq)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Flips the matching unhandled messages to handled. Already-handled or unknown seqs are
     * skipped, so repeating the call returns an empty list.
     */
    public synchronized List<HandledMessage> markHandled(String sessionId, Collection<Long> seqs) {
        Mailbox mailbox = mailboxes.get(sessionId);
        if (mailbox == null || seqs == null || seqs.isEmpty()) {
            return List.of();
        }
        Set<Long> wanted = new HashSet<>(seqs);
        List<HandledMessage> out = new ArrayList<>();
        for (Entry entry : mailbox.entries) {
            if (!entry.handled && wanted.contains(entry.seq)) {
                entry.handled = true;
                out.add(new HandledMessage(entry.seq, entry.from, entry.body));
            }
        }
        return out;
    }

    public synchronized void markPresented(String sessionId, Collection<Long> seqs) {
        if (seqs == null || seqs.isEmpty()) {
            return;
        }
        mailboxes.computeIfAbsent(sessionId, ignored -> new Mailbox()).presented.addAll(seqs);
    }

    public synchronized boolean isPresented(String sessionId, long seq) {
        Mailbox mailbox = mailboxes.get(sessionId);
        return mailbox != null && mailbox.presented.contains(seq);
    }

    public synchronized int size(String sessionId) {
        Mailbox mailbox = mailboxes.get(sessionId);
        return mailbox == null ? 0 : mailbox.entries.size();
    }

    public synchronized int totalSize() {
        int total = 0;
        for (Mailbox mailbox : mailboxes.values()) {
            total += mailbox.entries.size();
        }
        return total;
    }

    /**
     * Drops handled messages older than {@code handledTtlMs} and unhandled ones older than
     * {@code unhandledTtlMs}.
     */
    public synchronized int expire(long nowMs, long handledTtlMs, long unhandledTtlMs) {
        int removed = 0;
        for (Mailbox mailbox : mailboxes.values()) {
            int before = mailbox.entries.size();
            mailbox.entries.removeIf(entry -> {
                long age = nowMs - entry.createdAtMs;
                return entry.handled ? age > handledTtlMs : age > unhandledTtlMs;
            });
            removed += before - mailbox.entries.size();
            Set<Long> kept = new HashSet<>();
            for (Entry entry : mailbox.entries) {
                kept.add(entry.seq);
            }
            mailbox.presented.retainAll(kept);
        }
        expiredTotal.addAndGet(removed);
        return removed;
    }

    public synchronized void reset() {
        mailboxes.clear();
    }

    public long evictedTotal() {
        return evictedTotal.get();
    }

    public long expiredTotal() {
        return expiredTotal.get();
    }

    private static String newMessageId() {
        long bits = ThreadLocalRandom.current().nextLong() & Long.MAX_VALUE;
        String token = Long.toString(bits, 36);
        return token.length() > 8 ? token.substring(0, 8) : token;
    }

    private static final class Mailbox {
        private final LinkedList<Entry> entries = new LinkedList<>();
        private final Set<Long> presented = new HashSet<>();
        private long nextSeq = 1L;
    }

    private static final class Entry {
        private final String id;
        private final long seq;
        private final String from;
        private final String to;
        private final String body;
        private final long createdAtMs;
        private boolean handled;

        private Entry(String id, long seq, String from, String to, String body, long createdAtMs) {
            this.id = id;
            this.seq = seq;
            this.from = from;
            this.to = to;
            this.body = body;
            this.createdAtMs = createdAtMs;
        }

        private MailMessage snapshot() {
            return new MailMessage(id, seq, from, to, body, createdAtMs, handled);
        }
    }
}
