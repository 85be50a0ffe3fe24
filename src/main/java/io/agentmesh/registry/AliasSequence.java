package io.agentmesh.registry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic alias generator: agentA..agentZ, then agentA1..agentZ1, agentA2 and so on.
 * Never rewinds, so an alias is not reused within the process.
 */
public final class AliasSequence {
    static final String PREFIX = "agent";

    private final AtomicLong counter = new AtomicLong(0L);

    public String next() {
        return aliasFor(counter.getAndIncrement());
    }

    public long issued() {
        return counter.get();
    }

    public static String aliasFor(long index) {
        if (index < 0) {
            throw new IllegalArgumentException("alias index must be >= 0");
        }
        char letter = (char) ('A' + (index % 26));
        long round = index / 26;
        return round == 0 ? PREFIX + letter : PREFIX + letter + round;
    }
}
