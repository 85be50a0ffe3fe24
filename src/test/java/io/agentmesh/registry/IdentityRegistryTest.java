package io.agentmesh.registry;

import io.agentmesh.model.AgentIdentity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class IdentityRegistryTest {

    @Test
    void aliasesRollOverToNumberedRoundAfterZ() {
        IdentityRegistry registry = new IdentityRegistry();
        List<String> aliases = new ArrayList<>();
        for (int i = 0; i < 28; i++) {
            aliases.add(registry.register("ses-" + i, "root").orElseThrow());
        }
        Assertions.assertEquals("agentA", aliases.get(0));
        Assertions.assertEquals("agentZ", aliases.get(25));
        Assertions.assertEquals("agentA1", aliases.get(26));
        Assertions.assertEquals("agentB1", aliases.get(27));
        Assertions.assertEquals("agentA2", AliasSequence.aliasFor(52));
    }

    @Test
    void registerIsIdempotent() {
        IdentityRegistry registry = new IdentityRegistry();
        Assertions.assertEquals(Optional.of("agentA"), registry.register("ses-1", "root"));
        Assertions.assertEquals(Optional.of("agentA"), registry.register("ses-1", "root"));
        Assertions.assertEquals(1L, registry.aliasesIssued());
    }

    @Test
    void concurrentRegistrationOfSameIdYieldsOneAlias() throws Exception {
        IdentityRegistry registry = new IdentityRegistry();
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<String>>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return registry.register("ses-race", "root");
                }));
            }
            start.countDown();
            Set<String> seen = new HashSet<>();
            for (Future<Optional<String>> future : futures) {
                seen.add(future.get(5, TimeUnit.SECONDS).orElseThrow());
            }
            Assertions.assertEquals(Set.of("agentA"), seen);
            Assertions.assertEquals(1L, registry.aliasesIssued());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void resetRetiresIdsAndKeepsCounter() {
        IdentityRegistry registry = new IdentityRegistry();
        registry.register("ses-1", "root");
        registry.register("ses-2", "root");

        IdentityRegistry.ResetSummary summary = registry.reset();

        Assertions.assertEquals(2, summary.retiredNow());
        Assertions.assertEquals(2, summary.retiredTotal());
        Assertions.assertTrue(registry.isRetired("ses-1"));
        Assertions.assertFalse(registry.isLive("ses-1"));
        Assertions.assertTrue(registry.register("ses-1", "root").isEmpty());
        Assertions.assertEquals("ses-1", registry.alias("ses-1"));
        Assertions.assertTrue(registry.resolve("agentA").isEmpty());
        Assertions.assertEquals(Optional.of("agentC"), registry.register("ses-3", "root"));
    }

    @Test
    void resolvePrefersAliasThenLiveRawId() {
        IdentityRegistry registry = new IdentityRegistry();
        registry.register("ses-1", "root");
        Assertions.assertEquals(Optional.of("ses-1"), registry.resolve("agentA"));
        Assertions.assertEquals(Optional.of("ses-1"), registry.resolve(" ses-1 "));
        Assertions.assertTrue(registry.resolve("agentB").isEmpty());
        Assertions.assertTrue(registry.resolve("").isEmpty());
    }

    @Test
    void peersAreScopedToTheCallersRoot() {
        IdentityRegistry registry = new IdentityRegistry();
        registry.register("a", "root-1");
        registry.register("b", "root-1");
        registry.register("c", "root-2");

        List<String> peersOfA = registry.peers("a").stream().map(AgentIdentity::alias).toList();
        Assertions.assertEquals(List.of("agentB"), peersOfA);
        Assertions.assertEquals(List.of(), registry.knownAliases("c"));
        Assertions.assertEquals(3, registry.peers("outsider").size());
        Assertions.assertEquals(2, registry.liveIdentitiesUnder("root-1").size());
    }

    @Test
    void depthDefaultsToOneAndAnnouncementIsOnce() {
        IdentityRegistry registry = new IdentityRegistry();
        registry.register("a", "root");
        Assertions.assertEquals(1, registry.depthOf("a"));
        registry.setDepth("a", 3);
        Assertions.assertEquals(3, registry.depthOf("a"));

        Assertions.assertTrue(registry.markAnnounced("a"));
        Assertions.assertFalse(registry.markAnnounced("a"));
        registry.reset();
        Assertions.assertFalse(registry.hasAnnounced("a"));
        Assertions.assertEquals(1, registry.depthOf("a"));
    }
}
