package com.chainlog.audit;

import com.chainlog.config.AuditProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class AuditSessionRegistryTest {

    private AuditProperties props;
    private AuditSessionRegistry registry;

    @BeforeEach
    void setUp() {
        props = new AuditProperties();
        registry = new AuditSessionRegistry(props,
                Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void sessionsKeepIndependentChains() {
        AuditRecord a1 = registry.log("eng-1", "alice", "scan", Map.of("n", 1), "task-1", null);
        AuditRecord a2 = registry.log("eng-1", "alice", "scan", Map.of("n", 2), "task-1", null);
        AuditRecord b1 = registry.log("eng-1", "bob", "scan", Map.of("n", 1), "task-1", null);

        assertEquals(1, a1.sequence());
        assertEquals(2, a2.sequence());
        assertEquals(a1.chainHash(), a2.prevChainHash());
        assertEquals(1, b1.sequence());
        assertEquals(AuditHasher.GENESIS_HASH, b1.prevChainHash());
        assertEquals(2, registry.size());
    }

    @Test
    void tailReflectsLastRecord() {
        assertTrue(registry.tail("eng-1", "alice").isEmpty());
        registry.log("eng-1", "alice", "a", 1, "auth", null);
        AuditRecord last = registry.log("eng-1", "alice", "b", 2, "auth", "t-2");

        AuditSessionRegistry.Tail tail = registry.tail("eng-1", "alice").orElseThrow();
        assertEquals(2, tail.sequence());
        assertEquals(last.chainHash(), tail.tailHash());
    }

    @Test
    void closingDropsTheTip() {
        registry.log("eng-1", "alice", "a", 1, "auth", null);
        assertTrue(registry.close("eng-1", "alice"));
        assertFalse(registry.close("eng-1", "alice"));

        AuditRecord fresh = registry.log("eng-1", "alice", "a", 1, "auth", null);
        assertEquals(1, fresh.sequence());
        assertEquals(AuditHasher.GENESIS_HASH, fresh.prevChainHash());
    }

    @Test
    void refusesSessionsBeyondTheLimit() {
        props.getSessions().setMaxSessions(2);
        registry.open("e", "o1");
        registry.open("e", "o2");
        assertSame(registry.open("e", "o1"), registry.open("e", "o1"));
        assertThrows(AuditSessionRegistry.SessionLimitExceededException.class, () -> registry.open("e", "o3"));
    }

    @Test
    void concurrentWritersOnOneSessionProduceAGapFreeChain() throws Exception {
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<List<AuditRecord>>> futures = new ArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            final int worker = t;
            futures.add(pool.submit(() -> {
                start.await();
                List<AuditRecord> out = new ArrayList<>();
                for (int i = 0; i < perThread; i++) {
                    out.add(registry.log("eng-1", "shared", "w" + worker, Map.of("i", i), "auth", null));
                }
                return out;
            }));
        }
        start.countDown();

        List<AuditRecord> all = new ArrayList<>();
        for (Future<List<AuditRecord>> f : futures) all.addAll(f.get(30, TimeUnit.SECONDS));
        pool.shutdown();

        all.sort(Comparator.comparingLong(AuditRecord::sequence));
        for (int i = 0; i < all.size(); i++) assertEquals(i + 1, all.get(i).sequence());
        assertTrue(AuditVerifyService.verifyRecords(all));
        assertEquals(threads * perThread, registry.tail("eng-1", "shared").orElseThrow().sequence());
    }
}
