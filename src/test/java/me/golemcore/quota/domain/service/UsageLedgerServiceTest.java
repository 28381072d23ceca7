package me.golemcore.quota.domain.service;

import me.golemcore.quota.domain.model.TierInUseException;
import me.golemcore.quota.domain.model.UsageRecord;
import me.golemcore.quota.testsupport.QuotaHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UsageLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");

    private QuotaHarness harness;
    private UsageLedgerService service;

    @BeforeEach
    void setUp() {
        harness = QuotaHarness.start(NOW);
        service = harness.ledgerService;
    }

    @Test
    void ensureAccountOpensRowOnDefaultTier() {
        UsageRecord row = service.ensureAccount("alice", NOW);

        assertEquals("freemium", row.getTierName());
        assertEquals(0, row.getMessagesUsed());
        assertEquals(Instant.parse("2026-03-11T10:00:00Z"), row.getPeriodResetAt());
        assertEquals(NOW, row.getCreatedAt());
    }

    @Test
    void ensureAccountReturnsExistingRow() {
        service.assignTier("alice", "team");

        assertEquals("team", service.ensureAccount("alice", NOW).getTierName());
    }

    @Test
    void assignTierKeepsUsageAndPeriod() {
        harness.guard.checkAndConsume("alice");
        harness.guard.checkAndConsume("alice");

        UsageRecord row = service.assignTier("alice", "pro");

        assertEquals("pro", row.getTierName());
        assertEquals(2, row.getMessagesUsed());
        assertEquals(Instant.parse("2026-03-11T10:00:00Z"), row.getPeriodResetAt());
    }

    @Test
    void assignSameTierIsNoOp() {
        service.assignTier("alice", "pro");
        int writes = harness.storage.writeCount();

        service.assignTier("alice", "pro");

        assertEquals(writes, harness.storage.writeCount());
    }

    @Test
    void assignTierRejectsUnknownTier() {
        assertThrows(IllegalArgumentException.class, () -> service.assignTier("alice", "gold"));
        assertTrue(service.findUsage("alice").isEmpty());
    }

    @Test
    void assignTierRejectsInvalidUserId() {
        assertThrows(IllegalArgumentException.class, () -> service.assignTier("../alice", "pro"));
    }

    @Test
    void countByTierGroupsRows() {
        service.assignTier("alice", "pro");
        service.assignTier("bob", "pro");
        service.ensureAccount("carol", NOW);

        assertEquals(Map.of("freemium", 1L, "pro", 2L), service.countByTier());
    }

    @Test
    void deletingTierWhileAssigningNeverLeavesDanglingReference() throws Exception {
        int users = 8;
        for (int round = 0; round < 25; round++) {
            QuotaHarness fresh = QuotaHarness.start(NOW);
            ExecutorService executor = Executors.newFixedThreadPool(users + 1);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < users; i++) {
                    String userId = "user" + i;
                    futures.add(executor.submit(() -> {
                        start.await();
                        try {
                            fresh.ledgerService.assignTier(userId, "team");
                        } catch (IllegalArgumentException e) {
                            // tier already deleted
                        }
                        return null;
                    }));
                }
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        fresh.catalog.delete("team");
                    } catch (TierInUseException e) {
                        // an assignment got in first
                    }
                    return null;
                }));
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            for (UsageRecord row : fresh.ledger.listAllUsageRows()) {
                assertTrue(fresh.catalog.contains(row.getTierName()),
                        "row " + row.getUserId() + " references missing tier " + row.getTierName());
            }
        }
    }
}
