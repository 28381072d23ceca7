package me.golemcore.quota.domain.service;

import me.golemcore.quota.domain.model.SweepReport;
import me.golemcore.quota.domain.model.UsageRecord;
import me.golemcore.quota.testsupport.QuotaHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PeriodResetServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");

    private QuotaHarness harness;
    private PeriodResetService service;

    @BeforeEach
    void setUp() {
        harness = QuotaHarness.start(NOW);
        service = harness.resetService;
    }

    @Test
    void sweepResetsOnlyDueRows() {
        consume("early", 3);
        harness.clock.advance(Duration.ofDays(10));
        consume("late", 2);
        harness.clock.setInstant(Instant.parse("2026-03-15T00:00:00Z"));

        SweepReport report = service.sweep();

        assertEquals(2, report.scanned());
        assertEquals(1, report.reset());
        assertEquals(0, report.failed());
        UsageRecord early = harness.ledger.loadUsage("early").orElseThrow();
        assertEquals(0, early.getMessagesUsed());
        assertEquals(Instant.parse("2026-04-11T10:00:00Z"), early.getPeriodResetAt());
        assertEquals(2, harness.ledger.loadUsage("late").orElseThrow().getMessagesUsed());
    }

    @Test
    void sweepIsIdempotent() {
        consume("alice", 4);
        harness.clock.advance(Duration.ofDays(31));

        assertEquals(1, service.sweep().reset());
        UsageRecord afterFirst = harness.ledger.loadUsage("alice").orElseThrow();
        SweepReport second = service.sweep();
        UsageRecord afterSecond = harness.ledger.loadUsage("alice").orElseThrow();

        assertEquals(0, second.reset());
        assertEquals(afterFirst, afterSecond);
    }

    @Test
    void lazyResetBeforeSweepIsNotRepeated() {
        consume("alice", 10);
        harness.clock.advance(Duration.ofDays(31));
        consume("alice", 1);

        assertEquals(0, service.sweep().reset());
        assertEquals(1, harness.ledger.loadUsage("alice").orElseThrow().getMessagesUsed());
    }

    @Test
    void sweepContinuesPastWriteFailures() {
        consume("alice", 1);
        consume("bob", 1);
        harness.clock.advance(Duration.ofDays(31));
        harness.storage.failWrites(true);

        SweepReport report = service.sweep();

        assertEquals(2, report.scanned());
        assertEquals(0, report.reset());
        assertEquals(2, report.failed());
        assertEquals(1, harness.ledger.loadUsage("alice").orElseThrow().getMessagesUsed());

        harness.storage.failWrites(false);
        assertEquals(2, service.sweep().reset());
    }

    @Test
    void rowsWithoutResetDateAreLeftToAudit() {
        harness.ledger.createUsage("alice", "freemium", NOW, null);
        harness.clock.advance(Duration.ofDays(60));

        assertEquals(0, service.sweep().reset());
    }

    @Test
    void resetUserAppliesOnlyWhenDue() {
        consume("alice", 2);

        assertFalse(service.resetUser("alice"));
        harness.clock.advance(Duration.ofDays(31));
        assertTrue(service.resetUser("alice"));
        assertFalse(service.resetUser("alice"));
    }

    @Test
    void resetUserRejectsInvalidId() {
        assertThrows(IllegalArgumentException.class, () -> service.resetUser("no/pe"));
    }

    @Test
    void sweepRacingAdmissionsResetsEachRowOnce() throws Exception {
        int users = 20;
        int admissions = 5;
        for (int i = 0; i < users; i++) {
            consume("user" + i, 10);
        }
        harness.clock.advance(Duration.ofDays(31));

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> decisions = new ArrayList<>();
        Future<SweepReport> sweep;
        try {
            sweep = executor.submit(() -> {
                start.await();
                return service.sweep();
            });
            for (int i = 0; i < users; i++) {
                String userId = "user" + i;
                for (int j = 0; j < admissions; j++) {
                    decisions.add(executor.submit(() -> {
                        start.await();
                        return harness.guard.checkAndConsume(userId).isAllowed();
                    }));
                }
            }
            start.countDown();
            for (Future<Boolean> decision : decisions) {
                assertTrue(decision.get(10, TimeUnit.SECONDS));
            }
            SweepReport report = sweep.get(10, TimeUnit.SECONDS);
            assertEquals(0, report.failed());
            assertTrue(report.reset() <= users);
        } finally {
            executor.shutdownNow();
        }

        for (int i = 0; i < users; i++) {
            UsageRecord row = harness.ledger.loadUsage("user" + i).orElseThrow();
            assertEquals(admissions, row.getMessagesUsed());
            assertEquals(Instant.parse("2026-04-11T10:00:00Z"), row.getPeriodResetAt());
        }
    }

    private void consume(String userId, int times) {
        for (int i = 0; i < times; i++) {
            harness.guard.checkAndConsume(userId);
        }
    }
}
