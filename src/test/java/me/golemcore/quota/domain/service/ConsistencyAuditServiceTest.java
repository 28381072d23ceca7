package me.golemcore.quota.domain.service;

import me.golemcore.quota.domain.model.AuditReport;
import me.golemcore.quota.domain.model.ConsistencyViolation;
import me.golemcore.quota.domain.model.UsageRecord;
import me.golemcore.quota.testsupport.QuotaHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsistencyAuditServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final Instant RESET = Instant.parse("2026-03-11T10:00:00Z");

    private QuotaHarness harness;
    private ConsistencyAuditService service;

    @BeforeEach
    void setUp() {
        harness = QuotaHarness.start(NOW);
        service = harness.auditService;
    }

    @Test
    void cleanLedgerNeedsNoCorrections() {
        harness.guard.checkAndConsume("alice");
        harness.ledgerService.assignTier("bob", "pro");

        AuditReport report = service.audit();

        assertEquals(2, report.getChecked());
        assertEquals(0, report.getTotalCorrections());
        assertTrue(report.getRepairedUsers().isEmpty());
    }

    @Test
    void repairsUnknownAndLegacyTiersToDefault() {
        harness.ledger.createUsage("legacy", "free", NOW, RESET);
        harness.ledger.createUsage("bogus", "bogus", NOW, RESET);
        harness.ledger.createUsage("blank", " ", NOW, RESET);

        AuditReport report = service.audit();

        assertEquals(3, report.getCorrected().get(ConsistencyViolation.INVALID_TIER));
        assertEquals(List.of("blank", "bogus", "legacy"), report.getRepairedUsers());
        for (String user : List.of("legacy", "bogus", "blank")) {
            assertEquals("freemium", harness.ledger.loadUsage(user).orElseThrow().getTierName());
        }
    }

    @Test
    void canonicalizesCaseVariants() {
        harness.ledger.createUsage("shouty", "PRO", NOW, RESET);

        service.audit();

        assertEquals("pro", harness.ledger.loadUsage("shouty").orElseThrow().getTierName());
    }

    @Test
    void repairsMissingResetAndNegativeUsage() {
        harness.ledger.createUsage("alice", "freemium", NOW, null);
        harness.ledger.update("alice", row -> {
            row.setMessagesUsed(-4);
            return row;
        });

        AuditReport report = service.audit();

        UsageRecord row = harness.ledger.loadUsage("alice").orElseThrow();
        assertEquals(0, row.getMessagesUsed());
        assertEquals(RESET, row.getPeriodResetAt());
        assertEquals(1, report.getCorrected().get(ConsistencyViolation.MISSING_PERIOD_RESET));
        assertEquals(1, report.getCorrected().get(ConsistencyViolation.NEGATIVE_USAGE));
        assertEquals(2, report.getTotalCorrections());
        assertEquals(List.of("alice"), report.getRepairedUsers());
    }

    @Test
    void secondRunReportsNothing() {
        harness.ledger.createUsage("alice", "bogus", NOW, null);
        harness.ledger.createUsage("bob", "free", NOW, RESET);

        assertEquals(3, service.audit().getTotalCorrections());
        AuditReport second = service.audit();

        assertEquals(0, second.getTotalCorrections());
        assertEquals(2, second.getChecked());
    }

    @Test
    void neverDeletesRows() {
        harness.ledger.createUsage("alice", "bogus", NOW, null);

        service.audit();

        assertEquals(1, harness.ledger.listAllUsageRows().size());
    }

    @Test
    void reportsUsersFlaggedByGuardAndClearsThemAfterRepair() {
        harness.ledger.createUsage("alice", "bogus", NOW, RESET);
        harness.guard.checkAndConsume("alice");

        AuditReport report = service.audit();

        assertEquals(List.of("alice"), report.getFlaggedByGuard());
        assertEquals(0, harness.faultLog.size());
    }

    @Test
    void failedRepairIsReportedAndRetried() {
        harness.ledger.createUsage("alice", "bogus", NOW, RESET);
        harness.storage.failWrites(true);

        AuditReport failed = service.audit();

        assertEquals(List.of("alice"), failed.getFailedUsers());
        assertEquals(0, failed.getTotalCorrections());

        harness.storage.failWrites(false);
        assertEquals(1, service.audit().getTotalCorrections());
    }
}
