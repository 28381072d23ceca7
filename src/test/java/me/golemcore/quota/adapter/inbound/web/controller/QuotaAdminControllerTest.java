package me.golemcore.quota.adapter.inbound.web.controller;

import me.golemcore.quota.domain.model.AuditReport;
import me.golemcore.quota.domain.model.ConsistencyViolation;
import me.golemcore.quota.domain.model.SweepReport;
import me.golemcore.quota.domain.service.ConsistencyAuditService;
import me.golemcore.quota.domain.service.PeriodResetService;
import me.golemcore.quota.domain.service.UsageLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QuotaAdminControllerTest {

    private PeriodResetService periodResetService;
    private ConsistencyAuditService consistencyAuditService;
    private UsageLedgerService usageLedgerService;
    private QuotaAdminController controller;

    @BeforeEach
    void setUp() {
        periodResetService = mock(PeriodResetService.class);
        consistencyAuditService = mock(ConsistencyAuditService.class);
        usageLedgerService = mock(UsageLedgerService.class);
        controller = new QuotaAdminController(periodResetService, consistencyAuditService, usageLedgerService);
    }

    @Test
    void shouldRunResetSweep() {
        SweepReport report = new SweepReport(5, 2, 0, Instant.EPOCH, Instant.EPOCH);
        when(periodResetService.sweep()).thenReturn(report);

        StepVerifier.create(controller.runResetSweep())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(2, response.getBody().reset());
                })
                .verifyComplete();
    }

    @Test
    void shouldRunAudit() {
        Map<ConsistencyViolation, Integer> corrected = AuditReport.emptyCounts();
        corrected.put(ConsistencyViolation.INVALID_TIER, 2);
        when(consistencyAuditService.audit()).thenReturn(AuditReport.builder()
                .checked(4)
                .corrected(corrected)
                .repairedUsers(List.of("a", "b"))
                .build());

        StepVerifier.create(controller.runAudit())
                .assertNext(response -> {
                    assertEquals(4, response.getBody().getChecked());
                    assertEquals(2, response.getBody().getTotalCorrections());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnLedgerSummary() {
        when(usageLedgerService.countByTier()).thenReturn(Map.of("freemium", 3L));

        StepVerifier.create(controller.ledgerSummary())
                .assertNext(response -> assertEquals(3L, response.getBody().get("freemium")))
                .verifyComplete();
    }
}
