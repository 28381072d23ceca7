package me.golemcore.quota.adapter.inbound.web.controller;

import me.golemcore.quota.adapter.inbound.web.dto.AdmissionResponse;
import me.golemcore.quota.adapter.inbound.web.dto.AssignTierRequest;
import me.golemcore.quota.domain.model.AdmissionDecision;
import me.golemcore.quota.domain.model.UsageRecord;
import me.golemcore.quota.domain.service.UsageLedgerService;
import me.golemcore.quota.port.inbound.AdmissionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QuotaControllerTest {

    private static final Instant RESET_AT = Instant.parse("2026-03-11T10:00:00Z");

    private AdmissionPort admissionPort;
    private UsageLedgerService usageLedgerService;
    private QuotaController controller;

    @BeforeEach
    void setUp() {
        admissionPort = mock(AdmissionPort.class);
        usageLedgerService = mock(UsageLedgerService.class);
        controller = new QuotaController(admissionPort, usageLedgerService);
    }

    @Test
    void shouldReturnOkWhenAllowed() {
        when(admissionPort.checkAndConsume("alice")).thenReturn(AdmissionDecision.allowed(row("freemium", 3), 10));

        StepVerifier.create(controller.consume("alice"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    AdmissionResponse body = response.getBody();
                    assertNotNull(body);
                    assertTrue(body.isAllowed());
                    assertEquals(7L, body.getRemaining());
                    assertEquals(RESET_AT, body.getResetAt());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnPaymentRequiredWhenExhausted() {
        when(admissionPort.checkAndConsume("alice")).thenReturn(AdmissionDecision.exhausted(row("freemium", 10), 10));

        StepVerifier.create(controller.consume("alice"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.PAYMENT_REQUIRED, response.getStatusCode());
                    assertEquals("Monthly message limit reached", response.getBody().getReason());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnForbiddenForUnknownTier() {
        when(admissionPort.checkAndConsume("alice")).thenReturn(AdmissionDecision.unknownTier(row("bogus", 0)));

        StepVerifier.create(controller.consume("alice"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
                    assertEquals("UNKNOWN_TIER", response.getBody().getFault());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnServiceUnavailableForStorageFault() {
        when(admissionPort.checkAndConsume("alice")).thenReturn(AdmissionDecision.storageUnavailable("alice"));

        StepVerifier.create(controller.consume("alice"))
                .assertNext(response -> assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldHideSentinelForUnlimitedTier() {
        when(admissionPort.peek("bob")).thenReturn(AdmissionDecision.unlimited(row("pro", 500)));

        StepVerifier.create(controller.status("bob"))
                .assertNext(response -> {
                    AdmissionResponse body = response.getBody();
                    assertNotNull(body);
                    assertTrue(body.isUnlimited());
                    assertNull(body.getRemaining());
                    assertNull(body.getMonthlyAllowance());
                    assertEquals(500, body.getMessagesUsed());
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateValidationErrors() {
        when(admissionPort.checkAndConsume("a b")).thenThrow(new IllegalArgumentException("bad id"));

        StepVerifier.create(controller.consume("a b"))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void shouldAssignTierAndReturnStatus() {
        when(admissionPort.peek("alice")).thenReturn(AdmissionDecision.unlimited(row("team", 0)));

        StepVerifier.create(controller.assignTier("alice", new AssignTierRequest("team")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("team", response.getBody().getTierName());
                })
                .verifyComplete();
        verify(usageLedgerService).assignTier("alice", "team");
    }

    @Test
    void shouldRejectAssignWithoutTierName() {
        StepVerifier.create(controller.assignTier("alice", new AssignTierRequest(" ")))
                .expectErrorMatches(error -> error instanceof ResponseStatusException rse
                        && rse.getStatusCode().value() == 400)
                .verify();
        verify(usageLedgerService, never()).assignTier("alice", " ");
    }

    @Test
    void decisionWithoutFaultHasNullFaultField() {
        AdmissionResponse response = AdmissionResponse.from(AdmissionDecision.allowed(row("freemium", 1), 10));

        assertNull(response.getFault());
        assertFalse(response.isUnlimited());
    }

    private static UsageRecord row(String tier, long used) {
        return UsageRecord.builder()
                .userId("alice")
                .tierName(tier)
                .messagesUsed(used)
                .periodResetAt(RESET_AT)
                .build();
    }
}
