package me.golemcore.quota.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.quota.adapter.inbound.web.dto.AdmissionResponse;
import me.golemcore.quota.adapter.inbound.web.dto.AssignTierRequest;
import me.golemcore.quota.domain.model.AdmissionDecision;
import me.golemcore.quota.domain.model.AdmissionFault;
import me.golemcore.quota.domain.service.UsageLedgerService;
import me.golemcore.quota.port.inbound.AdmissionPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Per-user admission and status endpoints.
 *
 * <p>
 * A denied consume maps to {@code 402 Payment Required} when the allowance is
 * exhausted, {@code 403} for an account on an unknown tier and {@code 503} when
 * the ledger could not be written.
 */
@RestController
@RequestMapping("/api/quota/users")
@RequiredArgsConstructor
@Slf4j
public class QuotaController {

    private final AdmissionPort admissionPort;
    private final UsageLedgerService usageLedgerService;

    @PostMapping("/{userId}/consume")
    public Mono<ResponseEntity<AdmissionResponse>> consume(@PathVariable String userId) {
        return Mono.fromCallable(() -> {
            AdmissionDecision decision = admissionPort.checkAndConsume(userId);
            return ResponseEntity.status(statusOf(decision)).body(AdmissionResponse.from(decision));
        });
    }

    @GetMapping("/{userId}")
    public Mono<ResponseEntity<AdmissionResponse>> status(@PathVariable String userId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(AdmissionResponse.from(admissionPort.peek(userId))));
    }

    @PutMapping("/{userId}")
    public Mono<ResponseEntity<AdmissionResponse>> assignTier(@PathVariable String userId,
            @RequestBody AssignTierRequest request) {
        if (request == null || request.getTierName() == null || request.getTierName().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "tierName is required"));
        }
        return Mono.fromCallable(() -> {
            usageLedgerService.assignTier(userId, request.getTierName());
            log.info("[API] Assigned tier {} to user {}", request.getTierName(), userId);
            return ResponseEntity.ok(AdmissionResponse.from(admissionPort.peek(userId)));
        });
    }

    private static HttpStatus statusOf(AdmissionDecision decision) {
        if (decision.isAllowed()) {
            return HttpStatus.OK;
        }
        if (decision.getFault() == AdmissionFault.STORAGE_UNAVAILABLE) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (decision.getFault() == AdmissionFault.UNKNOWN_TIER) {
            return HttpStatus.FORBIDDEN;
        }
        return HttpStatus.PAYMENT_REQUIRED;
    }
}
