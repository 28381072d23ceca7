package me.golemcore.quota.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.quota.domain.model.AuditReport;
import me.golemcore.quota.domain.model.SweepReport;
import me.golemcore.quota.domain.service.ConsistencyAuditService;
import me.golemcore.quota.domain.service.PeriodResetService;
import me.golemcore.quota.domain.service.UsageLedgerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Operational endpoints: on-demand reset sweep, consistency audit and ledger
 * summary.
 */
@RestController
@RequestMapping("/api/quota/admin")
@RequiredArgsConstructor
public class QuotaAdminController {

    private final PeriodResetService periodResetService;
    private final ConsistencyAuditService consistencyAuditService;
    private final UsageLedgerService usageLedgerService;

    @PostMapping("/reset-sweep")
    public Mono<ResponseEntity<SweepReport>> runResetSweep() {
        return Mono.fromCallable(() -> ResponseEntity.ok(periodResetService.sweep()));
    }

    @PostMapping("/audit")
    public Mono<ResponseEntity<AuditReport>> runAudit() {
        return Mono.fromCallable(() -> ResponseEntity.ok(consistencyAuditService.audit()));
    }

    @GetMapping("/ledger/summary")
    public Mono<ResponseEntity<Map<String, Long>>> ledgerSummary() {
        return Mono.fromCallable(() -> ResponseEntity.ok(usageLedgerService.countByTier()));
    }
}
