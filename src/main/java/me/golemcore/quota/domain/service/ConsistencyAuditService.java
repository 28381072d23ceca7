package me.golemcore.quota.domain.service;


/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.quota.domain.model.AuditReport;
import me.golemcore.quota.domain.model.ConsistencyViolation;
import me.golemcore.quota.domain.model.LedgerUpdate;
import me.golemcore.quota.domain.model.StorageUnavailableException;
import me.golemcore.quota.domain.model.TierName;
import me.golemcore.quota.domain.model.UsageRecord;
import me.golemcore.quota.port.outbound.UsageLedgerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Verifies ledger invariants across all rows and repairs violations in place.
 *
 * <p>
 * Repairs:
 * <ul>
 * <li>{@link ConsistencyViolation#INVALID_TIER} - case or whitespace variants
 * of a catalog tier are canonicalized; anything else (null, blank, legacy
 * {@code free}, unknown) becomes the default tier</li>
 * <li>{@link ConsistencyViolation#MISSING_PERIOD_RESET} - one period from
 * now</li>
 * <li>{@link ConsistencyViolation#NEGATIVE_USAGE} - clamped to zero</li>
 * </ul>
 *
 * <p>
 * Rows are never deleted. Each row is checked and repaired inside one atomic
 * ledger update, and every correction is logged and counted. A repaired ledger
 * yields zero corrections on the next run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsistencyAuditService {

    private final UsageLedgerPort usageLedgerPort;
    private final TierCatalogService tierCatalogService;
    private final BillingPeriodCalculator billingPeriodCalculator;
    private final IntegrityFaultLog integrityFaultLog;
    private final Clock clock;

    public AuditReport audit() {
        Instant startedAt = clock.instant();
        Map<String, String> flagged = integrityFaultLog.snapshot();
        Map<ConsistencyViolation, Integer> corrected = AuditReport.emptyCounts();
        List<String> repairedUsers = new ArrayList<>();
        List<String> failedUsers = new ArrayList<>();

        List<UsageRecord> rows = usageLedgerPort.listAllUsageRows();
        for (UsageRecord row : rows) {
            String userId = row.getUserId();
            Set<ConsistencyViolation> found = EnumSet.noneOf(ConsistencyViolation.class);
            try {
                LedgerUpdate update = usageLedgerPort.update(userId, current -> repair(current, startedAt, found));
                if (update.applied()) {
                    found.forEach(violation -> corrected.merge(violation, 1, Integer::sum));
                    repairedUsers.add(userId);
                    log.warn("[Audit] Repaired user {}: {}", userId, found);
                }
                if (update.record() != null && tierCatalogService.contains(update.record().getTierName())) {
                    integrityFaultLog.clear(userId);
                }
            } catch (StorageUnavailableException e) {
                failedUsers.add(userId);
                log.error("[Audit] Failed to repair user {}: {}", userId, e.getMessage());
            }
        }

        AuditReport report = AuditReport.builder()
                .checked(rows.size())
                .corrected(corrected)
                .repairedUsers(repairedUsers)
                .failedUsers(failedUsers)
                .flaggedByGuard(new ArrayList<>(flagged.keySet()))
                .startedAt(startedAt)
                .completedAt(clock.instant())
                .build();
        log.info("[Audit] Checked {} rows, {} corrections {}, {} failures",
                report.getChecked(), report.getTotalCorrections(), corrected, failedUsers.size());
        return report;
    }

    private UsageRecord repair(UsageRecord row, Instant now, Set<ConsistencyViolation> found) {
        found.clear();
        if (!tierCatalogService.contains(row.getTierName())) {
            found.add(ConsistencyViolation.INVALID_TIER);
            row.setTierName(canonicalTierOrDefault(row.getTierName()));
        }
        if (row.getPeriodResetAt() == null) {
            found.add(ConsistencyViolation.MISSING_PERIOD_RESET);
            row.setPeriodResetAt(billingPeriodCalculator.firstPeriodEnd(now));
        }
        if (row.getMessagesUsed() < 0) {
            found.add(ConsistencyViolation.NEGATIVE_USAGE);
            row.setMessagesUsed(0);
        }
        if (!found.isEmpty()) {
            row.setUpdatedAt(now);
        }
        return row;
    }

    private String canonicalTierOrDefault(String tierName) {
        return TierName.fromId(tierName)
                .map(TierName::getId)
                .filter(tierCatalogService::contains)
                .orElseGet(tierCatalogService::getDefaultTierName);
    }
}
