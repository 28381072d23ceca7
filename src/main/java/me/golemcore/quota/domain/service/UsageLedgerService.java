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

import me.golemcore.quota.domain.model.LedgerUpdate;
import me.golemcore.quota.domain.model.UnknownTierException;
import me.golemcore.quota.domain.model.UsageRecord;
import me.golemcore.quota.port.outbound.UsageLedgerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Account-level operations on the usage ledger: opening accounts, tier
 * assignment and read-only views.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsageLedgerService {

    private final UsageLedgerPort usageLedgerPort;
    private final TierCatalogService tierCatalogService;
    private final BillingPeriodCalculator billingPeriodCalculator;
    private final Clock clock;

    /**
     * Return the user's row, creating it on the default tier with a fresh period
     * when the user has none.
     */
    public UsageRecord ensureAccount(String userId, Instant now) {
        Optional<UsageRecord> existing = usageLedgerPort.loadUsage(userId);
        if (existing.isPresent()) {
            return existing.get();
        }
        String tierName = tierCatalogService.getDefaultTierName();
        UsageRecord created = tierCatalogService.withTierReference(tierName,
                () -> usageLedgerPort.createUsage(userId, tierName, now, billingPeriodCalculator.firstPeriodEnd(now)));
        log.info("[Ledger] Opened account {} on tier {} (first use)", userId, created.getTierName());
        return created;
    }

    /**
     * Open an account on {@code tierName}, or move an existing account to it. The
     * usage counter and period are kept as they are.
     *
     * @throws IllegalArgumentException
     *             if the tier is not in the catalog
     */
    public UsageRecord assignTier(String userId, String tierName) {
        String id = UserIdValidator.normalizeOrThrow(userId);
        try {
            return tierCatalogService.withTierReference(tierName, () -> writeTier(id, tierName));
        } catch (UnknownTierException e) {
            throw new IllegalArgumentException("Unknown tier: " + tierName, e);
        }
    }

    private UsageRecord writeTier(String userId, String tierName) {
        Instant now = clock.instant();
        Optional<UsageRecord> existing = usageLedgerPort.loadUsage(userId);
        if (existing.isEmpty()) {
            UsageRecord created = usageLedgerPort.createUsage(userId, tierName, now,
                    billingPeriodCalculator.firstPeriodEnd(now));
            if (tierName.equals(created.getTierName())) {
                log.info("[Ledger] Opened account {} on tier {}", userId, tierName);
                return created;
            }
        }

        LedgerUpdate update = usageLedgerPort.update(userId, row -> {
            if (!tierName.equals(row.getTierName())) {
                row.setTierName(tierName);
                row.setUpdatedAt(now);
            }
            return row;
        });
        if (update.applied()) {
            log.info("[Ledger] Moved account {} to tier {}", userId, tierName);
        }
        return update.record();
    }

    public Optional<UsageRecord> findUsage(String userId) {
        return usageLedgerPort.loadUsage(UserIdValidator.normalizeOrThrow(userId));
    }

    /**
     * Number of ledger rows per tier name, blank names grouped under
     * {@code <none>}.
     */
    public Map<String, Long> countByTier() {
        return usageLedgerPort.listAllUsageRows().stream()
                .collect(Collectors.groupingBy(
                        row -> row.getTierName() == null || row.getTierName().isBlank()
                                ? "<none>"
                                : row.getTierName(),
                        TreeMap::new,
                        Collectors.counting()));
    }
}
