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

import me.golemcore.quota.domain.model.AdmissionDecision;
import me.golemcore.quota.domain.model.LedgerUpdate;
import me.golemcore.quota.domain.model.StorageUnavailableException;
import me.golemcore.quota.domain.model.Tier;
import me.golemcore.quota.domain.model.UsageRecord;
import me.golemcore.quota.infrastructure.config.QuotaProperties;
import me.golemcore.quota.port.inbound.AdmissionPort;
import me.golemcore.quota.port.outbound.UsageLedgerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

/**
 * Admission control for billable messages.
 *
 * <p>
 * One {@link #checkAndConsume(String)} call:
 * <ol>
 * <li>Loads the user's ledger row, creating it on the default tier at first
 * use</li>
 * <li>Resolves the tier; an unknown tier denies and is recorded in
 * {@link IntegrityFaultLog}</li>
 * <li>Runs a single atomic ledger operation that rolls an elapsed period over
 * and then increments the counter iff it is below the allowance</li>
 * </ol>
 *
 * <p>
 * Because rollover and increment happen in the same per-row unit, a request
 * arriving after the period end is always charged against the new period,
 * whether or not the reset sweep has reached the row yet. Unlimited tiers are
 * still counted but never denied. An allowance of zero always denies.
 *
 * <p>
 * Ledger write failures follow {@code quota.guard.storage-failure-policy}:
 * {@code PROPAGATE} rethrows {@link StorageUnavailableException}, {@code DENY}
 * returns a denial carrying
 * {@link me.golemcore.quota.domain.model.AdmissionFault#STORAGE_UNAVAILABLE}.
 *
 * @since 1.0
 * @see UsageLedgerPort
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuotaGuardService implements AdmissionPort {

    private static final String LOG_PREFIX = "[Quota]";

    private final UsageLedgerPort usageLedgerPort;
    private final UsageLedgerService usageLedgerService;
    private final TierCatalogService tierCatalogService;
    private final BillingPeriodCalculator billingPeriodCalculator;
    private final IntegrityFaultLog integrityFaultLog;
    private final QuotaProperties properties;
    private final Clock clock;

    @Override
    public AdmissionDecision checkAndConsume(String userId) {
        String id = UserIdValidator.normalizeOrThrow(userId);
        try {
            return consume(id);
        } catch (StorageUnavailableException e) {
            return onStorageFailure(id, e);
        }
    }

    @Override
    public AdmissionDecision peek(String userId) {
        String id = UserIdValidator.normalizeOrThrow(userId);
        Instant now = clock.instant();

        UsageRecord view = usageLedgerPort.loadUsage(id)
                .map(row -> projectToCurrentPeriod(row, now))
                .orElseGet(() -> UsageRecord.builder()
                        .userId(id)
                        .tierName(tierCatalogService.getDefaultTierName())
                        .messagesUsed(0)
                        .periodResetAt(billingPeriodCalculator.firstPeriodEnd(now))
                        .build());

        Optional<Tier> tier = tierCatalogService.find(view.getTierName());
        if (tier.isEmpty()) {
            return AdmissionDecision.unknownTier(view);
        }
        if (!tier.get().isMetered()) {
            return AdmissionDecision.unlimited(view);
        }
        long allowance = tier.get().getMonthlyAllowance();
        return view.getMessagesUsed() < allowance
                ? AdmissionDecision.allowed(view, allowance)
                : AdmissionDecision.exhausted(view, allowance);
    }

    private AdmissionDecision consume(String userId) {
        Instant now = clock.instant();
        Function<UsageRecord, Instant> nextPeriodEnd = usage -> billingPeriodCalculator.nextPeriodEnd(usage, now);

        UsageRecord row = usageLedgerService.ensureAccount(userId, now);
        Optional<Tier> resolved = tierCatalogService.find(row.getTierName());
        if (resolved.isEmpty()) {
            integrityFaultLog.recordUnknownTier(userId, row.getTierName());
            UsageRecord current = usageLedgerPort.resetIfDue(userId, now, nextPeriodEnd).record();
            log.debug("{} Denied user {}: unknown tier '{}'", LOG_PREFIX, userId, row.getTierName());
            return AdmissionDecision.unknownTier(current != null ? current : row);
        }

        Tier tier = resolved.get();
        long limit = tier.isMetered() ? tier.getMonthlyAllowance() : Long.MAX_VALUE;
        LedgerUpdate update = usageLedgerPort.conditionalIncrement(userId, limit, now, nextPeriodEnd);
        UsageRecord current = update.record();
        if (current == null) {
            throw new IllegalStateException("Usage row vanished for user " + userId);
        }

        if (!tier.isMetered()) {
            return AdmissionDecision.unlimited(current);
        }
        if (update.applied()) {
            log.debug("{} Allowed user {}: {}/{} on {}", LOG_PREFIX, userId, current.getMessagesUsed(),
                    limit, tier.getName());
            return AdmissionDecision.allowed(current, limit);
        }
        log.debug("{} Denied user {}: allowance {} exhausted on {}", LOG_PREFIX, userId, limit, tier.getName());
        return AdmissionDecision.exhausted(current, limit);
    }

    private UsageRecord projectToCurrentPeriod(UsageRecord row, Instant now) {
        if (row.getPeriodResetAt() == null) {
            row.setPeriodResetAt(billingPeriodCalculator.firstPeriodEnd(now));
        } else if (row.isDue(now)) {
            row.setMessagesUsed(0);
            row.setPeriodResetAt(billingPeriodCalculator.nextPeriodEnd(row, now));
        }
        return row;
    }

    private AdmissionDecision onStorageFailure(String userId, StorageUnavailableException e) {
        if (properties.getGuard().getStorageFailurePolicy() == QuotaProperties.StorageFailurePolicy.DENY) {
            log.error("{} Ledger unavailable for user {}, denying: {}", LOG_PREFIX, userId, e.getMessage());
            return AdmissionDecision.storageUnavailable(userId);
        }
        log.error("{} Ledger unavailable for user {}: {}", LOG_PREFIX, userId, e.getMessage());
        throw e;
    }
}
