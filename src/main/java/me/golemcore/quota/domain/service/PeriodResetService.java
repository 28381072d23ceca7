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
import me.golemcore.quota.domain.model.StorageUnavailableException;
import me.golemcore.quota.domain.model.SweepReport;
import me.golemcore.quota.domain.model.UsageRecord;
import me.golemcore.quota.port.outbound.UsageLedgerPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Rolls elapsed periods over: zeroes the counter and advances
 * {@code periodResetAt} to the first period boundary after now.
 *
 * <p>
 * Every row is reset independently through
 * {@link UsageLedgerPort#resetIfDue}, so a sweep interrupted halfway can simply
 * be run again, and a row already reset lazily by an admission check is left
 * alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PeriodResetService {

    private final UsageLedgerPort usageLedgerPort;
    private final BillingPeriodCalculator billingPeriodCalculator;
    private final Clock clock;

    /**
     * Reset every due row.
     */
    public SweepReport sweep() {
        Instant startedAt = clock.instant();
        List<UsageRecord> rows = usageLedgerPort.listAllUsageRows();

        int reset = 0;
        int failed = 0;
        for (UsageRecord row : rows) {
            if (!row.isDue(startedAt)) {
                continue;
            }
            try {
                if (resetRow(row.getUserId(), startedAt)) {
                    reset++;
                }
            } catch (StorageUnavailableException e) {
                failed++;
                log.warn("[Reset] Failed to reset user {}: {}", row.getUserId(), e.getMessage());
            }
        }

        SweepReport report = new SweepReport(rows.size(), reset, failed, startedAt, clock.instant());
        if (reset > 0 || failed > 0) {
            log.info("[Reset] Sweep finished: scanned={}, reset={}, failed={}", rows.size(), reset, failed);
        } else {
            log.debug("[Reset] Sweep finished: scanned={}, nothing due", rows.size());
        }
        return report;
    }

    /**
     * Reset a single user's row if its period has elapsed.
     *
     * @return true iff a reset was applied
     */
    public boolean resetUser(String userId) {
        return resetRow(UserIdValidator.normalizeOrThrow(userId), clock.instant());
    }

    private boolean resetRow(String userId, Instant now) {
        LedgerUpdate update = usageLedgerPort.resetIfDue(userId, now,
                row -> billingPeriodCalculator.nextPeriodEnd(row, now));
        if (update.applied()) {
            log.debug("[Reset] User {} rolled over, next reset at {}", userId, update.record().getPeriodResetAt());
        }
        return update.applied();
    }
}
