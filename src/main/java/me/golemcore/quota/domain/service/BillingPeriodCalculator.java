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

import me.golemcore.quota.domain.model.UsageRecord;
import me.golemcore.quota.infrastructure.config.QuotaProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.Period;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Billing period arithmetic.
 *
 * <p>
 * Periods are anchored per account: every period end is the account's
 * creation time plus a whole number of periods in the configured zone, never
 * the time a reset happened to run. Anchoring on the creation time keeps a
 * month-end anchor from drifting: an account opened on Jan 31 resets on Feb
 * 28, then on Mar 31. A period end that is several periods behind jumps
 * straight to the first boundary after {@code now}.
 */
@Component
public class BillingPeriodCalculator {

    private final Period period;
    private final ZoneId zone;

    public BillingPeriodCalculator(QuotaProperties properties) {
        this.period = properties.getPeriod();
        this.zone = ZoneId.of(properties.getZone());
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("quota.period must be positive: " + period);
        }
    }

    /**
     * End of a period starting at {@code start}.
     */
    public Instant firstPeriodEnd(Instant start) {
        return start.atZone(zone).plus(period).toInstant();
    }

    /**
     * Period end that follows the row's current period at {@code now}. A row
     * without a period end gets a fresh period starting at {@code now}; a row
     * without a creation time is anchored on its current period end.
     */
    public Instant nextPeriodEnd(UsageRecord row, Instant now) {
        Instant currentEnd = row.getPeriodResetAt();
        if (currentEnd == null) {
            return firstPeriodEnd(now);
        }
        Instant createdAt = row.getCreatedAt();
        Instant anchor = createdAt != null && createdAt.isBefore(currentEnd) ? createdAt : currentEnd;
        return firstBoundaryAfter(anchor, now);
    }

    /**
     * First boundary {@code anchor + k * period}, k &gt;= 1, strictly after
     * {@code now}.
     */
    Instant firstBoundaryAfter(Instant anchor, Instant now) {
        ZonedDateTime start = anchor.atZone(zone);
        int periods = 1;
        Instant candidate = start.plus(period).toInstant();
        while (!candidate.isAfter(now)) {
            periods++;
            candidate = start.plus(period.multipliedBy(periods)).toInstant();
        }
        return candidate;
    }

    public Period getPeriod() {
        return period;
    }
}
