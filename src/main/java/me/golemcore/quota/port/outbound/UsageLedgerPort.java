package me.golemcore.quota.port.outbound;


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
import me.golemcore.quota.domain.model.UsageRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Persistence port for the usage ledger.
 *
 * <p>
 * Every mutating operation is atomic per user: implementations must apply the
 * read, the predicate and the write for one row as a single unit, so that a
 * period rollover and an increment on the same row can never interleave. Rows
 * of different users are independent.
 *
 * <p>
 * Records returned by this port are detached copies; mutating them has no
 * effect on the ledger.
 *
 * <p>
 * Mutations throw {@link me.golemcore.quota.domain.model.StorageUnavailableException}
 * when the row cannot be persisted, in which case the row is left unchanged.
 */
public interface UsageLedgerPort {

    Optional<UsageRecord> loadUsage(String userId);

    /**
     * Create the row for {@code userId} with zero usage, unless one exists.
     *
     * @return the row now stored, either the new one or the existing one
     */
    UsageRecord createUsage(String userId, String tierName, Instant now, Instant periodResetAt);

    /**
     * Roll the period over if due, then increment {@code messagesUsed} by one iff
     * it is below {@code limit}.
     *
     * @param nextPeriodEnd
     *            computes the next period end for the row; applied only when
     *            the row is due at {@code now} or has no period end
     * @return applied iff the counter was incremented
     */
    LedgerUpdate conditionalIncrement(String userId, long limit, Instant now,
            Function<UsageRecord, Instant> nextPeriodEnd);

    /**
     * Zero the counter and advance {@code periodResetAt} iff the row is due at
     * {@code now}. A row that is not due is left untouched.
     *
     * @return applied iff a reset happened
     */
    LedgerUpdate resetIfDue(String userId, Instant now, Function<UsageRecord, Instant> nextPeriodEnd);

    /**
     * Apply an arbitrary mutation atomically. The mutation receives a copy of the
     * current row; returning an equal row leaves storage untouched.
     *
     * @return applied iff the row changed
     */
    LedgerUpdate update(String userId, UnaryOperator<UsageRecord> mutation);

    /**
     * Snapshot of all rows, for the reset sweep and the audit.
     */
    List<UsageRecord> listAllUsageRows();
}
