package me.golemcore.quota.domain.model;


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

/**
 * Ledger invariant violations detected and repaired by the consistency audit.
 */
public enum ConsistencyViolation {

    /**
     * Tier name null, blank, or not present in the catalog. Repaired to the
     * default tier.
     */
    INVALID_TIER,

    /**
     * No period end recorded. Repaired to one period from the audit time.
     */
    MISSING_PERIOD_RESET,

    /**
     * Negative usage counter. Clamped to zero.
     */
    NEGATIVE_USAGE
}
