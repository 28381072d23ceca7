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

import java.time.Instant;

/**
 * Summary of one period reset sweep.
 *
 * @param scanned
 *            ledger rows examined
 * @param reset
 *            rows whose period was rolled over by this sweep
 * @param failed
 *            rows that could not be written; they stay due and are retried by
 *            the next sweep
 */
public record SweepReport(int scanned, int reset, int failed, Instant startedAt, Instant completedAt) {
}
