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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A subscription tier as stored in the tier catalog.
 *
 * <p>
 * Metering is an explicit flag rather than a sentinel allowance value: when
 * {@code metered} is false the tier is unlimited and {@code monthlyAllowance}
 * is ignored. An allowance of {@code 0} on a metered tier is a valid, fully
 * exhausted allowance.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Tier {

    /**
     * Legacy allowance value that marks an unmetered tier in imported catalogs.
     */
    public static final long UNLIMITED_ALLOWANCE = -1L;

    private String name;

    @Builder.Default
    private boolean metered = true;

    private long monthlyAllowance;

    @Builder.Default
    private TierFeatures features = new TierFeatures();

    private Instant updatedAt;

    public Tier copy() {
        return toBuilder()
                .features(features != null ? features.toBuilder().build() : new TierFeatures())
                .build();
    }
}
