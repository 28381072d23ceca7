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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one consistency audit pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditReport {

    private int checked;

    @Builder.Default
    private Map<ConsistencyViolation, Integer> corrected = emptyCounts();

    @Builder.Default
    private List<String> repairedUsers = new ArrayList<>();

    @Builder.Default
    private List<String> failedUsers = new ArrayList<>();

    /**
     * Users denied for an unknown tier since the previous audit.
     */
    @Builder.Default
    private List<String> flaggedByGuard = new ArrayList<>();

    private Instant startedAt;
    private Instant completedAt;

    @JsonProperty("totalCorrections")
    public int getTotalCorrections() {
        return corrected.values().stream().mapToInt(Integer::intValue).sum();
    }

    public static Map<ConsistencyViolation, Integer> emptyCounts() {
        Map<ConsistencyViolation, Integer> counts = new EnumMap<>(ConsistencyViolation.class);
        for (ConsistencyViolation violation : ConsistencyViolation.values()) {
            counts.put(violation, 0);
        }
        return counts;
    }
}
