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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Result of a single quota evaluation.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code allowed} - whether the action is permitted</li>
 * <li>{@code remaining} - admissions left in the current period,
 * {@link Long#MAX_VALUE} for unlimited tiers</li>
 * <li>{@code resetAt} - end of the current period</li>
 * <li>{@code fault} - set when the decision was forced by a failure rather
 * than by the allowance</li>
 * </ul>
 *
 * <p>
 * Decisions are never persisted.
 */
@Data
@Builder
public class AdmissionDecision {

    private String userId;
    private boolean allowed;
    private boolean unlimited;
    private long remaining;
    private Instant resetAt;
    private String tierName;
    private long messagesUsed;
    private Long monthlyAllowance;
    private AdmissionFault fault;
    private String reason;

    public static AdmissionDecision allowed(UsageRecord record, long allowance) {
        return AdmissionDecision.builder()
                .userId(record.getUserId())
                .allowed(true)
                .remaining(Math.max(0, allowance - record.getMessagesUsed()))
                .resetAt(record.getPeriodResetAt())
                .tierName(record.getTierName())
                .messagesUsed(record.getMessagesUsed())
                .monthlyAllowance(allowance)
                .build();
    }

    public static AdmissionDecision unlimited(UsageRecord record) {
        return AdmissionDecision.builder()
                .userId(record.getUserId())
                .allowed(true)
                .unlimited(true)
                .remaining(Long.MAX_VALUE)
                .resetAt(record.getPeriodResetAt())
                .tierName(record.getTierName())
                .messagesUsed(record.getMessagesUsed())
                .build();
    }

    public static AdmissionDecision exhausted(UsageRecord record, long allowance) {
        return AdmissionDecision.builder()
                .userId(record.getUserId())
                .allowed(false)
                .remaining(0)
                .resetAt(record.getPeriodResetAt())
                .tierName(record.getTierName())
                .messagesUsed(record.getMessagesUsed())
                .monthlyAllowance(allowance)
                .reason("Monthly message limit reached")
                .build();
    }

    public static AdmissionDecision unknownTier(UsageRecord record) {
        return AdmissionDecision.builder()
                .userId(record.getUserId())
                .allowed(false)
                .remaining(0)
                .resetAt(record.getPeriodResetAt())
                .tierName(record.getTierName())
                .messagesUsed(record.getMessagesUsed())
                .fault(AdmissionFault.UNKNOWN_TIER)
                .reason("Unknown tier: " + record.getTierName())
                .build();
    }

    public static AdmissionDecision storageUnavailable(String userId) {
        return AdmissionDecision.builder()
                .userId(userId)
                .allowed(false)
                .remaining(0)
                .fault(AdmissionFault.STORAGE_UNAVAILABLE)
                .reason("Usage ledger unavailable")
                .build();
    }
}
