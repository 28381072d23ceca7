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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Usage ledger entry, one per user.
 *
 * <p>
 * {@code periodResetAt} is the end of the current period, i.e. the moment the
 * next reset is due. {@code messagesUsed} counts admissions granted since the
 * last reset.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UsageRecord {

    private String userId;
    private String tierName;
    private long messagesUsed;
    private Instant periodResetAt;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Whether the current period has elapsed at {@code now}.
     */
    @JsonIgnore
    public boolean isDue(Instant now) {
        return periodResetAt != null && !now.isBefore(periodResetAt);
    }

    public UsageRecord copy() {
        return toBuilder().build();
    }
}
