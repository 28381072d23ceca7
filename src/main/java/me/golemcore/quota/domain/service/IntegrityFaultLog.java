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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Users whose ledger row was found referencing an unknown tier during an
 * admission check. Entries are cleared when the consistency audit repairs the
 * row.
 */
@Component
@Slf4j
public class IntegrityFaultLog {

    private final Map<String, String> unknownTierByUser = new ConcurrentHashMap<>();

    /**
     * @return true if this is the first fault recorded for the user since the last
     *         clear
     */
    public boolean recordUnknownTier(String userId, String tierName) {
        String safeTier = tierName != null ? tierName : "<null>";
        boolean first = unknownTierByUser.put(userId, safeTier) == null;
        if (first) {
            log.warn("[Integrity] User {} references unknown tier '{}'", userId, safeTier);
        }
        return first;
    }

    public void clear(String userId) {
        unknownTierByUser.remove(userId);
    }

    /**
     * Flagged users and the tier name seen, ordered by user id.
     */
    public Map<String, String> snapshot() {
        return new TreeMap<>(unknownTierByUser);
    }

    public int size() {
        return unknownTierByUser.size();
    }
}
