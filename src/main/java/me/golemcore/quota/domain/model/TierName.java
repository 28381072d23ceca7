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

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of subscription tier identifiers. Catalog entries and ledger rows
 * refer to tiers by {@link #getId()}.
 */
public enum TierName {

    FREEMIUM("freemium"), PRO("pro"), TEAM("team"), ENTERPRISE("enterprise");

    private final String id;

    TierName(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Resolve a tier identifier, case-insensitively. Blank or unrecognized values
     * (including the legacy {@code free} tier) resolve to empty.
     */
    public static Optional<TierName> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TierName name : values()) {
            if (name.id.equals(normalized)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }

    public static boolean isValid(String value) {
        return fromId(value).isPresent();
    }
}
