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
 * Raised when a tier name does not resolve in the catalog. On the admission
 * path this is an integrity fault and is turned into a denial.
 */
public class UnknownTierException extends RuntimeException {

    private final String tierName;

    public UnknownTierException(String tierName) {
        super("Unknown tier: " + tierName);
        this.tierName = tierName;
    }

    public String getTierName() {
        return tierName;
    }
}
