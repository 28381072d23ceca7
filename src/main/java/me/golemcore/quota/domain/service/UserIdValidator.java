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

import java.util.regex.Pattern;

/**
 * User id validation helpers.
 *
 * <p>
 * Contract: {@code ^[a-zA-Z0-9_.@-]{1,128}$}. Ids double as ledger file names,
 * so anything outside this set is rejected before it reaches storage.
 */
public final class UserIdValidator {

    private static final Pattern USER_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_.@-]{1,128}$");

    private UserIdValidator() {
    }

    public static boolean isValid(String value) {
        String normalized = normalize(value);
        return normalized != null && USER_ID_PATTERN.matcher(normalized).matches();
    }

    public static String normalizeOrThrow(String value) {
        String normalized = normalize(value);
        if (normalized == null || !USER_ID_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("userId must match ^[a-zA-Z0-9_.@-]{1,128}$");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String candidate = value.trim();
        return candidate.isEmpty() ? null : candidate;
    }
}
