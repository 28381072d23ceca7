package me.golemcore.quota.port.inbound;


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

import me.golemcore.quota.domain.model.AdmissionDecision;

/**
 * Admission control entry point for request handlers.
 *
 * @see me.golemcore.quota.domain.service.QuotaGuardService
 */
public interface AdmissionPort {

    /**
     * Decide whether {@code userId} may perform one billable action and, if so,
     * charge it against the current period.
     *
     * @throws me.golemcore.quota.domain.model.StorageUnavailableException
     *             when the ledger is unavailable and the failure policy is
     *             {@code PROPAGATE}
     */
    AdmissionDecision checkAndConsume(String userId);

    /**
     * Same decision as {@link #checkAndConsume(String)} would make, without any
     * side effect.
     */
    AdmissionDecision peek(String userId);
}
