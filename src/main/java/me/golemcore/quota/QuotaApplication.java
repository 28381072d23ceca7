package me.golemcore.quota;


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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore quota service.
 *
 * <p>
 * Grants every user a bounded monthly allotment of billable messages according
 * to their subscription tier and answers, per request, whether the action is
 * permitted.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Tier Catalog</b> - tier allowances and feature flags, seeded from
 * configuration and administered over HTTP</li>
 * <li><b>Usage Ledger</b> - per-user counters with atomic per-row updates and
 * crash-safe persistence</li>
 * <li><b>Quota Guard</b> - deny-closed admission checks with lazy period
 * rollover</li>
 * <li><b>Period Reset Scheduler</b> - hourly idempotent sweep of elapsed
 * periods</li>
 * <li><b>Consistency Auditor</b> - on-demand detection and repair of ledger
 * invariant violations</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → QuotaController, TierCatalogController, QuotaAdminController
 * Domain Layer       → QuotaGuardService, PeriodResetService, ConsistencyAuditService
 * Infrastructure     → LocalStorageAdapter, StorageUsageLedgerAdapter
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code quota.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class QuotaApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuotaApplication.class, args);
    }

}
