package me.golemcore.quota.infrastructure.config;


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

import me.golemcore.quota.domain.model.Tier;
import me.golemcore.quota.domain.model.TierFeatures;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Period;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the quota engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code quota.*} prefix:
 * <ul>
 * <li>{@link GuardProperties} - admission failure policy</li>
 * <li>{@link ResetProperties} - background period reset sweep</li>
 * <li>{@link StorageProperties} - persistence location</li>
 * <li>{@code tiers} - seed catalog used when no catalog has been persisted</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "quota")
@Data
public class QuotaProperties {

    private Period period = Period.ofMonths(1);
    private String zone = "UTC";
    private String defaultTier = "freemium";
    private GuardProperties guard = new GuardProperties();
    private ResetProperties reset = new ResetProperties();
    private StorageProperties storage = new StorageProperties();
    private List<Tier> tiers = defaultTiers();

    public enum StorageFailurePolicy {
        PROPAGATE, DENY
    }

    @Data
    public static class GuardProperties {
        private StorageFailurePolicy storageFailurePolicy = StorageFailurePolicy.PROPAGATE;
    }

    @Data
    public static class ResetProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofHours(1);
        private Duration initialDelay = Duration.ofMinutes(1);
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/quota";
    }

    static List<Tier> defaultTiers() {
        List<Tier> tiers = new ArrayList<>();
        tiers.add(Tier.builder()
                .name("freemium")
                .metered(true)
                .monthlyAllowance(10)
                .features(TierFeatures.builder()
                        .aiProviders(new ArrayList<>(List.of("basic")))
                        .maxProjects(1)
                        .supportLevel("community")
                        .build())
                .build());
        tiers.add(Tier.builder()
                .name("pro")
                .metered(false)
                .features(TierFeatures.builder()
                        .aiProviders(new ArrayList<>(List.of("openai", "anthropic", "gemini", "azure")))
                        .maxProjects(1)
                        .fullCodebaseContext(true)
                        .gitIntegration(true)
                        .aiCodeReviewsPerMonth(10)
                        .supportLevel("email")
                        .build())
                .build());
        tiers.add(Tier.builder()
                .name("team")
                .metered(false)
                .features(TierFeatures.builder()
                        .aiProviders(new ArrayList<>(List.of("openai", "anthropic", "gemini", "azure", "custom")))
                        .maxProjects(10)
                        .fullCodebaseContext(true)
                        .gitIntegration(true)
                        .aiCodeReviewsPerMonth(100)
                        .teamFeatures(true)
                        .supportLevel("priority_email")
                        .build())
                .build());
        tiers.add(Tier.builder()
                .name("enterprise")
                .metered(false)
                .features(TierFeatures.builder()
                        .aiProviders(new ArrayList<>(List.of("all")))
                        .maxProjects(999_999)
                        .fullCodebaseContext(true)
                        .gitIntegration(true)
                        .aiCodeReviewsPerMonth(999_999)
                        .teamFeatures(true)
                        .supportLevel("dedicated")
                        .build())
                .build());
        return tiers;
    }
}
