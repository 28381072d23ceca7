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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Feature flags attached to a tier. None of these take part in admission
 * decisions; they are carried for callers that gate features by tier.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TierFeatures {

    @Builder.Default
    private List<String> aiProviders = new ArrayList<>();

    @Builder.Default
    private int maxProjects = 1;

    private boolean fullCodebaseContext;
    private boolean gitIntegration;
    private int aiCodeReviewsPerMonth;
    private boolean teamFeatures;

    @Builder.Default
    private String supportLevel = "community";
}
