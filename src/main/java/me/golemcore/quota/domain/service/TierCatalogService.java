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

import me.golemcore.quota.domain.model.InvalidAllowanceException;
import me.golemcore.quota.domain.model.StorageUnavailableException;
import me.golemcore.quota.domain.model.Tier;
import me.golemcore.quota.domain.model.TierFeatures;
import me.golemcore.quota.domain.model.TierInUseException;
import me.golemcore.quota.domain.model.TierName;
import me.golemcore.quota.domain.model.UnknownTierException;
import me.golemcore.quota.infrastructure.config.QuotaProperties;
import me.golemcore.quota.port.outbound.StoragePort;
import me.golemcore.quota.port.outbound.UsageLedgerPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Tier catalog: maps tier names to allowances and feature flags. The catalog is
 * persisted in {@code catalog/tiers.json} via {@link StoragePort} and seeded
 * from {@code quota.tiers} the first time the service starts.
 *
 * <p>
 * Reads are served from an in-memory map and never touch storage. Writes are
 * serialized, persisted first and only then published to readers. Changing an
 * allowance never rewrites ledger rows: usage already above a lowered limit
 * stays as recorded and only later admission checks see the new limit.
 */
@Service
@Slf4j
public class TierCatalogService {

    private static final String CATALOG_DIR = "catalog";
    private static final String TIERS_FILE = "tiers.json";
    private static final TypeReference<List<Tier>> TIER_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final UsageLedgerPort usageLedgerPort;
    private final ObjectMapper objectMapper;
    private final QuotaProperties properties;
    private final Clock clock;

    private final Map<String, Tier> tiers = new ConcurrentHashMap<>();
    // delete holds the write lock; writers of tier references hold the read lock
    private final ReadWriteLock referenceLock = new ReentrantReadWriteLock();

    public TierCatalogService(StoragePort storagePort, UsageLedgerPort usageLedgerPort,
            ObjectMapper objectMapper, QuotaProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.usageLedgerPort = usageLedgerPort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        List<Tier> persisted = loadCatalog();
        if (persisted.isEmpty()) {
            Map<String, Tier> seeded = new LinkedHashMap<>();
            for (Tier tier : properties.getTiers()) {
                Tier normalized = normalize(tier);
                seeded.put(normalized.getName(), normalized);
            }
            saveCatalog(seeded.values());
            tiers.putAll(seeded);
            log.info("[Catalog] Seeded {} tiers from configuration", seeded.size());
        } else {
            for (Tier tier : persisted) {
                Tier normalized = normalize(tier);
                tiers.put(normalized.getName(), normalized);
            }
            log.info("[Catalog] Loaded {} tiers from storage", tiers.size());
        }

        String defaultTier = properties.getDefaultTier();
        if (!tiers.containsKey(defaultTier)) {
            throw new IllegalStateException("Default tier '" + defaultTier + "' is not in the tier catalog");
        }
    }

    /**
     * Look up a tier by its exact name.
     */
    public Optional<Tier> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Tier tier = tiers.get(name);
        return tier != null ? Optional.of(tier.copy()) : Optional.empty();
    }

    /**
     * @throws UnknownTierException
     *             if the tier is not in the catalog
     */
    public Tier require(String name) {
        return find(name).orElseThrow(() -> new UnknownTierException(name));
    }

    public boolean contains(String name) {
        return name != null && tiers.containsKey(name);
    }

    public List<Tier> list() {
        return tiers.values().stream()
                .sorted(Comparator.comparing(t -> TierName.fromId(t.getName()).orElseThrow()))
                .map(Tier::copy)
                .toList();
    }

    /**
     * Tier assigned to new accounts and to rows repaired by the audit.
     */
    public String getDefaultTierName() {
        return properties.getDefaultTier();
    }

    /**
     * Add a tier or replace its definition.
     *
     * @throws IllegalArgumentException
     *             if the name is not one of {@link TierName}
     * @throws InvalidAllowanceException
     *             if a metered tier has a negative allowance other than
     *             {@link Tier#UNLIMITED_ALLOWANCE}
     */
    public synchronized Tier upsert(Tier tier) {
        if (tier == null) {
            throw new IllegalArgumentException("Tier definition is required");
        }
        Tier normalized = normalize(tier.toBuilder().updatedAt(clock.instant()).build());

        Map<String, Tier> updated = new LinkedHashMap<>(tiers);
        Tier previous = updated.put(normalized.getName(), normalized);
        saveCatalog(updated.values());
        tiers.put(normalized.getName(), normalized);

        if (previous == null) {
            log.info("[Catalog] Added tier {}: {}", normalized.getName(), describe(normalized));
        } else {
            log.info("[Catalog] Updated tier {}: {} -> {}", normalized.getName(), describe(previous),
                    describe(normalized));
        }
        return normalized.copy();
    }

    /**
     * Remove a tier from the catalog.
     *
     * @throws TierInUseException
     *             if the tier is the default tier or any ledger row references it
     * @throws UnknownTierException
     *             if the tier is not in the catalog
     */
    public synchronized void delete(String name) {
        Lock writeLock = referenceLock.writeLock();
        writeLock.lock();
        try {
            deleteUnreferenced(name);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Run {@code action}, which stores a reference to {@code tierName} in the
     * ledger, while the tier is guaranteed to stay in the catalog. Concurrent
     * {@link #delete(String)} calls wait until the action completes.
     *
     * @throws UnknownTierException
     *             if the tier is not in the catalog
     */
    public <T> T withTierReference(String tierName, Supplier<T> action) {
        Lock readLock = referenceLock.readLock();
        readLock.lock();
        try {
            if (!contains(tierName)) {
                throw new UnknownTierException(tierName);
            }
            return action.get();
        } finally {
            readLock.unlock();
        }
    }

    private void deleteUnreferenced(String name) {
        if (!contains(name)) {
            throw new UnknownTierException(name);
        }
        if (name.equals(getDefaultTierName())) {
            throw new TierInUseException("Tier '" + name + "' is the default tier");
        }
        long references = usageLedgerPort.listAllUsageRows().stream()
                .filter(row -> name.equals(row.getTierName()))
                .count();
        if (references > 0) {
            throw new TierInUseException("Tier '" + name + "' is referenced by " + references + " accounts");
        }

        Map<String, Tier> updated = new LinkedHashMap<>(tiers);
        updated.remove(name);
        saveCatalog(updated.values());
        tiers.remove(name);
        log.info("[Catalog] Removed tier {}", name);
    }

    private Tier normalize(Tier tier) {
        if (tier == null) {
            throw new IllegalArgumentException("Tier definition is required");
        }
        String name = TierName.fromId(tier.getName())
                .map(TierName::getId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Tier name must be one of " + Arrays.toString(tierIds()) + ": " + tier.getName()));

        boolean metered = tier.isMetered();
        long allowance = tier.getMonthlyAllowance();
        if (allowance == Tier.UNLIMITED_ALLOWANCE) {
            metered = false;
            allowance = 0;
        } else if (allowance < 0) {
            throw new InvalidAllowanceException(name, allowance);
        }
        if (!metered) {
            allowance = 0;
        }

        TierFeatures features = tier.getFeatures() != null
                ? tier.getFeatures().toBuilder().build()
                : new TierFeatures();
        if (features.getAiProviders() == null) {
            features.setAiProviders(new ArrayList<>());
        }

        return Tier.builder()
                .name(name)
                .metered(metered)
                .monthlyAllowance(allowance)
                .features(features)
                .updatedAt(tier.getUpdatedAt() != null ? tier.getUpdatedAt() : clock.instant())
                .build();
    }

    private static String[] tierIds() {
        return Arrays.stream(TierName.values()).map(TierName::getId).toArray(String[]::new);
    }

    private static String describe(Tier tier) {
        return tier.isMetered() ? tier.getMonthlyAllowance() + "/period" : "unlimited";
    }

    private void saveCatalog(Iterable<Tier> catalog) {
        List<Tier> snapshot = new ArrayList<>();
        catalog.forEach(snapshot::add);
        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tier catalog", e);
        }
        try {
            storagePort.putTextAtomic(CATALOG_DIR, TIERS_FILE, json, true).join();
        } catch (CompletionException e) {
            log.error("[Catalog] Failed to save tier catalog", e);
            throw new StorageUnavailableException("Failed to save tier catalog", e.getCause());
        }
    }

    private List<Tier> loadCatalog() {
        String json;
        try {
            json = storagePort.getText(CATALOG_DIR, TIERS_FILE).join();
        } catch (CompletionException e) {
            throw new StorageUnavailableException("Failed to read tier catalog", e.getCause());
        }
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, TIER_LIST_TYPE_REF));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tier catalog is corrupt: " + CATALOG_DIR + "/" + TIERS_FILE, e);
        }
    }
}
