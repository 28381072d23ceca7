package me.golemcore.quota.adapter.outbound.ledger;


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

import me.golemcore.quota.domain.model.LedgerUpdate;
import me.golemcore.quota.domain.model.StorageUnavailableException;
import me.golemcore.quota.domain.model.UsageRecord;
import me.golemcore.quota.port.outbound.StoragePort;
import me.golemcore.quota.port.outbound.UsageLedgerPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Usage ledger backed by {@link StoragePort}, one JSON file per user under
 * {@code ledger/}.
 *
 * <p>
 * All rows are indexed in memory at startup. Each mutation holds a lock owned
 * by the user's key, so concurrent mutations of the same row are serialized
 * while other users proceed in parallel. The new row is written to storage
 * before it replaces the in-memory value; if the write fails the row keeps its
 * previous value and the caller gets a {@link StorageUnavailableException}.
 * No storage I/O happens inside a map operation.
 *
 * <p>
 * Period rollover is applied by the same code path for the lazy reset on
 * increment and for the scheduled sweep, so whichever runs first wins and the
 * other sees a row that is no longer due.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageUsageLedgerAdapter implements UsageLedgerPort {

    private static final String LEDGER_DIR = "ledger";
    private static final String JSON_EXTENSION = ".json";
    private static final String LOG_PREFIX = "[Ledger]";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final Map<String, UsageRecord> rows = new ConcurrentHashMap<>();
    private final Map<String, Lock> rowLocks = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        List<String> files;
        try {
            files = storagePort.listObjects(LEDGER_DIR, "").join();
        } catch (CompletionException e) {
            throw new StorageUnavailableException("Failed to list usage ledger", e.getCause());
        }

        int loaded = 0;
        for (String file : files) {
            if (!file.endsWith(JSON_EXTENSION)) {
                continue;
            }
            UsageRecord record = readRow(file);
            if (record == null) {
                continue;
            }
            if (record.getUserId() == null) {
                record.setUserId(file.substring(0, file.length() - JSON_EXTENSION.length()));
            }
            rows.put(record.getUserId(), record);
            loaded++;
        }
        log.info("{} Loaded {} usage rows from storage", LOG_PREFIX, loaded);
    }

    @Override
    public Optional<UsageRecord> loadUsage(String userId) {
        UsageRecord record = rows.get(userId);
        return record != null ? Optional.of(record.copy()) : Optional.empty();
    }

    @Override
    public UsageRecord createUsage(String userId, String tierName, Instant now, Instant periodResetAt) {
        Lock lock = lockFor(userId);
        lock.lock();
        try {
            UsageRecord current = rows.get(userId);
            if (current != null) {
                return current.copy();
            }
            UsageRecord created = UsageRecord.builder()
                    .userId(userId)
                    .tierName(tierName)
                    .messagesUsed(0)
                    .periodResetAt(periodResetAt)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            persist(created);
            rows.put(userId, created);
            log.debug("{} Created row for user {} on tier {}", LOG_PREFIX, userId, tierName);
            return created.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public LedgerUpdate conditionalIncrement(String userId, long limit, Instant now,
            Function<UsageRecord, Instant> nextPeriodEnd) {
        AtomicBoolean incremented = new AtomicBoolean(false);
        LedgerUpdate update = mutate(userId, row -> {
            if (row.getPeriodResetAt() == null) {
                row.setPeriodResetAt(nextPeriodEnd.apply(row));
                row.setUpdatedAt(now);
            }
            rollOverIfDue(row, now, nextPeriodEnd);
            if (row.getMessagesUsed() < limit) {
                row.setMessagesUsed(row.getMessagesUsed() + 1);
                row.setUpdatedAt(now);
                incremented.set(true);
            }
            return row;
        });
        return new LedgerUpdate(incremented.get(), update.record());
    }

    @Override
    public LedgerUpdate resetIfDue(String userId, Instant now, Function<UsageRecord, Instant> nextPeriodEnd) {
        return mutate(userId, row -> rollOverIfDue(row, now, nextPeriodEnd));
    }

    @Override
    public LedgerUpdate update(String userId, UnaryOperator<UsageRecord> mutation) {
        return mutate(userId, mutation);
    }

    @Override
    public List<UsageRecord> listAllUsageRows() {
        return rows.values().stream()
                .map(UsageRecord::copy)
                .sorted(Comparator.comparing(UsageRecord::getUserId))
                .toList();
    }

    private static UsageRecord rollOverIfDue(UsageRecord row, Instant now,
            Function<UsageRecord, Instant> nextPeriodEnd) {
        if (row.isDue(now)) {
            row.setPeriodResetAt(nextPeriodEnd.apply(row));
            row.setMessagesUsed(0);
            row.setUpdatedAt(now);
        }
        return row;
    }

    private LedgerUpdate mutate(String userId, UnaryOperator<UsageRecord> mutation) {
        Lock lock = lockFor(userId);
        lock.lock();
        try {
            UsageRecord current = rows.get(userId);
            if (current == null) {
                return LedgerUpdate.unchanged(null);
            }
            UsageRecord candidate = mutation.apply(current.copy());
            if (candidate == null || candidate.equals(current)) {
                return LedgerUpdate.unchanged(current.copy());
            }
            persist(candidate);
            rows.put(userId, candidate);
            return LedgerUpdate.applied(candidate.copy());
        } finally {
            lock.unlock();
        }
    }

    private Lock lockFor(String userId) {
        return rowLocks.computeIfAbsent(userId, key -> new ReentrantLock());
    }

    private void persist(UsageRecord record) {
        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize usage row for " + record.getUserId(), e);
        }
        try {
            storagePort.putTextAtomic(LEDGER_DIR, record.getUserId() + JSON_EXTENSION, json, false).join();
        } catch (CompletionException e) {
            log.error("{} Failed to persist row for user {}", LOG_PREFIX, record.getUserId(), e.getCause());
            throw new StorageUnavailableException("Failed to persist usage row for " + record.getUserId(),
                    e.getCause());
        }
    }

    private UsageRecord readRow(String file) {
        String content;
        try {
            content = storagePort.getText(LEDGER_DIR, file).join();
        } catch (CompletionException e) {
            throw new StorageUnavailableException("Failed to read usage row " + file, e.getCause());
        }
        if (content == null || content.isBlank()) {
            log.warn("{} Skipping empty ledger file {}", LOG_PREFIX, file);
            return null;
        }
        try {
            return objectMapper.readValue(content, UsageRecord.class);
        } catch (JsonProcessingException e) {
            log.error("{} Skipping malformed ledger file {}: {}", LOG_PREFIX, file, e.getMessage());
            return null;
        }
    }
}
