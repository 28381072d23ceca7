package me.golemcore.quota.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.quota.adapter.outbound.ledger.StorageUsageLedgerAdapter;
import me.golemcore.quota.domain.service.BillingPeriodCalculator;
import me.golemcore.quota.domain.service.ConsistencyAuditService;
import me.golemcore.quota.domain.service.IntegrityFaultLog;
import me.golemcore.quota.domain.service.PeriodResetService;
import me.golemcore.quota.domain.service.QuotaGuardService;
import me.golemcore.quota.domain.service.TierCatalogService;
import me.golemcore.quota.domain.service.UsageLedgerService;
import me.golemcore.quota.infrastructure.config.AutoConfiguration;
import me.golemcore.quota.infrastructure.config.QuotaProperties;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Wires the quota services the way the application context does, over an
 * in-memory storage and a mutable clock.
 */
public final class QuotaHarness {

    public final QuotaProperties properties;
    public final MutableClock clock;
    public final InMemoryStoragePort storage;
    public final ObjectMapper objectMapper;
    public final StorageUsageLedgerAdapter ledger;
    public final TierCatalogService catalog;
    public final BillingPeriodCalculator periods;
    public final UsageLedgerService ledgerService;
    public final IntegrityFaultLog faultLog;
    public final QuotaGuardService guard;
    public final PeriodResetService resetService;
    public final ConsistencyAuditService auditService;

    private QuotaHarness(QuotaProperties properties, Instant now, InMemoryStoragePort storage) {
        this.properties = properties;
        this.clock = new MutableClock(now, ZoneOffset.UTC);
        this.storage = storage;
        this.objectMapper = AutoConfiguration.objectMapper();
        this.ledger = new StorageUsageLedgerAdapter(storage, objectMapper);
        ledger.init();
        this.catalog = new TierCatalogService(storage, ledger, objectMapper, properties, clock);
        catalog.init();
        this.periods = new BillingPeriodCalculator(properties);
        this.ledgerService = new UsageLedgerService(ledger, catalog, periods, clock);
        this.faultLog = new IntegrityFaultLog();
        this.guard = new QuotaGuardService(ledger, ledgerService, catalog, periods, faultLog, properties, clock);
        this.resetService = new PeriodResetService(ledger, periods, clock);
        this.auditService = new ConsistencyAuditService(ledger, catalog, periods, faultLog, clock);
    }

    public static QuotaHarness start(Instant now) {
        return new QuotaHarness(new QuotaProperties(), now, new InMemoryStoragePort());
    }

    public static QuotaHarness start(QuotaProperties properties, Instant now) {
        return new QuotaHarness(properties, now, new InMemoryStoragePort());
    }

    /**
     * Simulates a restart over the same storage.
     */
    public QuotaHarness restart() {
        return new QuotaHarness(properties, clock.instant(), storage);
    }
}
