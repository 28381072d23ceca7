package me.golemcore.quota.auto;


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

import me.golemcore.quota.domain.model.SweepReport;
import me.golemcore.quota.domain.service.PeriodResetService;
import me.golemcore.quota.infrastructure.config.QuotaProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background driver for {@link PeriodResetService#sweep()}.
 *
 * <p>
 * Runs on a single daemon thread at {@code quota.reset.interval} after an
 * initial delay of {@code quota.reset.initial-delay}. Ticks do not overlap: if
 * a sweep is still running when the next tick fires, that tick is skipped.
 * Admission checks never wait for the sweep since they roll periods over
 * themselves.
 *
 * @since 1.0
 * @see PeriodResetService
 */
@Component
@Slf4j
public class PeriodResetScheduler {

    private final PeriodResetService periodResetService;
    private final QuotaProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public PeriodResetScheduler(PeriodResetService periodResetService, QuotaProperties properties) {
        this.periodResetService = periodResetService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        QuotaProperties.ResetProperties reset = properties.getReset();
        if (!reset.isEnabled()) {
            log.info("[ResetScheduler] Period reset sweep disabled");
            return;
        }

        Duration interval = reset.getInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalStateException("quota.reset.interval must be positive, got " + interval);
        }
        Duration initialDelay = reset.getInitialDelay() != null && !reset.getInitialDelay().isNegative()
                ? reset.getInitialDelay()
                : Duration.ZERO;

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "quota-reset-scheduler");
            t.setDaemon(true);
            return t;
        });

        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                initialDelay.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS);

        log.info("[ResetScheduler] Started with interval {} (initial delay {})", interval, initialDelay);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[ResetScheduler] Shut down");
    }

    /**
     * Run one sweep unless another is in progress.
     *
     * @return the sweep report, or null if the tick was skipped
     */
    SweepReport tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[ResetScheduler] Previous sweep still running, skipping tick");
            return null;
        }
        try {
            return periodResetService.sweep();
        } catch (RuntimeException e) { // NOSONAR - keep the scheduled task alive
            log.error("[ResetScheduler] Sweep failed", e);
            return null;
        } finally {
            executing.set(false);
        }
    }

    boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }
}
