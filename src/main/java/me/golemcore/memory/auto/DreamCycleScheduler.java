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

package me.golemcore.memory.auto;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.ConsolidationAbortedException;
import me.golemcore.memory.domain.model.ConsolidationReport;
import me.golemcore.memory.domain.service.ConsolidationService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background trigger for the dream cycle.
 *
 * <p>
 * When {@code memory.schedule.enabled} is true a single daemon thread calls
 * {@link ConsolidationService#consolidate()} at a fixed interval. The core
 * decides whether a run may start; a tick that lands during an on-demand run
 * is rejected by the consolidator and simply skipped here.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DreamCycleScheduler {

    private final ConsolidationService consolidationService;
    private final MemoryProperties properties;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    @PostConstruct
    public void init() {
        MemoryProperties.ScheduleProperties schedule = properties.getSchedule();
        if (!schedule.isEnabled()) {
            log.info("[DreamCycle] Scheduled consolidation disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dream-cycle-scheduler");
            t.setDaemon(true);
            return t;
        });

        int intervalSeconds = Math.max(1, schedule.getIntervalSeconds());
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                Math.max(0, schedule.getInitialDelaySeconds()),
                intervalSeconds,
                TimeUnit.SECONDS);

        log.info("[DreamCycle] Started with interval: {}s", intervalSeconds);
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
        log.info("[DreamCycle] Shut down");
    }

    void tick() {
        try {
            ConsolidationReport report = consolidationService.consolidate();
            if (report.getOutcome() == ConsolidationReport.Outcome.REJECTED_CONCURRENT) {
                log.debug("[DreamCycle] Skipped tick, consolidation already running");
            }
        } catch (ConsolidationAbortedException e) {
            log.warn("[DreamCycle] Consolidation aborted: {}", e.getMessage());
        } catch (RuntimeException e) {
            // Keep the scheduled task alive; an escaping exception cancels it.
            log.error("[DreamCycle] Unexpected tick failure", e);
        }
    }
}
