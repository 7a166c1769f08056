package me.golemcore.contextengine.domain.service;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.contextengine.infrastructure.config.ContextEngineProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the error-pattern TTL sweep and pending-failure eviction on a single
 * daemon thread.
 */
@Component
@Slf4j
public class ErrorPatternSweeper {

    private static final long EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 5;

    private final ErrorPatternService errorPatternService;
    private final TaskOutcomeCorrelator taskOutcomeCorrelator;
    private final ContextEngineProperties properties;

    private final ScheduledExecutorService sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "pattern-sweep");
        t.setDaemon(true);
        return t;
    });

    public ErrorPatternSweeper(ErrorPatternService errorPatternService, TaskOutcomeCorrelator taskOutcomeCorrelator,
            ContextEngineProperties properties) {
        this.errorPatternService = errorPatternService;
        this.taskOutcomeCorrelator = taskOutcomeCorrelator;
        this.properties = properties;
    }

    @PostConstruct
    void init() {
        Duration interval = properties.getPatterns().getSweepInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            log.info("[Patterns] Scheduled sweep disabled");
            return;
        }
        long millis = interval.toMillis();
        sweepExecutor.scheduleAtFixedRate(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
        log.info("[Patterns] Sweep scheduled every {}", interval);
    }

    @PreDestroy
    void destroy() {
        sweepExecutor.shutdownNow();
        try {
            sweepExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void runOnce() {
        try {
            int removed = errorPatternService.sweepExpired();
            int evicted = taskOutcomeCorrelator.evictStale();
            log.debug("[Patterns] Scheduled sweep removed {} pattern(s), evicted {} pending failure(s)",
                    removed, evicted);
        } catch (RuntimeException e) {
            // keep the schedule alive
            log.warn("[Patterns] Scheduled sweep failed: {}", e.getMessage());
        }
    }
}
