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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.contextengine.domain.model.ContextSettings;
import me.golemcore.contextengine.domain.model.ErrorPattern;
import me.golemcore.contextengine.domain.model.TaskAttemptEvent;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pairs FAILURE and SUCCESS events of the same task attempt. A success that
 * follows a pending failure becomes a captured error pattern.
 */
@Service
@Slf4j
public class TaskOutcomeCorrelator {

    private final ErrorPatternService errorPatternService;
    private final ContextSettingsService contextSettingsService;
    private final Clock clock;

    private final Map<String, PendingFailure> pendingFailures = new ConcurrentHashMap<>();

    public TaskOutcomeCorrelator(ErrorPatternService errorPatternService,
            ContextSettingsService contextSettingsService, Clock clock) {
        this.errorPatternService = errorPatternService;
        this.contextSettingsService = contextSettingsService;
        this.clock = clock;
    }

    /**
     * Handle one attempt event.
     *
     * @return the captured pattern when this event completed a fail-then-succeed
     *         pair
     */
    public Optional<ErrorPattern> onEvent(TaskAttemptEvent event) {
        if (event == null || event.getKind() == null || isBlank(event.getAttemptId())) {
            log.debug("[Outcomes] Ignoring incomplete event");
            return Optional.empty();
        }
        ContextSettings settings = contextSettingsService.current();
        evictStale(settings);
        try {
            return switch (event.getKind()) {
            case FAILURE -> {
                onFailure(event);
                yield Optional.empty();
            }
            case SUCCESS -> onSuccess(event, settings);
            };
        } catch (RuntimeException e) {
            log.warn("[Outcomes] Failed to handle {} for attempt {}: {}", event.getKind(), event.getAttemptId(),
                    e.getMessage());
            return Optional.empty();
        }
    }

    private void onFailure(TaskAttemptEvent event) {
        if (!isBlank(event.getAppliedPatternHash())) {
            errorPatternService.recordFalseLead(event.getAppliedPatternHash());
        }
        if (event.getSignature() == null) {
            log.debug("[Outcomes] Failure without signature for attempt {}", event.getAttemptId());
            return;
        }
        pendingFailures.put(event.getAttemptId(), new PendingFailure(event, timestampOf(event)));
    }

    private Optional<ErrorPattern> onSuccess(TaskAttemptEvent event, ContextSettings settings) {
        if (!isBlank(event.getAppliedPatternHash())) {
            errorPatternService.recordHelpful(event.getAppliedPatternHash());
        }
        PendingFailure pending = pendingFailures.remove(event.getAttemptId());
        if (pending == null) {
            log.debug("[Outcomes] Success without pending failure for attempt {}", event.getAttemptId());
            return Optional.empty();
        }
        TaskAttemptEvent failure = pending.event();
        String projectId = !isBlank(failure.getProjectId()) ? failure.getProjectId() : event.getProjectId();
        String language = !isBlank(event.getLanguage()) ? event.getLanguage() : failure.getLanguage();
        return errorPatternService.capture(projectId, failure.getSignature(), event.getSolution(), language,
                settings);
    }

    /**
     * Drop pending failures older than the configured window.
     *
     * @return number of evicted entries
     */
    public int evictStale() {
        return evictStale(contextSettingsService.current());
    }

    private int evictStale(ContextSettings settings) {
        Instant cutoff = clock.instant().minus(settings.getPendingFailureWindow());
        int before = pendingFailures.size();
        pendingFailures.values().removeIf(pending -> pending.receivedAt().isBefore(cutoff));
        int evicted = before - pendingFailures.size();
        if (evicted > 0) {
            log.debug("[Outcomes] Evicted {} stale pending failure(s)", evicted);
        }
        return Math.max(0, evicted);
    }

    int pendingCount() {
        return pendingFailures.size();
    }

    private Instant timestampOf(TaskAttemptEvent event) {
        return event.getTimestamp() != null ? event.getTimestamp() : clock.instant();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record PendingFailure(TaskAttemptEvent event, Instant receivedAt) {
    }
}
