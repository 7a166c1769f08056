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
import me.golemcore.contextengine.domain.model.Strategy;
import me.golemcore.contextengine.port.outbound.ContextStorePort;
import me.golemcore.contextengine.security.RedactionException;
import me.golemcore.contextengine.security.SecretRedactor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Reusable approaches learned from completed tasks, one per project and
 * topic.
 */
@Service
@Slf4j
public class StrategyService {

    private final ContextStorePort storePort;
    private final SecretRedactor secretRedactor;
    private final ContextSettingsService contextSettingsService;
    private final Clock clock;

    public StrategyService(ContextStorePort storePort, SecretRedactor secretRedactor,
            ContextSettingsService contextSettingsService, Clock clock) {
        this.storePort = storePort;
        this.secretRedactor = secretRedactor;
        this.contextSettingsService = contextSettingsService;
        this.clock = clock;
    }

    /**
     * Insert a strategy, or refresh the insight of the existing one with the
     * same topic in the project.
     */
    public Optional<Strategy> recordStrategy(String projectId, String topic, String insight, String language,
            String framework) {
        if (isBlank(projectId) || isBlank(topic) || isBlank(insight)) {
            log.debug("[Strategies] Record skipped: project, topic and insight are required");
            return Optional.empty();
        }
        ContextSettings settings = contextSettingsService.current();
        try {
            String redactedInsight = secretRedactor.redact(insight.trim(), settings);
            Instant now = clock.instant();
            String normalizedTopic = secretRedactor.redact(topic.trim(), settings);

            Strategy strategy = storePort.findStrategies(projectId).stream()
                    .filter(existing -> sameTopic(existing.getTopic(), normalizedTopic))
                    .findFirst()
                    .orElseGet(() -> Strategy.builder()
                            .id(UUID.randomUUID().toString())
                            .projectId(projectId)
                            .topic(normalizedTopic)
                            .helpfulness(0)
                            .createdAt(now)
                            .build());
            strategy.setInsight(redactedInsight);
            if (!isBlank(language)) {
                strategy.setLanguage(language.trim());
            }
            if (!isBlank(framework)) {
                strategy.setFramework(framework.trim());
            }
            strategy.setUpdatedAt(now);
            storePort.saveStrategy(strategy);
            log.info("[Strategies] Recorded strategy '{}' for project {}", normalizedTopic, projectId);
            return Optional.of(strategy);
        } catch (RedactionException e) {
            log.warn("[Strategies] Redaction failed, strategy dropped: {}", e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("[Strategies] Failed to record strategy '{}': {}", topic, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<Strategy> markHelpful(String strategyId) {
        try {
            Optional<Strategy> found = storePort.findStrategy(strategyId);
            found.ifPresent(strategy -> {
                strategy.setHelpfulness(Math.max(0, strategy.getHelpfulness()) + 1);
                strategy.setUpdatedAt(clock.instant());
                storePort.saveStrategy(strategy);
            });
            return found;
        } catch (RuntimeException e) {
            log.warn("[Strategies] Failed to mark {} helpful: {}", strategyId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Most helpful strategies of a project. Strategies tagged with the requested
     * language come first, then helpfulness, then the most recent update.
     */
    public List<Strategy> topStrategies(String projectId, String language, int limit) {
        if (isBlank(projectId) || limit <= 0) {
            return List.of();
        }
        Comparator<Strategy> order = Comparator
                .comparing((Strategy strategy) -> !matchesLanguage(strategy, language))
                .thenComparing(Comparator.comparingInt(Strategy::getHelpfulness).reversed())
                .thenComparing(Strategy::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder()));
        return storePort.findStrategies(projectId).stream()
                .sorted(order)
                .limit(limit)
                .toList();
    }

    private boolean matchesLanguage(Strategy strategy, String language) {
        return !isBlank(language) && strategy.getLanguage() != null
                && strategy.getLanguage().equalsIgnoreCase(language.trim());
    }

    private boolean sameTopic(String left, String right) {
        return left != null && left.trim().toLowerCase(Locale.ROOT).equals(right.toLowerCase(Locale.ROOT));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
