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
import me.golemcore.contextengine.domain.model.AgentRole;
import me.golemcore.contextengine.domain.model.ContextSettings;
import me.golemcore.contextengine.domain.model.RankingWeights;
import me.golemcore.contextengine.domain.model.RedactionMode;
import me.golemcore.contextengine.domain.model.ZoneBoundaries;
import me.golemcore.contextengine.infrastructure.config.ContextEngineProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Converts bound {@link ContextEngineProperties} into an immutable
 * {@link ContextSettings} snapshot. Invalid values fall back to documented
 * defaults with a warning.
 */
@Service
@Slf4j
public class ContextSettingsService {

    private final ContextEngineProperties properties;
    private volatile ContextSettings snapshot;

    public ContextSettingsService(ContextEngineProperties properties) {
        this.properties = properties;
    }

    /**
     * Current snapshot, built on first use.
     */
    public ContextSettings current() {
        ContextSettings current = snapshot;
        if (current == null) {
            current = reload();
        }
        return current;
    }

    /**
     * Rebuild the snapshot from the bound properties.
     */
    public synchronized ContextSettings reload() {
        ContextSettings defaults = ContextSettings.defaults();
        ContextEngineProperties.RetrievalProperties retrieval = properties.getRetrieval();
        ContextEngineProperties.TokenProperties tokens = properties.getTokens();
        ContextEngineProperties.RankingProperties ranking = properties.getRanking();
        ContextEngineProperties.RedactionProperties redaction = properties.getRedaction();
        ContextEngineProperties.PatternProperties patterns = properties.getPatterns();

        ContextSettings built = ContextSettings.builder()
                .defaultRetrievalLimit(positiveOr(retrieval.getDefaultLimit(), defaults.getDefaultRetrievalLimit()))
                .roleLimits(resolveRoleLimits(retrieval.getRoleLimits()))
                .bodyTokenLimit(positiveOr(retrieval.getBodyTokenLimit(), defaults.getBodyTokenLimit()))
                .maxStrategies(Math.max(0, retrieval.getMaxStrategies()))
                .conservativeSummaryChars(positiveOr(retrieval.getConservativeSummaryChars(),
                        defaults.getConservativeSummaryChars()))
                .latencyTarget(durationOr(retrieval.getLatencyTarget(), defaults.getLatencyTarget()))
                .safetyMargin(fractionOr(tokens.getSafetyMargin(), defaults.getSafetyMargin()))
                .defaultContextWindow(positiveOr(tokens.getDefaultContextWindow(), defaults.getDefaultContextWindow()))
                .contextWindows(resolveContextWindows(tokens.getContextWindows()))
                .rankingWeights(new RankingWeights(
                        nonNegativeOr(ranking.getPriorityWeight(), RankingWeights.DEFAULTS.priority()),
                        nonNegativeOr(ranking.getGroupWeight(), RankingWeights.DEFAULTS.sameGroup()),
                        nonNegativeOr(ranking.getAffinityWeight(), RankingWeights.DEFAULTS.roleAffinity()),
                        nonNegativeOr(ranking.getRecencyWeight(), RankingWeights.DEFAULTS.recency())))
                .zoneBoundaries(resolveZones(properties.getZones()))
                .redactionMode(RedactionMode.fromConfig(redaction.getMode()))
                .entropyThreshold(positiveOr(redaction.getEntropyThreshold(), defaults.getEntropyThreshold()))
                .minEntropyLength(positiveOr(redaction.getMinEntropyLength(), defaults.getMinEntropyLength()))
                .patternTtlDays(positiveOr(patterns.getTtlDays(), defaults.getPatternTtlDays()))
                .injectionThreshold(fractionOr(patterns.getInjectionThreshold(), defaults.getInjectionThreshold()))
                .observationThreshold(
                        fractionOr(patterns.getObservationThreshold(), defaults.getObservationThreshold()))
                .initialConfidence(fractionOr(patterns.getInitialConfidence(), defaults.getInitialConfidence()))
                .successBoost(fractionOr(patterns.getSuccessBoost(), defaults.getSuccessBoost()))
                .falseLeadPenalty(fractionOr(patterns.getFalseLeadPenalty(), defaults.getFalseLeadPenalty()))
                .minConfidence(fractionOr(patterns.getMinConfidence(), defaults.getMinConfidence()))
                .pendingFailureWindow(durationOr(patterns.getPendingFailureWindow(),
                        defaults.getPendingFailureWindow()))
                .build();
        snapshot = built;
        return built;
    }

    private Map<AgentRole, Integer> resolveRoleLimits(Map<String, Integer> configured) {
        Map<AgentRole, Integer> limits = new EnumMap<>(AgentRole.class);
        if (configured == null) {
            return Map.copyOf(limits);
        }
        for (Map.Entry<String, Integer> entry : configured.entrySet()) {
            Optional<AgentRole> role = AgentRole.fromValue(entry.getKey());
            if (role.isEmpty()) {
                log.warn("[Settings] Ignoring retrieval limit for unknown role '{}'", entry.getKey());
                continue;
            }
            Integer value = entry.getValue();
            if (value == null || value <= 0) {
                log.warn("[Settings] Ignoring non-positive retrieval limit {} for role {}", value, role.get());
                continue;
            }
            limits.put(role.get(), value);
        }
        return Map.copyOf(limits);
    }

    private Map<String, Integer> resolveContextWindows(Map<String, Integer> configured) {
        Map<String, Integer> windows = new LinkedHashMap<>();
        if (configured == null) {
            return Map.of();
        }
        configured.forEach((model, window) -> {
            if (model != null && !model.isBlank() && window != null && window > 0) {
                windows.put(model.trim().toLowerCase(Locale.ROOT), window);
            }
        });
        return Map.copyOf(windows);
    }

    private ZoneBoundaries resolveZones(ContextEngineProperties.ZoneProperties zones) {
        ZoneBoundaries candidate = new ZoneBoundaries(zones.getSoftWarning(), zones.getConservative(),
                zones.getWrapup(), zones.getEmergency());
        if (!candidate.isValid()) {
            log.warn("[Settings] Invalid zone boundaries {}, using defaults {}", candidate, ZoneBoundaries.DEFAULTS);
            return ZoneBoundaries.DEFAULTS;
        }
        return candidate;
    }

    private int positiveOr(int value, int fallback) {
        return value > 0 ? value : fallback;
    }

    private double positiveOr(double value, double fallback) {
        return value > 0.0 && Double.isFinite(value) ? value : fallback;
    }

    private double nonNegativeOr(double value, double fallback) {
        return value >= 0.0 && Double.isFinite(value) ? value : fallback;
    }

    private double fractionOr(double value, double fallback) {
        if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
            return fallback;
        }
        return value;
    }

    private Duration durationOr(Duration value, Duration fallback) {
        if (value == null || value.isNegative() || value.isZero()) {
            return fallback;
        }
        return value;
    }
}
