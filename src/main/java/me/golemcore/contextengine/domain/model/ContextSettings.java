package me.golemcore.contextengine.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable snapshot of every tunable used during assembly and learning.
 * Passed explicitly into each call instead of being read from global state.
 */
@Value
@Builder(toBuilder = true)
public class ContextSettings {

    @Builder.Default
    int defaultRetrievalLimit = AgentRole.DEFAULT_RETRIEVAL_LIMIT;

    @Builder.Default
    Map<AgentRole, Integer> roleLimits = Map.of(AgentRole.QA_EXPERT, 5, AgentRole.TECH_LEAD, 5);

    @Builder.Default
    int bodyTokenLimit = 1200;

    @Builder.Default
    int maxStrategies = 2;

    @Builder.Default
    int conservativeSummaryChars = 160;

    @Builder.Default
    double safetyMargin = 0.15;

    @Builder.Default
    int defaultContextWindow = 200_000;

    @Builder.Default
    Map<String, Integer> contextWindows = Map.of();

    @Builder.Default
    RankingWeights rankingWeights = RankingWeights.DEFAULTS;

    @Builder.Default
    ZoneBoundaries zoneBoundaries = ZoneBoundaries.DEFAULTS;

    @Builder.Default
    RedactionMode redactionMode = RedactionMode.BOTH;

    @Builder.Default
    double entropyThreshold = 4.0;

    @Builder.Default
    int minEntropyLength = 20;

    @Builder.Default
    int patternTtlDays = 90;

    @Builder.Default
    double injectionThreshold = 0.7;

    @Builder.Default
    double observationThreshold = 0.3;

    @Builder.Default
    double initialConfidence = 0.5;

    @Builder.Default
    double successBoost = 0.1;

    @Builder.Default
    double falseLeadPenalty = 0.2;

    @Builder.Default
    double minConfidence = 0.1;

    @Builder.Default
    Duration pendingFailureWindow = Duration.ofHours(6);

    @Builder.Default
    Duration latencyTarget = Duration.ofMillis(500);

    public static ContextSettings defaults() {
        return ContextSettings.builder().build();
    }

    /**
     * Retrieval limit for a role: an explicit override wins, then the configured
     * default. Roles with a larger built-in default never go below it.
     */
    public int retrievalLimitFor(AgentRole role) {
        if (role != null && roleLimits != null) {
            Integer override = roleLimits.get(role);
            if (override != null && override > 0) {
                return override;
            }
        }
        int base = defaultRetrievalLimit > 0 ? defaultRetrievalLimit : AgentRole.DEFAULT_RETRIEVAL_LIMIT;
        if (role != null && role.getDefaultRetrievalLimit() > AgentRole.DEFAULT_RETRIEVAL_LIMIT) {
            return Math.max(base, role.getDefaultRetrievalLimit());
        }
        return base;
    }
}
