package me.golemcore.contextengine.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the context engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code context.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - workspace location</li>
 * <li>{@link StoreProperties} - lock wait and retry backoff</li>
 * <li>{@link RetrievalProperties} - per-role limits and body budgets</li>
 * <li>{@link TokenProperties} - estimation margin and model windows</li>
 * <li>{@link RankingProperties} - score weights</li>
 * <li>{@link ZoneProperties} - budget zone boundaries</li>
 * <li>{@link RedactionProperties} - secret scrubbing</li>
 * <li>{@link PatternProperties} - error pattern learning</li>
 * </ul>
 *
 * <p>
 * These values are mutable binding targets only. Services work with the
 * immutable snapshot produced by
 * {@link me.golemcore.contextengine.domain.service.ContextSettingsService}.
 */
@Component
@ConfigurationProperties(prefix = "context")
@Data
public class ContextEngineProperties {

    private StorageProperties storage = new StorageProperties();
    private StoreProperties store = new StoreProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private TokenProperties tokens = new TokenProperties();
    private RankingProperties ranking = new RankingProperties();
    private ZoneProperties zones = new ZoneProperties();
    private RedactionProperties redaction = new RedactionProperties();
    private PatternProperties patterns = new PatternProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String directory = "store";
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/context";
    }

    // ==================== STORE ====================

    @Data
    public static class StoreProperties {
        /** Total attempts for a contended operation, first try included. */
        private int maxAttempts = 4;

        /** Backoff before the second attempt; doubles after each retry. */
        private Duration initialBackoff = Duration.ofMillis(100);

        /** How long an operation waits for a table lock before it counts as contention. */
        private Duration lockTimeout = Duration.ofMillis(250);
    }

    // ==================== RETRIEVAL ====================

    @Data
    public static class RetrievalProperties {
        private int defaultLimit = 3;
        private Map<String, Integer> roleLimits = new HashMap<>(Map.of("qa_expert", 5, "tech_lead", 5));
        private int bodyTokenLimit = 1200;
        private int maxStrategies = 2;
        private int conservativeSummaryChars = 160;
        private Duration latencyTarget = Duration.ofMillis(500);

        /**
         * Directory that relative package content pointers resolve against.
         */
        private String contentRoot = ".";
        private long maxContentBytes = 256 * 1024;
    }

    // ==================== TOKENS ====================

    @Data
    public static class TokenProperties {
        private double safetyMargin = 0.15;
        private int defaultContextWindow = 200_000;
        private Map<String, Integer> contextWindows = new HashMap<>();
    }

    // ==================== RANKING ====================

    @Data
    public static class RankingProperties {
        private double priorityWeight = 1.0;
        private double groupWeight = 0.5;
        private double affinityWeight = 0.3;
        private double recencyWeight = 0.2;
    }

    // ==================== ZONES ====================

    @Data
    public static class ZoneProperties {
        private double softWarning = 0.60;
        private double conservative = 0.75;
        private double wrapup = 0.85;
        private double emergency = 0.95;
    }

    // ==================== REDACTION ====================

    @Data
    public static class RedactionProperties {
        /** One of pattern_only, entropy, both. */
        private String mode = "both";
        private double entropyThreshold = 4.0;
        private int minEntropyLength = 20;
    }

    // ==================== ERROR PATTERNS ====================

    @Data
    public static class PatternProperties {
        private int ttlDays = 90;
        private double injectionThreshold = 0.7;
        private double observationThreshold = 0.3;
        private double initialConfidence = 0.5;
        private double successBoost = 0.1;
        private double falseLeadPenalty = 0.2;
        private double minConfidence = 0.1;
        private Duration sweepInterval = Duration.ofHours(24);
        private Duration pendingFailureWindow = Duration.ofHours(6);
    }
}
