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

import me.golemcore.contextengine.domain.model.ContextSettings;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * Model-aware approximation of token counts. Counts characters and divides by
 * a per-family chars-per-token ratio, then inflates by a safety margin so that
 * estimates err on the high side.
 */
@Service
public class TokenEstimator {

    private static final double DEFAULT_CHARS_PER_TOKEN = 4.0;

    enum ModelFamily {
        CLAUDE(3.5, 200_000),
        OPENAI(4.0, 128_000),
        GEMINI(4.0, 1_000_000),
        OTHER(DEFAULT_CHARS_PER_TOKEN, 0);

        private final double charsPerToken;
        private final int contextWindow;

        ModelFamily(double charsPerToken, int contextWindow) {
            this.charsPerToken = charsPerToken;
            this.contextWindow = contextWindow;
        }
    }

    public int estimate(String text, String modelId) {
        return estimate(text, modelId, ContextSettings.defaults().getSafetyMargin());
    }

    public int estimate(String text, String modelId, double safetyMargin) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        double margin = Double.isFinite(safetyMargin) ? Math.min(1.0, Math.max(0.0, safetyMargin)) : 0.0;
        double raw = text.length() / resolveFamily(modelId).charsPerToken;
        return (int) Math.ceil(raw * (1.0 + margin));
    }

    /**
     * Context window for a model: configured override, then family default, then
     * the configured default window.
     */
    public int contextWindow(String modelId, ContextSettings settings) {
        ContextSettings effective = settings != null ? settings : ContextSettings.defaults();
        String normalized = normalizeModelId(modelId);
        Map<String, Integer> overrides = effective.getContextWindows();
        if (overrides != null && modelId != null) {
            Integer exact = overrides.get(modelId.trim().toLowerCase(Locale.ROOT));
            if (exact == null) {
                exact = overrides.get(normalized);
            }
            if (exact != null && exact > 0) {
                return exact;
            }
        }
        int familyWindow = resolveFamily(modelId).contextWindow;
        return familyWindow > 0 ? familyWindow : effective.getDefaultContextWindow();
    }

    /**
     * Share of the model's context window already used, clamped to [0, 1].
     */
    public double usageFraction(long tokensUsed, String modelId, ContextSettings settings) {
        int window = contextWindow(modelId, settings);
        if (window <= 0 || tokensUsed <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) tokensUsed / (double) window);
    }

    /**
     * Truncate text so that its estimate stays within {@code maxTokens}.
     */
    public String truncateToTokens(String text, String modelId, int maxTokens, double safetyMargin) {
        if (text == null || maxTokens <= 0) {
            return "";
        }
        if (estimate(text, modelId, safetyMargin) <= maxTokens) {
            return text;
        }
        double charsPerToken = resolveFamily(modelId).charsPerToken;
        int maxChars = (int) Math.floor(maxTokens * charsPerToken / (1.0 + Math.max(0.0, safetyMargin)));
        if (maxChars <= 3) {
            return "";
        }
        return text.substring(0, Math.min(text.length(), maxChars - 3)) + "...";
    }

    ModelFamily resolveFamily(String modelId) {
        String id = normalizeModelId(modelId);
        if (id.isEmpty()) {
            return ModelFamily.OTHER;
        }
        if (id.startsWith("claude") || id.contains("opus") || id.contains("sonnet") || id.contains("haiku")) {
            return ModelFamily.CLAUDE;
        }
        if (id.startsWith("gpt-") || id.startsWith("o1") || id.startsWith("o3") || id.startsWith("o4")) {
            return ModelFamily.OPENAI;
        }
        if (id.startsWith("gemini")) {
            return ModelFamily.GEMINI;
        }
        return ModelFamily.OTHER;
    }

    private String normalizeModelId(String modelId) {
        if (modelId == null || modelId.isBlank()) {
            return "";
        }
        String normalized = modelId.trim().toLowerCase(Locale.ROOT);
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }
}
