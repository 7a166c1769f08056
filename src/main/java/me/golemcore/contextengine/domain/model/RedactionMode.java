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

import java.util.Locale;

/**
 * Which redaction passes run before text is persisted.
 */
public enum RedactionMode {

    PATTERN_ONLY, ENTROPY, BOTH;

    public boolean patternPass() {
        return this == PATTERN_ONLY || this == BOTH;
    }

    public boolean entropyPass() {
        return this == ENTROPY || this == BOTH;
    }

    /**
     * Parse a configuration value such as {@code pattern_only}. Unknown or blank
     * values run both passes.
     */
    public static RedactionMode fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return BOTH;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (RedactionMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        return BOTH;
    }
}
