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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Worker roles that request context. Closed set so role affinity lookups stay
 * exhaustive.
 */
public enum AgentRole {

    PROJECT_MANAGER("project_manager", 3),
    REQUIREMENTS_ENGINEER("requirements_engineer", 3),
    INVESTIGATOR("investigator", 3),
    DEVELOPER("developer", 3),
    SENIOR_SOFTWARE_ENGINEER("senior_software_engineer", 3),
    QA_EXPERT("qa_expert", 5),
    TECH_LEAD("tech_lead", 5);

    public static final int DEFAULT_RETRIEVAL_LIMIT = 3;

    private final String wireName;
    private final int defaultRetrievalLimit;

    AgentRole(String wireName, int defaultRetrievalLimit) {
        this.wireName = wireName;
        this.defaultRetrievalLimit = defaultRetrievalLimit;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public int getDefaultRetrievalLimit() {
        return defaultRetrievalLimit;
    }

    /**
     * Resolve a role from its wire name or enum constant name, ignoring case and
     * treating dashes and spaces as underscores.
     */
    public static Optional<AgentRole> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (AgentRole role : values()) {
            if (role.wireName.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static AgentRole fromJson(String value) {
        return fromValue(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown agent role: " + value));
    }
}
