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

/**
 * Graduated token-budget regimes. Each zone governs how much, and what kind of,
 * context may still be injected.
 */
public enum BudgetZone {

    NORMAL("Full context"),
    SOFT_WARNING("Summaries preferred"),
    CONSERVATIVE("Critical and high priority only"),
    WRAPUP("No new context"),
    EMERGENCY("Checkpoint and halt");

    private final String description;

    BudgetZone(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean allowsNewItems() {
        return this == NORMAL || this == SOFT_WARNING || this == CONSERVATIVE;
    }

    public boolean allowsFullBodies() {
        return this == NORMAL;
    }

    public boolean requiresHighPriority() {
        return this == CONSERVATIVE;
    }

    public boolean allowsStrategies() {
        return this == NORMAL || this == SOFT_WARNING;
    }

    public boolean requiresCheckpoint() {
        return this == EMERGENCY;
    }
}
