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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formatted context block plus the metadata describing what went into it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextBlock {

    private String renderedContext;
    private BudgetZone zone;
    private double usageFraction;

    @Builder.Default
    private List<ContextPackage> includedPackages = new ArrayList<>();

    private int overflowCount;

    @Builder.Default
    private List<ErrorHint> errorHints = new ArrayList<>();

    @Builder.Default
    private List<Strategy> strategies = new ArrayList<>();

    private int estimatedTokens;
    private boolean degraded;

    @Builder.Default
    private Map<String, Object> diagnostics = new LinkedHashMap<>();

    public boolean requiresCheckpoint() {
        return zone != null && zone.requiresCheckpoint();
    }
}
