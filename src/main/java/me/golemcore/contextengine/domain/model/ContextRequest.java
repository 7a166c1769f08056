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
import java.util.List;

/**
 * Input of a single context assembly.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextRequest {

    private String sessionId;
    private String groupId;
    private AgentRole role;
    private String modelId;
    private long currentTokenUsage;
    private int iteration;

    /**
     * Scope for error patterns and strategies. Falls back to the session id.
     */
    private String projectId;

    private String taskDescription;
    private String language;

    @Builder.Default
    private List<ErrorSignature> recentErrors = new ArrayList<>();

    public boolean hasRecentErrors() {
        return recentErrors != null && !recentErrors.isEmpty();
    }
}
