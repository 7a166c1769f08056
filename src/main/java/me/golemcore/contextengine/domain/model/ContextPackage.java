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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A retrievable unit of supporting material produced by an upstream role and
 * scoped to a session and, optionally, a task group.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextPackage {

    private String id;
    private String sessionId;
    private String groupId;
    private PackageType packageType;
    private PackagePriority priority;
    private String summary;

    /**
     * Location of the full content, usually an artifact file.
     */
    private String contentPath;

    private AgentRole producerRole;

    @Builder.Default
    private List<AgentRole> consumerRoles = new ArrayList<>();

    private Instant createdAt;

    public boolean isIntendedFor(AgentRole role) {
        return consumerRoles == null || consumerRoles.isEmpty() || consumerRoles.contains(role);
    }
}
