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

/**
 * One half of a correlated fail-then-succeed pair, keyed by task attempt.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskAttemptEvent {

    public enum Kind {
        FAILURE, SUCCESS
    }

    private Kind kind;
    private String attemptId;
    private String projectId;

    /**
     * Set on FAILURE events.
     */
    private ErrorSignature signature;

    /**
     * Set on SUCCESS events.
     */
    private String solution;

    private String language;

    /**
     * Hash of an error hint the worker applied during this attempt, if any.
     */
    private String appliedPatternHash;

    private Instant timestamp;

    public static TaskAttemptEvent failure(String attemptId, String projectId, ErrorSignature signature) {
        return TaskAttemptEvent.builder()
                .kind(Kind.FAILURE)
                .attemptId(attemptId)
                .projectId(projectId)
                .signature(signature)
                .build();
    }

    public static TaskAttemptEvent success(String attemptId, String projectId, String solution) {
        return TaskAttemptEvent.builder()
                .kind(Kind.SUCCESS)
                .attemptId(attemptId)
                .projectId(projectId)
                .solution(solution)
                .build();
    }
}
