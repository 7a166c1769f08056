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
import java.time.temporal.ChronoUnit;

/**
 * Learned association between a normalized error signature and the redacted
 * solution that resolved it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ErrorPattern {

    private String patternHash;
    private String projectId;
    private ErrorSignature signature;
    private String solution;
    private double confidence;
    private int occurrences;
    private String language;
    private PatternState state;
    private Instant createdAt;
    private Instant lastSeen;
    private Integer ttlDays;

    /**
     * True once {@code lastSeen + ttlDays} lies strictly before {@code now}.
     */
    public boolean isExpired(Instant now, int defaultTtlDays) {
        Instant seen = lastSeen != null ? lastSeen : createdAt;
        if (seen == null) {
            return false;
        }
        int ttl = ttlDays != null && ttlDays > 0 ? ttlDays : defaultTtlDays;
        return seen.plus(ttl, ChronoUnit.DAYS).isBefore(now);
    }
}
