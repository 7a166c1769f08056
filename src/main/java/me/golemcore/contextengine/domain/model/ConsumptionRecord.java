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
 * Audit row marking that a package was shown to a role on a given iteration.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsumptionRecord {

    private String sessionId;
    private String groupId;
    private AgentRole role;
    private int iteration;
    private String packageId;
    private Instant consumedAt;

    public Key key() {
        return new Key(sessionId, groupId != null ? groupId : "", role, iteration, packageId);
    }

    /**
     * Composite uniqueness key. A new iteration is a new key.
     */
    public record Key(String sessionId, String groupId, AgentRole role, int iteration, String packageId) {

        /**
         * Length-prefixed encoding, so field values containing the separator
         * cannot make two keys collide.
         */
        public String asString() {
            StringBuilder encoded = new StringBuilder();
            for (String part : new String[] { sessionId, groupId, role != null ? role.getWireName() : null,
                    Integer.toString(iteration), packageId }) {
                String value = part != null ? part : "";
                encoded.append(value.length()).append(':').append(value).append('|');
            }
            return encoded.toString();
        }
    }
}
