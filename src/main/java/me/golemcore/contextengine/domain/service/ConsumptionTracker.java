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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.contextengine.domain.model.AgentRole;
import me.golemcore.contextengine.domain.model.ConsumptionRecord;
import me.golemcore.contextengine.port.outbound.ContextStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.List;

/**
 * Audit trail of which package was shown to which role on which iteration.
 * Recording is idempotent per (session, group, role, iteration, package).
 */
@Service
@Slf4j
public class ConsumptionTracker {

    private final ContextStorePort storePort;
    private final Clock clock;

    public ConsumptionTracker(ContextStorePort storePort, Clock clock) {
        this.storePort = storePort;
        this.clock = clock;
    }

    /**
     * @return {@code true} if this call stored a new row
     */
    public boolean record(String sessionId, String groupId, AgentRole role, int iteration, String packageId) {
        ConsumptionRecord consumptionRecord = ConsumptionRecord.builder()
                .sessionId(sessionId)
                .groupId(groupId)
                .role(role)
                .iteration(iteration)
                .packageId(packageId)
                .consumedAt(clock.instant())
                .build();
        try {
            boolean inserted = storePort.insertConsumptionIfAbsent(consumptionRecord);
            if (inserted) {
                log.debug("[Consumption] {} consumed {} (session={}, iteration={})",
                        role != null ? role.getWireName() : null, packageId, sessionId, iteration);
            }
            return inserted;
        } catch (RuntimeException e) {
            log.warn("[Consumption] Failed to record {} for session {}: {}", packageId, sessionId, e.getMessage());
            return false;
        }
    }

    /**
     * @return number of new rows
     */
    public int recordAll(String sessionId, String groupId, AgentRole role, int iteration,
            Collection<String> packageIds) {
        if (packageIds == null || packageIds.isEmpty()) {
            return 0;
        }
        int inserted = 0;
        for (String packageId : packageIds) {
            if (record(sessionId, groupId, role, iteration, packageId)) {
                inserted++;
            }
        }
        return inserted;
    }

    public List<ConsumptionRecord> deliveries(String sessionId) {
        return storePort.findConsumption(sessionId);
    }
}
