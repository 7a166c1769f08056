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
import me.golemcore.contextengine.domain.model.ContextPackage;
import me.golemcore.contextengine.port.outbound.ContextStorePort;
import me.golemcore.contextengine.security.SecretRedactor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.UUID;

/**
 * Registration of context packages produced by upstream roles.
 */
@Service
@Slf4j
public class ContextPackageService {

    private final ContextStorePort storePort;
    private final SecretRedactor secretRedactor;
    private final ContextSettingsService contextSettingsService;
    private final Clock clock;

    public ContextPackageService(ContextStorePort storePort, SecretRedactor secretRedactor,
            ContextSettingsService contextSettingsService, Clock clock) {
        this.storePort = storePort;
        this.secretRedactor = secretRedactor;
        this.contextSettingsService = contextSettingsService;
        this.clock = clock;
    }

    /**
     * Validate, complete and store a package.
     *
     * @throws IllegalArgumentException
     *             if session, priority or summary is missing
     */
    public ContextPackage register(ContextPackage contextPackage) {
        if (contextPackage == null) {
            throw new IllegalArgumentException("package is required");
        }
        if (contextPackage.getSessionId() == null || contextPackage.getSessionId().isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (contextPackage.getPriority() == null) {
            throw new IllegalArgumentException("priority is required");
        }
        if (contextPackage.getSummary() == null || contextPackage.getSummary().isBlank()) {
            throw new IllegalArgumentException("summary is required");
        }
        if (contextPackage.getId() == null || contextPackage.getId().isBlank()) {
            contextPackage.setId(UUID.randomUUID().toString());
        }
        if (contextPackage.getCreatedAt() == null) {
            contextPackage.setCreatedAt(clock.instant());
        }
        if (contextPackage.getConsumerRoles() == null) {
            contextPackage.setConsumerRoles(new ArrayList<>());
        }
        contextPackage.setSummary(secretRedactor.redact(contextPackage.getSummary().strip(),
                contextSettingsService.current()));
        storePort.savePackage(contextPackage);
        log.info("[Packages] Registered {} package {} for session {}", contextPackage.getPriority().getWireName(),
                contextPackage.getId(), contextPackage.getSessionId());
        return contextPackage;
    }
}
