package me.golemcore.contextengine.adapter.outbound.store;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.contextengine.domain.model.ConsumptionRecord;
import me.golemcore.contextengine.domain.model.ContextPackage;
import me.golemcore.contextengine.domain.model.ContextSettings;
import me.golemcore.contextengine.domain.model.ErrorPattern;
import me.golemcore.contextengine.domain.model.ErrorSignature;
import me.golemcore.contextengine.domain.model.Strategy;
import me.golemcore.contextengine.domain.service.ContextSettingsService;
import me.golemcore.contextengine.infrastructure.config.ContextEngineProperties;
import me.golemcore.contextengine.port.outbound.ContextStorePort;
import me.golemcore.contextengine.port.outbound.StoragePort;
import me.golemcore.contextengine.security.RedactionException;
import me.golemcore.contextengine.security.SecretRedactor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * {@link ContextStorePort} backed by JSON table documents in the local
 * workspace.
 *
 * <p>
 * Tables:
 * <ul>
 * <li>{@code context_packages} - keyed by package id</li>
 * <li>{@code error_patterns} - keyed by pattern hash</li>
 * <li>{@code strategies} - keyed by strategy id</li>
 * <li>{@code consumption} - keyed by (session, group, role, iteration,
 * package)</li>
 * </ul>
 *
 * <p>
 * Package summaries, pattern solutions, every text field of a signature and
 * strategy topics and insights are redacted again at this boundary before they
 * are written.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkspaceContextStoreAdapter implements ContextStorePort {

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ContextEngineProperties properties;
    private final StoreRetryExecutor retryExecutor;
    private final SecretRedactor secretRedactor;
    private final ContextSettingsService contextSettingsService;

    private JsonTable<ContextPackage> packages;
    private JsonTable<ErrorPattern> patterns;
    private JsonTable<Strategy> strategies;
    private JsonTable<ConsumptionRecord> consumption;

    @PostConstruct
    public void init() {
        String directory = properties.getStorage().getDirectory();
        Duration lockTimeout = properties.getStore().getLockTimeout();
        packages = new JsonTable<>("context_packages", directory, ContextPackage.class, ContextPackage::getId,
                storagePort, objectMapper, lockTimeout);
        patterns = new JsonTable<>("error_patterns", directory, ErrorPattern.class, ErrorPattern::getPatternHash,
                storagePort, objectMapper, lockTimeout);
        strategies = new JsonTable<>("strategies", directory, Strategy.class, Strategy::getId,
                storagePort, objectMapper, lockTimeout);
        consumption = new JsonTable<>("consumption", directory, ConsumptionRecord.class,
                row -> row.key().asString(), storagePort, objectMapper, lockTimeout);
        try {
            storagePort.ensureDirectory(directory).join();
        } catch (RuntimeException e) {
            log.warn("[Store] Could not prepare store directory '{}': {}", directory, e.getMessage());
        }
        log.info("[Store] Workspace context store ready in '{}'", directory);
    }

    @Override
    public void savePackage(ContextPackage contextPackage) {
        if (contextPackage == null || isBlank(contextPackage.getId())) {
            log.warn("[Store] Ignoring package without id");
            return;
        }
        ContextPackage row = packages.copy(contextPackage);
        try {
            row.setSummary(secretRedactor.redact(row.getSummary(), settings()));
        } catch (RedactionException e) {
            log.warn("[Store] Dropping package {}: {}", contextPackage.getId(), e.getMessage());
            return;
        }
        retryExecutor.write("savePackage", () -> packages.write(rows -> rows.put(row.getId(), row)));
    }

    @Override
    public List<ContextPackage> findPackages(String sessionId) {
        return retryExecutor.read("findPackages", () -> packages.read(rows -> packages.copyAll(
                rows.values().stream()
                        .filter(row -> Objects.equals(sessionId, row.getSessionId()))
                        .toList())));
    }

    @Override
    public Optional<ErrorPattern> findPattern(String patternHash) {
        if (isBlank(patternHash)) {
            return Optional.empty();
        }
        return retryExecutor.read("findPattern",
                () -> patterns.read(rows -> Optional.ofNullable(patterns.copy(rows.get(patternHash)))));
    }

    @Override
    public List<ErrorPattern> findPatterns(String projectId) {
        return retryExecutor.read("findPatterns", () -> patterns.read(rows -> patterns.copyAll(
                rows.values().stream()
                        .filter(row -> Objects.equals(projectId, row.getProjectId()))
                        .toList())));
    }

    @Override
    public List<ErrorPattern> findAllPatterns() {
        return retryExecutor.read("findAllPatterns", () -> patterns.read(rows -> patterns.copyAll(rows.values())));
    }

    @Override
    public void upsertPattern(ErrorPattern pattern) {
        if (pattern == null || isBlank(pattern.getPatternHash())) {
            log.warn("[Store] Ignoring pattern without hash");
            return;
        }
        ErrorPattern row;
        try {
            row = redactPattern(patterns.copy(pattern), settings());
        } catch (RedactionException e) {
            log.warn("[Store] Dropping pattern {}: {}", pattern.getPatternHash(), e.getMessage());
            return;
        }
        retryExecutor.write("upsertPattern", () -> patterns.write(rows -> rows.put(row.getPatternHash(), row)));
    }

    @Override
    public Optional<ErrorPattern> mergePattern(ErrorPattern pattern, BinaryOperator<ErrorPattern> merger) {
        if (pattern == null || isBlank(pattern.getPatternHash()) || merger == null) {
            log.warn("[Store] Ignoring pattern merge without hash");
            return Optional.empty();
        }
        ContextSettings settings = settings();
        ErrorPattern candidate;
        try {
            candidate = redactPattern(patterns.copy(pattern), settings);
        } catch (RedactionException e) {
            log.warn("[Store] Dropping pattern {}: {}", pattern.getPatternHash(), e.getMessage());
            return Optional.empty();
        }
        String hash = candidate.getPatternHash();
        return retryExecutor.write("mergePattern", () -> patterns.write(rows -> {
            ErrorPattern existing = rows.get(hash);
            ErrorPattern stored = candidate;
            if (existing != null) {
                stored = redactPattern(merger.apply(patterns.copy(existing), patterns.copy(candidate)), settings);
                stored.setPatternHash(hash);
            }
            rows.put(hash, stored);
            return Optional.of(patterns.copy(stored));
        }), Optional.empty());
    }

    @Override
    public int deletePatterns(Collection<String> patternHashes) {
        if (patternHashes == null || patternHashes.isEmpty()) {
            return 0;
        }
        return retryExecutor.write("deletePatterns", () -> patterns.write(rows -> {
            int removed = 0;
            for (String hash : patternHashes) {
                if (hash != null && rows.remove(hash) != null) {
                    removed++;
                }
            }
            return removed;
        }), 0);
    }

    @Override
    public void saveStrategy(Strategy strategy) {
        if (strategy == null || isBlank(strategy.getId())) {
            log.warn("[Store] Ignoring strategy without id");
            return;
        }
        Strategy row = strategies.copy(strategy);
        try {
            ContextSettings settings = settings();
            row.setTopic(secretRedactor.redact(row.getTopic(), settings));
            row.setInsight(secretRedactor.redact(row.getInsight(), settings));
        } catch (RedactionException e) {
            log.warn("[Store] Dropping strategy {}: {}", strategy.getId(), e.getMessage());
            return;
        }
        retryExecutor.write("saveStrategy", () -> strategies.write(rows -> rows.put(row.getId(), row)));
    }

    @Override
    public Optional<Strategy> findStrategy(String strategyId) {
        if (isBlank(strategyId)) {
            return Optional.empty();
        }
        return retryExecutor.read("findStrategy",
                () -> strategies.read(rows -> Optional.ofNullable(strategies.copy(rows.get(strategyId)))));
    }

    @Override
    public List<Strategy> findStrategies(String projectId) {
        return retryExecutor.read("findStrategies", () -> strategies.read(rows -> strategies.copyAll(
                rows.values().stream()
                        .filter(row -> Objects.equals(projectId, row.getProjectId()))
                        .toList())));
    }

    @Override
    public boolean insertConsumptionIfAbsent(ConsumptionRecord consumptionRecord) {
        if (consumptionRecord == null || isBlank(consumptionRecord.getSessionId())
                || isBlank(consumptionRecord.getPackageId()) || consumptionRecord.getRole() == null) {
            log.warn("[Store] Ignoring incomplete consumption record");
            return false;
        }
        ConsumptionRecord row = consumption.copy(consumptionRecord);
        String key = consumption.keyOf(row);
        return retryExecutor.write("insertConsumption", () -> consumption.write(rows -> {
            if (rows.containsKey(key)) {
                return false;
            }
            rows.put(key, row);
            return true;
        }), false);
    }

    @Override
    public List<ConsumptionRecord> findConsumption(String sessionId) {
        return retryExecutor.read("findConsumption", () -> consumption.read(rows -> consumption.copyAll(
                rows.values().stream()
                        .filter(row -> Objects.equals(sessionId, row.getSessionId()))
                        .toList())));
    }

    private ErrorPattern redactPattern(ErrorPattern row, ContextSettings settings) {
        row.setSolution(secretRedactor.redact(row.getSolution(), settings));
        ErrorSignature signature = row.getSignature();
        if (signature != null) {
            signature.setCategory(secretRedactor.redact(signature.getCategory(), settings));
            signature.setMessage(secretRedactor.redact(signature.getMessage(), settings));
            signature.setContextHints(redactAll(signature.getContextHints(), settings));
            signature.setStackShape(redactAll(signature.getStackShape(), settings));
        }
        return row;
    }

    private List<String> redactAll(List<String> values, ContextSettings settings) {
        if (values == null) {
            return null;
        }
        return values.stream()
                .map(value -> secretRedactor.redact(value, settings))
                .toList();
    }

    private ContextSettings settings() {
        return contextSettingsService.current();
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
