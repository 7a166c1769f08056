package me.golemcore.contextengine.port.outbound;

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

import me.golemcore.contextengine.domain.model.ConsumptionRecord;
import me.golemcore.contextengine.domain.model.ContextPackage;
import me.golemcore.contextengine.domain.model.ErrorPattern;
import me.golemcore.contextengine.domain.model.Strategy;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * Narrow repository over the four persisted tables: context packages, error
 * patterns, strategies and consumption records.
 *
 * <p>
 * Implementations own concurrency: contended operations are retried with
 * backoff internally. Writes that still fail are logged and dropped; reads that
 * still fail throw {@link StoreUnavailableException}.
 */
public interface ContextStorePort {

    /**
     * Insert or replace a package by id.
     */
    void savePackage(ContextPackage contextPackage);

    /**
     * All packages of a session, in insertion order.
     */
    List<ContextPackage> findPackages(String sessionId);

    Optional<ErrorPattern> findPattern(String patternHash);

    List<ErrorPattern> findPatterns(String projectId);

    List<ErrorPattern> findAllPatterns();

    /**
     * Insert or replace a pattern by hash.
     */
    void upsertPattern(ErrorPattern pattern);

    /**
     * Insert the pattern, or replace an existing row with the same hash by
     * {@code merger.apply(existing, pattern)}. Lookup and write happen under one
     * table lock, so concurrent merges of the same hash are not lost.
     *
     * @return the stored row, or empty if the write was dropped
     */
    Optional<ErrorPattern> mergePattern(ErrorPattern pattern, BinaryOperator<ErrorPattern> merger);

    /**
     * Delete patterns by hash.
     *
     * @return number of rows removed
     */
    int deletePatterns(Collection<String> patternHashes);

    void saveStrategy(Strategy strategy);

    Optional<Strategy> findStrategy(String strategyId);

    List<Strategy> findStrategies(String projectId);

    /**
     * Atomic insert-or-ignore on the composite consumption key.
     *
     * @return {@code true} if a new row was stored
     */
    boolean insertConsumptionIfAbsent(ConsumptionRecord consumptionRecord);

    List<ConsumptionRecord> findConsumption(String sessionId);
}
