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
import me.golemcore.contextengine.domain.component.RelevanceRanker;
import me.golemcore.contextengine.domain.model.ContextPackage;
import me.golemcore.contextengine.domain.model.PackagePriority;
import me.golemcore.contextengine.domain.model.PackageType;
import me.golemcore.contextengine.domain.model.RankingQuery;
import me.golemcore.contextengine.domain.model.RankingWeights;
import me.golemcore.contextengine.domain.model.ScoredPackage;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deterministic relevance heuristic:
 *
 * <pre>
 * score = w1 * priorityWeight + w2 * sameGroupBonus + w3 * roleAffinity + w4 * recencyDecay
 * </pre>
 *
 * <p>
 * {@code recencyDecay} is {@code 1 / (1 + ageHours)}. Packages of type
 * {@link PackageType#FAILURES} are escalated to at least
 * {@link PackagePriority#HIGH} while the requesting role faces errors. Ties
 * keep insertion order.
 */
@Service
@Slf4j
public class HeuristicRelevanceRanker implements RelevanceRanker {

    private static final double SAME_GROUP_BONUS = 1.0;
    private static final double SESSION_WIDE_BONUS = 0.5;

    @Override
    public List<ScoredPackage> rank(List<ContextPackage> candidates, RankingQuery query, RankingWeights weights) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        RankingWeights effectiveWeights = weights != null ? weights : RankingWeights.DEFAULTS;
        Instant now = query != null && query.now() != null ? query.now() : Instant.now();

        List<ScoredPackage> scored = new ArrayList<>();
        int index = 0;
        int skipped = 0;
        for (ContextPackage candidate : candidates) {
            int insertionIndex = index++;
            try {
                if (!isWellFormed(candidate)) {
                    log.warn("[Ranker] Skipping malformed package at position {}: {}", insertionIndex,
                            describe(candidate));
                    skipped++;
                    continue;
                }
                PackagePriority effectivePriority = effectivePriority(candidate, query);
                double score = score(candidate, effectivePriority, query, effectiveWeights, now);
                scored.add(new ScoredPackage(candidate, score, effectivePriority, insertionIndex));
            } catch (RuntimeException e) {
                log.warn("[Ranker] Skipping package at position {}: {}", insertionIndex, e.getMessage());
                skipped++;
            }
        }

        scored.sort(Comparator.comparingDouble(ScoredPackage::score).reversed()
                .thenComparingInt(ScoredPackage::insertionIndex));
        log.debug("[Ranker] Ranked {} package(s), skipped {}", scored.size(), skipped);
        return scored;
    }

    double score(ContextPackage contextPackage, PackagePriority effectivePriority, RankingQuery query,
            RankingWeights weights, Instant now) {
        double priority = effectivePriority.getWeight();
        double group = groupBonus(contextPackage, query);
        double affinity = RoleAffinity.of(contextPackage, query != null ? query.role() : null);
        double recency = recencyDecay(contextPackage.getCreatedAt(), now);
        return (weights.priority() * priority)
                + (weights.sameGroup() * group)
                + (weights.roleAffinity() * affinity)
                + (weights.recency() * recency);
    }

    private PackagePriority effectivePriority(ContextPackage contextPackage, RankingQuery query) {
        PackagePriority priority = contextPackage.getPriority();
        if (query != null && query.failureActive() && contextPackage.getPackageType() == PackageType.FAILURES) {
            return priority.escalateTo(PackagePriority.HIGH);
        }
        return priority;
    }

    private double groupBonus(ContextPackage contextPackage, RankingQuery query) {
        String packageGroup = contextPackage.getGroupId();
        if (packageGroup == null || packageGroup.isBlank()) {
            return SESSION_WIDE_BONUS;
        }
        if (query != null && packageGroup.equals(query.groupId())) {
            return SAME_GROUP_BONUS;
        }
        return 0.0;
    }

    private double recencyDecay(Instant createdAt, Instant now) {
        if (createdAt == null) {
            return 0.0;
        }
        double ageHours = Math.max(0L, Duration.between(createdAt, now).toMillis()) / 3_600_000.0;
        return 1.0 / (1.0 + ageHours);
    }

    private boolean isWellFormed(ContextPackage candidate) {
        return candidate != null
                && candidate.getId() != null && !candidate.getId().isBlank()
                && candidate.getPriority() != null
                && candidate.getSummary() != null && !candidate.getSummary().isBlank();
    }

    private String describe(ContextPackage candidate) {
        if (candidate == null) {
            return "null";
        }
        return "id=" + candidate.getId() + ", priority=" + candidate.getPriority();
    }
}
