package me.golemcore.contextengine.domain.component;

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

import me.golemcore.contextengine.domain.model.ContextPackage;
import me.golemcore.contextengine.domain.model.RankingQuery;
import me.golemcore.contextengine.domain.model.RankingWeights;
import me.golemcore.contextengine.domain.model.ScoredPackage;

import java.util.List;

/**
 * Orders candidate context packages by relevance to a requesting role.
 * Implementations must be deterministic and must never throw: malformed
 * candidates are skipped.
 */
public interface RelevanceRanker {

    /**
     * Ranks candidates, best first.
     *
     * @param candidates
     *            pool in insertion order; ties keep this order
     * @param query
     *            session, group, role and reference time
     * @param weights
     *            score component weights
     * @return total order over the well-formed candidates
     */
    List<ScoredPackage> rank(List<ContextPackage> candidates, RankingQuery query, RankingWeights weights);
}
