package me.golemcore.contextengine.domain.service;

import me.golemcore.contextengine.domain.model.AgentRole;
import me.golemcore.contextengine.domain.model.ContextPackage;
import me.golemcore.contextengine.domain.model.PackagePriority;
import me.golemcore.contextengine.domain.model.PackageType;
import me.golemcore.contextengine.domain.model.RankingQuery;
import me.golemcore.contextengine.domain.model.RankingWeights;
import me.golemcore.contextengine.domain.model.ScoredPackage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HeuristicRelevanceRankerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String SESSION = "S1";
    private static final String GROUP = "G1";

    private final HeuristicRelevanceRanker ranker = new HeuristicRelevanceRanker();

    @ParameterizedTest
    @EnumSource(AgentRole.class)
    void shouldBeMonotoneInPriority(AgentRole role) {
        RankingQuery query = new RankingQuery(SESSION, GROUP, role, NOW, false);
        double previous = Double.POSITIVE_INFINITY;
        for (PackagePriority priority : PackagePriority.values()) {
            ContextPackage pkg = pkg("p-" + priority, priority, GROUP, PackageType.RESEARCH, NOW.minusSeconds(60));
            double score = ranker.score(pkg, priority, query, RankingWeights.DEFAULTS, NOW);
            assertTrue(score <= previous, priority + " must not outscore a higher priority");
            previous = score;
        }
    }

    @Test
    void shouldOrderByPriorityWhenOtherFactorsEqual() {
        List<ContextPackage> candidates = List.of(
                pkg("low", PackagePriority.LOW),
                pkg("critical", PackagePriority.CRITICAL),
                pkg("medium", PackagePriority.MEDIUM),
                pkg("high", PackagePriority.HIGH));

        List<ScoredPackage> ranked = ranker.rank(candidates, query(AgentRole.DEVELOPER, false),
                RankingWeights.DEFAULTS);

        assertEquals(List.of("critical", "high", "medium", "low"), ids(ranked));
    }

    @Test
    void shouldBreakTiesByInsertionOrder() {
        List<ContextPackage> candidates = List.of(
                pkg("first", PackagePriority.MEDIUM),
                pkg("second", PackagePriority.MEDIUM),
                pkg("third", PackagePriority.MEDIUM));

        List<ScoredPackage> ranked = ranker.rank(candidates, query(AgentRole.DEVELOPER, false),
                RankingWeights.DEFAULTS);

        assertEquals(List.of("first", "second", "third"), ids(ranked));
    }

    @Test
    void shouldBeDeterministic() {
        List<ContextPackage> candidates = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            PackagePriority priority = PackagePriority.values()[i % 4];
            candidates.add(pkg("p" + i, priority, i % 3 == 0 ? "G2" : GROUP, PackageType.values()[i % 6],
                    NOW.minus(Duration.ofMinutes(i * 17L))));
        }

        List<String> first = ids(ranker.rank(candidates, query(AgentRole.QA_EXPERT, false), RankingWeights.DEFAULTS));
        List<String> second = ids(ranker.rank(candidates, query(AgentRole.QA_EXPERT, false), RankingWeights.DEFAULTS));

        assertEquals(first, second);
    }

    @Test
    void shouldPreferSameGroupOverOtherGroup() {
        List<ContextPackage> candidates = List.of(
                pkg("other", PackagePriority.MEDIUM, "G9", PackageType.RESEARCH, NOW),
                pkg("same", PackagePriority.MEDIUM, GROUP, PackageType.RESEARCH, NOW));

        List<ScoredPackage> ranked = ranker.rank(candidates, query(AgentRole.DEVELOPER, false),
                RankingWeights.DEFAULTS);

        assertEquals(List.of("same", "other"), ids(ranked));
    }

    @Test
    void shouldPreferRecentPackages() {
        List<ContextPackage> candidates = List.of(
                pkg("old", PackagePriority.HIGH, GROUP, PackageType.RESEARCH, NOW.minus(Duration.ofDays(3))),
                pkg("fresh", PackagePriority.HIGH, GROUP, PackageType.RESEARCH, NOW.minusSeconds(30)));

        List<ScoredPackage> ranked = ranker.rank(candidates, query(AgentRole.DEVELOPER, false),
                RankingWeights.DEFAULTS);

        assertEquals(List.of("fresh", "old"), ids(ranked));
    }

    @Test
    void shouldEscalateFailurePackagesWhileErrorsAreActive() {
        ContextPackage failures = pkg("failures", PackagePriority.LOW, GROUP, PackageType.FAILURES, NOW);

        ScoredPackage idle = ranker.rank(List.of(failures), query(AgentRole.DEVELOPER, false),
                RankingWeights.DEFAULTS).get(0);
        ScoredPackage active = ranker.rank(List.of(failures), query(AgentRole.DEVELOPER, true),
                RankingWeights.DEFAULTS).get(0);

        assertEquals(PackagePriority.LOW, idle.effectivePriority());
        assertEquals(PackagePriority.HIGH, active.effectivePriority());
        assertTrue(active.score() > idle.score());
        assertEquals(PackagePriority.LOW, failures.getPriority());
    }

    @Test
    void shouldNeverDowngradeCriticalOnEscalation() {
        ContextPackage failures = pkg("failures", PackagePriority.CRITICAL, GROUP, PackageType.FAILURES, NOW);

        ScoredPackage ranked = ranker.rank(List.of(failures), query(AgentRole.DEVELOPER, true),
                RankingWeights.DEFAULTS).get(0);

        assertEquals(PackagePriority.CRITICAL, ranked.effectivePriority());
    }

    @Test
    void shouldSkipMalformedPackagesWithoutThrowing() {
        ContextPackage noPriority = pkg("no-priority", null);
        ContextPackage noSummary = pkg("no-summary", PackagePriority.HIGH);
        noSummary.setSummary(" ");
        ContextPackage noId = pkg(null, PackagePriority.CRITICAL);

        List<ScoredPackage> ranked = ranker.rank(
                Arrays.asList(null, noPriority, pkg("valid", PackagePriority.LOW), noSummary, noId),
                query(AgentRole.DEVELOPER, false), RankingWeights.DEFAULTS);

        assertEquals(List.of("valid"), ids(ranked));
    }

    @Test
    void shouldReturnEmptyListForNoCandidates() {
        assertTrue(ranker.rank(List.of(), query(AgentRole.DEVELOPER, false), RankingWeights.DEFAULTS).isEmpty());
        assertTrue(ranker.rank(null, query(AgentRole.DEVELOPER, false), RankingWeights.DEFAULTS).isEmpty());
    }

    @Test
    void shouldGiveExplicitConsumersFullAffinity() {
        ContextPackage addressed = pkg("addressed", PackagePriority.MEDIUM, GROUP, PackageType.REQUIREMENTS, NOW);
        addressed.setConsumerRoles(List.of(AgentRole.INVESTIGATOR));

        assertEquals(1.0, RoleAffinity.of(addressed, AgentRole.INVESTIGATOR), 1e-9);
        assertEquals(0.4, RoleAffinity.of(PackageType.REQUIREMENTS, AgentRole.INVESTIGATOR), 1e-9);
    }

    private RankingQuery query(AgentRole role, boolean failureActive) {
        return new RankingQuery(SESSION, GROUP, role, NOW, failureActive);
    }

    private ContextPackage pkg(String id, PackagePriority priority) {
        return pkg(id, priority, GROUP, PackageType.RESEARCH, NOW.minusSeconds(60));
    }

    private ContextPackage pkg(String id, PackagePriority priority, String group, PackageType type,
            Instant createdAt) {
        return ContextPackage.builder()
                .id(id)
                .sessionId(SESSION)
                .groupId(group)
                .packageType(type)
                .priority(priority)
                .summary("Summary of " + id)
                .createdAt(createdAt)
                .build();
    }

    private List<String> ids(List<ScoredPackage> ranked) {
        return ranked.stream().map(scored -> scored.contextPackage().getId()).toList();
    }
}
