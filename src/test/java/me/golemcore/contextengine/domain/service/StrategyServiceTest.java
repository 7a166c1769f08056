package me.golemcore.contextengine.domain.service;

import me.golemcore.contextengine.domain.model.Strategy;
import me.golemcore.contextengine.security.SecretRedactor;
import me.golemcore.contextengine.testsupport.MutableClock;
import me.golemcore.contextengine.testsupport.WorkspaceStoreFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StrategyServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private WorkspaceStoreFixture fixture;
    private StrategyService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        fixture = WorkspaceStoreFixture.create(tempDir);
        service = new StrategyService(fixture.store(), new SecretRedactor(), fixture.settingsService(), clock);
    }

    @Test
    void shouldRecordNewStrategy() {
        Strategy strategy = service.recordStrategy("proj", " flaky tests ", "isolate shared fixtures", "java",
                "junit").orElseThrow();

        assertFalse(strategy.getId().isBlank());
        assertEquals("flaky tests", strategy.getTopic());
        assertEquals(0, strategy.getHelpfulness());
        assertEquals(NOW, strategy.getCreatedAt());
        assertEquals(1, fixture.store().findStrategies("proj").size());
    }

    @Test
    void shouldRedactSecretsInTopic() {
        Strategy strategy = service.recordStrategy("proj", "deploy with password=opensesame42", "use the vault",
                null, null).orElseThrow();

        assertFalse(strategy.getTopic().contains("opensesame42"));
        assertFalse(fixture.store().findStrategies("proj").get(0).getTopic().contains("opensesame42"));
    }

    @Test
    void shouldUpdateExistingTopicCaseInsensitively() {
        String id = service.recordStrategy("proj", "Migrations", "run them first", null, null)
                .orElseThrow().getId();
        clock.advance(Duration.ofMinutes(5));

        Strategy updated = service.recordStrategy("proj", "migrations", "run them in a transaction", "sql", null)
                .orElseThrow();

        assertEquals(id, updated.getId());
        assertEquals("run them in a transaction", updated.getInsight());
        assertEquals("sql", updated.getLanguage());
        assertEquals(NOW.plus(Duration.ofMinutes(5)), updated.getUpdatedAt());
        assertEquals(1, fixture.store().findStrategies("proj").size());
    }

    @Test
    void shouldKeepProjectsSeparate() {
        service.recordStrategy("alpha", "caching", "warm on boot", null, null);
        service.recordStrategy("beta", "caching", "lazy load", null, null);

        assertEquals(1, service.topStrategies("alpha", null, 10).size());
        assertEquals("lazy load", service.topStrategies("beta", null, 10).get(0).getInsight());
    }

    @Test
    void shouldRedactSecretsInInsight() {
        Strategy strategy = service.recordStrategy("proj", "deploy", "login with password=letmein first", null,
                null).orElseThrow();

        assertFalse(strategy.getInsight().contains("letmein"));
        assertFalse(fixture.store().findStrategy(strategy.getId()).orElseThrow().getInsight().contains("letmein"));
    }

    @Test
    void shouldRejectIncompleteStrategies() {
        assertTrue(service.recordStrategy("proj", "", "insight", null, null).isEmpty());
        assertTrue(service.recordStrategy(null, "topic", "insight", null, null).isEmpty());
        assertTrue(service.recordStrategy("proj", "topic", " ", null, null).isEmpty());
    }

    @Test
    void shouldMarkHelpful() {
        String id = service.recordStrategy("proj", "logging", "use structured fields", null, null)
                .orElseThrow().getId();

        service.markHelpful(id);
        Strategy strategy = service.markHelpful(id).orElseThrow();

        assertEquals(2, strategy.getHelpfulness());
        assertEquals(2, fixture.store().findStrategy(id).orElseThrow().getHelpfulness());
        assertTrue(service.markHelpful("missing").isEmpty());
    }

    @Test
    void shouldOrderByLanguageThenHelpfulnessThenRecency() {
        String older = service.recordStrategy("proj", "a", "older python", "python", null).orElseThrow().getId();
        clock.advance(Duration.ofMinutes(1));
        service.recordStrategy("proj", "b", "newer python", "python", null);
        clock.advance(Duration.ofMinutes(1));
        String popular = service.recordStrategy("proj", "c", "popular go", "go", null).orElseThrow().getId();
        service.markHelpful(popular);
        service.markHelpful(popular);
        clock.advance(Duration.ofMinutes(1));
        service.markHelpful(older);

        List<String> insights = service.topStrategies("proj", "Python", 10).stream()
                .map(Strategy::getInsight)
                .toList();

        assertEquals(List.of("older python", "newer python", "popular go"), insights);
        assertEquals("popular go", service.topStrategies("proj", null, 1).get(0).getInsight());
    }

    @Test
    void shouldReturnNothingForNonPositiveLimit() {
        service.recordStrategy("proj", "t", "i", null, null);

        assertTrue(service.topStrategies("proj", null, 0).isEmpty());
        assertTrue(service.topStrategies(" ", null, 5).isEmpty());
    }
}
