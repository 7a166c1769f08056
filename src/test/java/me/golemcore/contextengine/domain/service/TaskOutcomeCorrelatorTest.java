package me.golemcore.contextengine.domain.service;

import me.golemcore.contextengine.domain.model.ContextSettings;
import me.golemcore.contextengine.domain.model.ErrorPattern;
import me.golemcore.contextengine.domain.model.ErrorSignature;
import me.golemcore.contextengine.domain.model.TaskAttemptEvent;
import me.golemcore.contextengine.infrastructure.config.ContextEngineProperties;
import me.golemcore.contextengine.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskOutcomeCorrelatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private ErrorPatternService errorPatternService;
    private MutableClock clock;
    private TaskOutcomeCorrelator correlator;

    @BeforeEach
    void setUp() {
        errorPatternService = mock(ErrorPatternService.class);
        clock = new MutableClock(NOW);
        correlator = new TaskOutcomeCorrelator(errorPatternService,
                new ContextSettingsService(new ContextEngineProperties()), clock);
    }

    @Test
    void shouldCaptureWhenSuccessFollowsFailure() {
        ErrorSignature signature = signature();
        ErrorPattern captured = ErrorPattern.builder().patternHash("h1").build();
        when(errorPatternService.capture(eq("proj"), eq(signature), eq("pin the version"), eq("java"),
                any(ContextSettings.class))).thenReturn(Optional.of(captured));

        correlator.onEvent(TaskAttemptEvent.failure("a1", "proj", signature));
        TaskAttemptEvent success = TaskAttemptEvent.success("a1", "proj", "pin the version");
        success.setLanguage("java");
        Optional<ErrorPattern> result = correlator.onEvent(success);

        assertEquals(Optional.of(captured), result);
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void shouldNotCaptureSuccessWithoutPriorFailure() {
        Optional<ErrorPattern> result = correlator.onEvent(TaskAttemptEvent.success("a1", "proj", "done"));

        assertTrue(result.isEmpty());
        verify(errorPatternService, never()).capture(anyString(), any(), any(), any(), any());
    }

    @Test
    void shouldNotPairDifferentAttempts() {
        correlator.onEvent(TaskAttemptEvent.failure("a1", "proj", signature()));

        correlator.onEvent(TaskAttemptEvent.success("a2", "proj", "done"));

        assertEquals(1, correlator.pendingCount());
        verify(errorPatternService, never()).capture(anyString(), any(), any(), any(), any());
    }

    @Test
    void shouldUseFailureProjectWhenSuccessOmitsIt() {
        ErrorSignature signature = signature();
        correlator.onEvent(TaskAttemptEvent.failure("a1", "proj", signature));

        correlator.onEvent(TaskAttemptEvent.success("a1", null, "done"));

        verify(errorPatternService).capture(eq("proj"), eq(signature), eq("done"), any(), any());
    }

    @Test
    void shouldRecordFeedbackForAppliedHints() {
        TaskAttemptEvent failure = TaskAttemptEvent.failure("a1", "proj", signature());
        failure.setAppliedPatternHash("bad-hint");
        correlator.onEvent(failure);

        TaskAttemptEvent success = TaskAttemptEvent.success("a2", "proj", "fixed");
        success.setAppliedPatternHash("good-hint");
        correlator.onEvent(success);

        verify(errorPatternService).recordFalseLead("bad-hint");
        verify(errorPatternService).recordHelpful("good-hint");
    }

    @Test
    void shouldIgnoreFailureWithoutSignature() {
        correlator.onEvent(TaskAttemptEvent.failure("a1", "proj", null));

        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void shouldIgnoreIncompleteEvents() {
        assertTrue(correlator.onEvent(null).isEmpty());
        assertTrue(correlator.onEvent(TaskAttemptEvent.builder().attemptId("a1").build()).isEmpty());
        assertTrue(correlator.onEvent(TaskAttemptEvent.failure(" ", "proj", signature())).isEmpty());
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void shouldEvictPendingFailuresOutsideWindow() {
        correlator.onEvent(TaskAttemptEvent.failure("a1", "proj", signature()));
        clock.advance(Duration.ofHours(5));
        correlator.onEvent(TaskAttemptEvent.failure("a2", "proj", signature()));
        clock.advance(Duration.ofHours(2));

        assertEquals(1, correlator.evictStale());
        assertEquals(1, correlator.pendingCount());

        correlator.onEvent(TaskAttemptEvent.success("a1", "proj", "late"));
        verify(errorPatternService, never()).capture(anyString(), any(), any(), any(), any());
    }

    @Test
    void shouldSwallowCaptureFailures() {
        when(errorPatternService.capture(any(), any(), any(), any(), any())).thenThrow(new IllegalStateException("x"));
        correlator.onEvent(TaskAttemptEvent.failure("a1", "proj", signature()));

        assertTrue(correlator.onEvent(TaskAttemptEvent.success("a1", "proj", "done")).isEmpty());
    }

    private ErrorSignature signature() {
        return ErrorSignature.builder().category("build").message("cannot resolve symbol Foo").build();
    }
}
