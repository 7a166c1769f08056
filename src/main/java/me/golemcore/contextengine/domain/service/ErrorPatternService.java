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
import me.golemcore.contextengine.domain.model.ContextSettings;
import me.golemcore.contextengine.domain.model.ErrorHint;
import me.golemcore.contextengine.domain.model.ErrorPattern;
import me.golemcore.contextengine.domain.model.ErrorSignature;
import me.golemcore.contextengine.domain.model.PatternState;
import me.golemcore.contextengine.port.outbound.ContextStorePort;
import me.golemcore.contextengine.security.RedactionException;
import me.golemcore.contextengine.security.SecretRedactor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Learned error patterns: capture of fail-then-succeed outcomes, exact-hash
 * matching, confidence feedback and TTL expiry.
 *
 * <p>
 * Signatures are redacted before they are normalised and hashed, so the hash
 * of a signature never depends on a secret it happened to contain. Nothing
 * here throws to the caller; store and redaction failures are logged and the
 * operation is skipped.
 */
@Service
@Slf4j
public class ErrorPatternService {

    private static final double MAX_CONFIDENCE = 1.0;

    private final ContextStorePort storePort;
    private final ErrorSignatureNormalizer normalizer;
    private final SecretRedactor secretRedactor;
    private final ContextSettingsService contextSettingsService;
    private final Clock clock;

    public ErrorPatternService(ContextStorePort storePort, ErrorSignatureNormalizer normalizer,
            SecretRedactor secretRedactor, ContextSettingsService contextSettingsService, Clock clock) {
        this.storePort = storePort;
        this.normalizer = normalizer;
        this.secretRedactor = secretRedactor;
        this.contextSettingsService = contextSettingsService;
        this.clock = clock;
    }

    // ==================== Capture ====================

    public Optional<ErrorPattern> capture(String projectId, ErrorSignature signature, String solution,
            String language) {
        return capture(projectId, signature, solution, language, contextSettingsService.current());
    }

    /**
     * Record a fail-then-succeed outcome. A new signature starts at the initial
     * confidence; a known one gains an occurrence and a fresh last-seen time.
     */
    public Optional<ErrorPattern> capture(String projectId, ErrorSignature signature, String solution,
            String language, ContextSettings settings) {
        if (isBlank(projectId) || signature == null) {
            log.debug("[Patterns] Capture skipped: missing project or signature");
            return Optional.empty();
        }
        try {
            ErrorSignature normalized = normalizer.normalize(redactSignature(signature, settings));
            String redactedSolution = secretRedactor.redact(solution, settings);
            String hash = normalizer.hash(projectId, normalized);
            Instant now = clock.instant();

            ErrorPattern candidate = newPattern(hash, projectId, normalized, redactedSolution, language, now,
                    settings);
            candidate.setState(stateFor(candidate.getConfidence(), settings));
            Optional<ErrorPattern> stored = storePort.mergePattern(candidate, this::mergeCapture);
            if (stored.isEmpty()) {
                log.warn("[Patterns] Capture of {} was not stored", shortHash(hash));
                return Optional.empty();
            }
            ErrorPattern pattern = stored.get();
            log.info("[Patterns] Captured pattern {} (project={}, occurrences={}, confidence={})",
                    shortHash(hash), projectId, pattern.getOccurrences(), pattern.getConfidence());
            return stored;
        } catch (RedactionException e) {
            log.warn("[Patterns] Redaction failed, capture dropped: {}", e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("[Patterns] Capture failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private ErrorPattern mergeCapture(ErrorPattern existing, ErrorPattern incoming) {
        existing.setOccurrences(existing.getOccurrences() + 1);
        existing.setLastSeen(incoming.getLastSeen());
        if (isBlank(existing.getSolution()) && !isBlank(incoming.getSolution())) {
            existing.setSolution(incoming.getSolution());
        }
        if (isBlank(existing.getLanguage()) && !isBlank(incoming.getLanguage())) {
            existing.setLanguage(incoming.getLanguage());
        }
        return existing;
    }

    private ErrorPattern newPattern(String hash, String projectId, ErrorSignature signature, String solution,
            String language, Instant now, ContextSettings settings) {
        return ErrorPattern.builder()
                .patternHash(hash)
                .projectId(projectId)
                .signature(signature)
                .solution(solution)
                .confidence(clamp(settings.getInitialConfidence(), settings))
                .occurrences(1)
                .language(language)
                .state(PatternState.ACTIVE)
                .createdAt(now)
                .lastSeen(now)
                .ttlDays(settings.getPatternTtlDays())
                .build();
    }

    // ==================== Match ====================

    public Optional<ErrorHint> match(String projectId, ErrorSignature signature) {
        return match(projectId, signature, contextSettingsService.current());
    }

    /**
     * Exact-hash lookup within a project. Only patterns at or above the
     * injection threshold produce a hint.
     */
    public Optional<ErrorHint> match(String projectId, ErrorSignature signature, ContextSettings settings) {
        if (isBlank(projectId) || signature == null) {
            return Optional.empty();
        }
        try {
            String hash = normalizer.hash(projectId, normalizer.normalize(redactSignature(signature, settings)));
            Optional<ErrorPattern> found = storePort.findPattern(hash)
                    .filter(pattern -> Objects.equals(projectId, pattern.getProjectId()))
                    .filter(pattern -> !pattern.isExpired(clock.instant(), settings.getPatternTtlDays()));
            if (found.isEmpty()) {
                return Optional.empty();
            }
            ErrorPattern pattern = found.get();
            touch(pattern);
            if (!isInjectable(pattern.getConfidence(), settings)) {
                log.debug("[Patterns] Pattern {} below injection threshold ({})", shortHash(hash),
                        pattern.getConfidence());
                return Optional.empty();
            }
            return Optional.of(ErrorHint.builder()
                    .patternHash(pattern.getPatternHash())
                    .solution(pattern.getSolution())
                    .confidence(pattern.getConfidence())
                    .occurrences(pattern.getOccurrences())
                    .language(pattern.getLanguage())
                    .build());
        } catch (RedactionException e) {
            log.warn("[Patterns] Redaction failed, match skipped: {}", e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("[Patterns] Match failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Hints for several recent errors, one per distinct pattern, highest
     * confidence first.
     */
    public List<ErrorHint> matchAll(String projectId, List<ErrorSignature> signatures, ContextSettings settings) {
        if (signatures == null || signatures.isEmpty()) {
            return List.of();
        }
        Map<String, ErrorHint> byHash = new LinkedHashMap<>();
        for (ErrorSignature signature : signatures) {
            match(projectId, signature, settings).ifPresent(hint -> byHash.putIfAbsent(hint.getPatternHash(), hint));
        }
        List<ErrorHint> hints = new ArrayList<>(byHash.values());
        hints.sort((a, b) -> Double.compare(b.getConfidence(), a.getConfidence()));
        return hints;
    }

    private void touch(ErrorPattern pattern) {
        try {
            pattern.setLastSeen(clock.instant());
            storePort.upsertPattern(pattern);
        } catch (RuntimeException e) {
            log.debug("[Patterns] Failed to refresh last-seen for {}: {}", shortHash(pattern.getPatternHash()),
                    e.getMessage());
        }
    }

    // ==================== Feedback ====================

    public Optional<ErrorPattern> recordHelpful(String patternHash) {
        ContextSettings settings = contextSettingsService.current();
        return adjustConfidence(patternHash, settings.getSuccessBoost(), settings);
    }

    public Optional<ErrorPattern> recordFalseLead(String patternHash) {
        ContextSettings settings = contextSettingsService.current();
        return adjustConfidence(patternHash, -settings.getFalseLeadPenalty(), settings);
    }

    Optional<ErrorPattern> adjustConfidence(String patternHash, double delta, ContextSettings settings) {
        if (isBlank(patternHash)) {
            return Optional.empty();
        }
        try {
            Optional<ErrorPattern> found = storePort.findPattern(patternHash);
            if (found.isEmpty()) {
                log.debug("[Patterns] Feedback for unknown pattern {}", shortHash(patternHash));
                return Optional.empty();
            }
            ErrorPattern pattern = found.get();
            double before = pattern.getConfidence();
            pattern.setConfidence(clamp(before + delta, settings));
            pattern.setState(stateFor(pattern.getConfidence(), settings));
            storePort.upsertPattern(pattern);
            log.info("[Patterns] Pattern {} confidence {} -> {} ({})", shortHash(patternHash), before,
                    pattern.getConfidence(), pattern.getState());
            return Optional.of(pattern);
        } catch (RuntimeException e) {
            log.warn("[Patterns] Feedback for {} failed: {}", shortHash(patternHash), e.getMessage());
            return Optional.empty();
        }
    }

    // ==================== Expiry ====================

    public int sweepExpired() {
        return sweepExpired(clock.instant());
    }

    /**
     * Delete exactly the patterns whose {@code lastSeen + ttlDays} is before
     * {@code now}.
     */
    public int sweepExpired(Instant now) {
        ContextSettings settings = contextSettingsService.current();
        try {
            List<String> expired = storePort.findAllPatterns().stream()
                    .filter(pattern -> pattern.isExpired(now, settings.getPatternTtlDays()))
                    .map(ErrorPattern::getPatternHash)
                    .toList();
            if (expired.isEmpty()) {
                return 0;
            }
            int removed = storePort.deletePatterns(expired);
            log.info("[Patterns] Swept {} expired pattern(s)", removed);
            return removed;
        } catch (RuntimeException e) {
            log.warn("[Patterns] Sweep failed: {}", e.getMessage());
            return 0;
        }
    }

    // ==================== Helpers ====================

    static double clamp(double confidence, ContextSettings settings) {
        double floor = Math.max(0.0, settings.getMinConfidence());
        if (Double.isNaN(confidence)) {
            return floor;
        }
        double bounded = Math.max(floor, Math.min(MAX_CONFIDENCE, confidence));
        return Math.round(bounded * 10_000d) / 10_000d;
    }

    static boolean isInjectable(double confidence, ContextSettings settings) {
        return confidence >= settings.getObservationThreshold() && confidence >= settings.getInjectionThreshold();
    }

    static PatternState stateFor(double confidence, ContextSettings settings) {
        if (confidence >= settings.getInjectionThreshold()) {
            return PatternState.CONFIRMED;
        }
        if (confidence < settings.getObservationThreshold()) {
            return PatternState.DEMOTED;
        }
        return PatternState.ACTIVE;
    }

    private ErrorSignature redactSignature(ErrorSignature signature, ContextSettings settings) {
        ErrorSignature redacted = signature.toBuilder().build();
        redacted.setCategory(secretRedactor.redact(signature.getCategory(), settings));
        redacted.setMessage(secretRedactor.redact(signature.getMessage(), settings));
        redacted.setContextHints(redactAll(signature.getContextHints(), settings));
        redacted.setStackShape(redactAll(signature.getStackShape(), settings));
        return redacted;
    }

    private List<String> redactAll(List<String> values, ContextSettings settings) {
        if (values == null) {
            return new ArrayList<>();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(value -> secretRedactor.redact(value, settings))
                .toList();
    }

    private static String shortHash(String hash) {
        return hash != null && hash.length() > 12 ? hash.substring(0, 12) : hash;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
