package me.golemcore.contextengine.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.contextengine.adapter.inbound.web.dto.ErrorPatternDto;
import me.golemcore.contextengine.adapter.inbound.web.dto.PatternFeedbackRequest;
import me.golemcore.contextengine.adapter.inbound.web.dto.StrategyDto;
import me.golemcore.contextengine.adapter.inbound.web.dto.StrategyRequest;
import me.golemcore.contextengine.adapter.inbound.web.dto.TaskOutcomeRequest;
import me.golemcore.contextengine.domain.model.ErrorPattern;
import me.golemcore.contextengine.domain.model.Strategy;
import me.golemcore.contextengine.domain.model.TaskAttemptEvent;
import me.golemcore.contextengine.domain.service.ErrorPatternService;
import me.golemcore.contextengine.domain.service.StrategyService;
import me.golemcore.contextengine.domain.service.TaskOutcomeCorrelator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Learning endpoints: task outcomes, error-pattern feedback and strategies.
 */
@RestController
@RequestMapping("/api/learning")
@RequiredArgsConstructor
public class LearningController {

    private static final int MAX_STRATEGY_LIMIT = 50;

    private final TaskOutcomeCorrelator taskOutcomeCorrelator;
    private final ErrorPatternService errorPatternService;
    private final StrategyService strategyService;

    @PostMapping("/outcomes")
    public Mono<ResponseEntity<Map<String, Object>>> recordOutcome(@RequestBody TaskOutcomeRequest request) {
        if (request == null || isBlank(request.getAttemptId()) || isBlank(request.getKind())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "attemptId and kind are required");
        }
        TaskAttemptEvent.Kind kind = parseKind(request.getKind());
        if (kind == TaskAttemptEvent.Kind.FAILURE && request.getSignature() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "signature is required for failures");
        }
        TaskAttemptEvent event = TaskAttemptEvent.builder()
                .kind(kind)
                .attemptId(request.getAttemptId())
                .projectId(request.getProjectId())
                .signature(request.getSignature())
                .solution(request.getSolution())
                .language(request.getLanguage())
                .appliedPatternHash(request.getAppliedPatternHash())
                .build();
        Optional<ErrorPattern> captured = taskOutcomeCorrelator.onEvent(event);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("accepted", true);
        response.put("captured", captured.isPresent());
        captured.ifPresent(pattern -> response.put("pattern", toDto(pattern)));
        return Mono.just(ResponseEntity.accepted().body(response));
    }

    @PostMapping("/patterns/{hash}/feedback")
    public Mono<ResponseEntity<ErrorPatternDto>> patternFeedback(@PathVariable String hash,
            @RequestBody PatternFeedbackRequest request) {
        String outcome = request != null && request.getOutcome() != null
                ? request.getOutcome().trim().toLowerCase(Locale.ROOT)
                : "";
        Optional<ErrorPattern> updated = switch (outcome) {
        case "helpful" -> errorPatternService.recordHelpful(hash);
        case "false_lead", "false-lead" -> errorPatternService.recordFalseLead(hash);
        default -> throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "outcome must be 'helpful' or 'false_lead'");
        };
        return Mono.just(updated
                .map(pattern -> ResponseEntity.ok(toDto(pattern)))
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @PostMapping("/patterns/sweep")
    public Mono<ResponseEntity<Map<String, Integer>>> sweepPatterns() {
        int removed = errorPatternService.sweepExpired();
        return Mono.just(ResponseEntity.ok(Map.of("removed", removed)));
    }

    @PostMapping("/strategies")
    public Mono<ResponseEntity<StrategyDto>> recordStrategy(@RequestBody StrategyRequest request) {
        if (request == null || isBlank(request.getProjectId()) || isBlank(request.getTopic())
                || isBlank(request.getInsight())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "projectId, topic and insight are required");
        }
        Optional<Strategy> recorded = strategyService.recordStrategy(request.getProjectId(), request.getTopic(),
                request.getInsight(), request.getLanguage(), request.getFramework());
        return Mono.just(recorded
                .map(strategy -> ResponseEntity.status(HttpStatus.CREATED).body(StrategyDto.from(strategy)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build()));
    }

    @PostMapping("/strategies/{id}/helpful")
    public Mono<ResponseEntity<StrategyDto>> markStrategyHelpful(@PathVariable String id) {
        return Mono.just(strategyService.markHelpful(id)
                .map(strategy -> ResponseEntity.ok(StrategyDto.from(strategy)))
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @GetMapping("/strategies")
    public Mono<ResponseEntity<List<StrategyDto>>> getStrategies(@RequestParam String projectId,
            @RequestParam(required = false) String language,
            @RequestParam(defaultValue = "10") int limit) {
        if (limit <= 0 || limit > MAX_STRATEGY_LIMIT) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "limit must be between 1 and " + MAX_STRATEGY_LIMIT);
        }
        List<StrategyDto> strategies = strategyService.topStrategies(projectId, language, limit).stream()
                .map(StrategyDto::from)
                .toList();
        return Mono.just(ResponseEntity.ok(strategies));
    }

    private static TaskAttemptEvent.Kind parseKind(String kind) {
        try {
            return TaskAttemptEvent.Kind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "kind must be 'failure' or 'success'");
        }
    }

    private static ErrorPatternDto toDto(ErrorPattern pattern) {
        return ErrorPatternDto.builder()
                .patternHash(pattern.getPatternHash())
                .projectId(pattern.getProjectId())
                .category(pattern.getSignature() != null ? pattern.getSignature().getCategory() : null)
                .solution(pattern.getSolution())
                .confidence(pattern.getConfidence())
                .occurrences(pattern.getOccurrences())
                .language(pattern.getLanguage())
                .state(pattern.getState() != null ? pattern.getState().name() : null)
                .lastSeen(pattern.getLastSeen())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
