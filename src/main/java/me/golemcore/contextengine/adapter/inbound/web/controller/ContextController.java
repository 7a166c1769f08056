package me.golemcore.contextengine.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.contextengine.adapter.inbound.web.dto.AssembleContextRequest;
import me.golemcore.contextengine.adapter.inbound.web.dto.ContextBlockResponse;
import me.golemcore.contextengine.adapter.inbound.web.dto.RegisterPackageRequest;
import me.golemcore.contextengine.adapter.inbound.web.dto.StrategyDto;
import me.golemcore.contextengine.domain.model.AgentRole;
import me.golemcore.contextengine.domain.model.ConsumptionRecord;
import me.golemcore.contextengine.domain.model.ContextBlock;
import me.golemcore.contextengine.domain.model.ContextPackage;
import me.golemcore.contextengine.domain.model.ContextRequest;
import me.golemcore.contextengine.domain.model.PackagePriority;
import me.golemcore.contextengine.domain.model.PackageType;
import me.golemcore.contextengine.domain.service.ConsumptionTracker;
import me.golemcore.contextengine.domain.service.ContextAssembler;
import me.golemcore.contextengine.domain.service.ContextPackageService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Context assembly and package registration endpoints, consumed by the
 * orchestrator.
 */
@RestController
@RequestMapping("/api/context")
@RequiredArgsConstructor
public class ContextController {

    private final ContextAssembler contextAssembler;
    private final ContextPackageService contextPackageService;
    private final ConsumptionTracker consumptionTracker;

    @PostMapping("/assemble")
    public Mono<ResponseEntity<ContextBlockResponse>> assemble(@RequestBody AssembleContextRequest request) {
        if (request == null || isBlank(request.getSessionId())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "sessionId is required");
        }
        ContextRequest contextRequest = ContextRequest.builder()
                .sessionId(request.getSessionId())
                .groupId(request.getGroupId())
                .role(parseRole(request.getRole()))
                .modelId(request.getModelId())
                .currentTokenUsage(request.getCurrentTokenUsage())
                .iteration(request.getIteration())
                .projectId(request.getProjectId())
                .taskDescription(request.getTaskDescription())
                .language(request.getLanguage())
                .recentErrors(request.getRecentErrors() != null ? request.getRecentErrors() : new ArrayList<>())
                .build();
        ContextBlock block = contextAssembler.assemble(contextRequest);
        return Mono.just(ResponseEntity.ok(toResponse(block)));
    }

    @PostMapping("/packages")
    public Mono<ResponseEntity<ContextPackage>> registerPackage(@RequestBody RegisterPackageRequest request) {
        if (request == null || isBlank(request.getSessionId()) || isBlank(request.getSummary())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "sessionId and summary are required");
        }
        if (isBlank(request.getPriority())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "priority is required");
        }
        List<AgentRole> consumers = new ArrayList<>();
        if (request.getConsumerRoles() != null) {
            for (String consumer : request.getConsumerRoles()) {
                consumers.add(parseRole(consumer));
            }
        }
        ContextPackage contextPackage = ContextPackage.builder()
                .id(request.getId())
                .sessionId(request.getSessionId())
                .groupId(request.getGroupId())
                .packageType(parseEnum(request.getPackageType(), "packageType", PackageType.class))
                .priority(parseEnum(request.getPriority(), "priority", PackagePriority.class))
                .summary(request.getSummary())
                .contentPath(request.getContentPath())
                .producerRole(isBlank(request.getProducerRole()) ? null : parseRole(request.getProducerRole()))
                .consumerRoles(consumers)
                .build();
        ContextPackage saved = contextPackageService.register(contextPackage);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(saved));
    }

    @GetMapping("/sessions/{sessionId}/consumption")
    public Mono<ResponseEntity<List<ConsumptionRecord>>> getConsumption(@PathVariable String sessionId) {
        return Mono.just(ResponseEntity.ok(consumptionTracker.deliveries(sessionId)));
    }

    private ContextBlockResponse toResponse(ContextBlock block) {
        return ContextBlockResponse.builder()
                .context(block.getRenderedContext())
                .zone(block.getZone() != null ? block.getZone().name() : null)
                .usageFraction(block.getUsageFraction())
                .checkpointRequired(block.requiresCheckpoint())
                .packageIds(block.getIncludedPackages().stream().map(ContextPackage::getId).toList())
                .overflowCount(block.getOverflowCount())
                .errorHints(block.getErrorHints())
                .strategies(block.getStrategies().stream()
                        .map(StrategyDto::from)
                        .toList())
                .estimatedTokens(block.getEstimatedTokens())
                .degraded(block.isDegraded())
                .diagnostics(block.getDiagnostics())
                .build();
    }

    private static AgentRole parseRole(String role) {
        return AgentRole.fromValue(role)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown role: " + role));
    }

    private static <E extends Enum<E>> E parseEnum(String value, String field, Class<E> type) {
        if (isBlank(value)) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown " + field + ": " + value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
