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
import me.golemcore.contextengine.domain.model.AgentRole;
import me.golemcore.contextengine.domain.model.BudgetZone;
import me.golemcore.contextengine.domain.model.ContextBlock;
import me.golemcore.contextengine.domain.model.ContextPackage;
import me.golemcore.contextengine.domain.model.ContextRequest;
import me.golemcore.contextengine.domain.model.ContextSettings;
import me.golemcore.contextengine.domain.model.ErrorHint;
import me.golemcore.contextengine.domain.model.PackagePriority;
import me.golemcore.contextengine.domain.model.RankingQuery;
import me.golemcore.contextengine.domain.model.ScoredPackage;
import me.golemcore.contextengine.domain.model.Strategy;
import me.golemcore.contextengine.port.outbound.ContextStorePort;
import me.golemcore.contextengine.port.outbound.PackageContentPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the bounded context block handed to a worker role.
 *
 * <p>
 * Steps:
 * <ol>
 * <li>resolve usage fraction and budget zone</li>
 * <li>stop early with a marker in WRAPUP and EMERGENCY</li>
 * <li>fetch and rank the session's packages, keep the role's top-K</li>
 * <li>render bodies or summaries depending on the zone</li>
 * <li>add error hints and strategies where the zone allows</li>
 * <li>record consumption of every included package</li>
 * </ol>
 *
 * <p>
 * Never throws: any failure yields a minimal degraded block.
 */
@Service
@Slf4j
public class ContextAssembler {

    static final String CHECKPOINT_MARKER = "CHECKPOINT REQUIRED: context budget exhausted. "
            + "Save progress and halt before starting new work.";
    static final String NO_NEW_CONTEXT_MARKER = "NO NEW CONTEXT: context budget nearly exhausted. "
            + "Finish the current step and wrap up.";

    private final ContextStorePort storePort;
    private final PackageContentPort packageContentPort;
    private final RelevanceRanker relevanceRanker;
    private final TokenEstimator tokenEstimator;
    private final BudgetZoneCalculator budgetZoneCalculator;
    private final ErrorPatternService errorPatternService;
    private final StrategyService strategyService;
    private final ConsumptionTracker consumptionTracker;
    private final ContextSettingsService contextSettingsService;
    private final Clock clock;

    public ContextAssembler(ContextStorePort storePort, PackageContentPort packageContentPort,
            RelevanceRanker relevanceRanker, TokenEstimator tokenEstimator,
            BudgetZoneCalculator budgetZoneCalculator, ErrorPatternService errorPatternService,
            StrategyService strategyService, ConsumptionTracker consumptionTracker,
            ContextSettingsService contextSettingsService, Clock clock) {
        this.storePort = storePort;
        this.packageContentPort = packageContentPort;
        this.relevanceRanker = relevanceRanker;
        this.tokenEstimator = tokenEstimator;
        this.budgetZoneCalculator = budgetZoneCalculator;
        this.errorPatternService = errorPatternService;
        this.strategyService = strategyService;
        this.consumptionTracker = consumptionTracker;
        this.contextSettingsService = contextSettingsService;
        this.clock = clock;
    }

    public ContextBlock assemble(ContextRequest request) {
        return assemble(request, contextSettingsService.current());
    }

    public ContextBlock assemble(ContextRequest request, ContextSettings settings) {
        long started = System.nanoTime();
        ContextSettings effective = settings != null ? settings : ContextSettings.defaults();
        ContextRequest safeRequest = request != null ? request : new ContextRequest();
        double usageFraction = 0.0;
        BudgetZone zone = BudgetZone.NORMAL;
        ContextBlock block;
        try {
            usageFraction = tokenEstimator.usageFraction(safeRequest.getCurrentTokenUsage(),
                    safeRequest.getModelId(), effective);
            zone = budgetZoneCalculator.resolve(usageFraction, effective.getZoneBoundaries());
            block = doAssemble(safeRequest, effective, usageFraction, zone);
        } catch (RuntimeException e) {
            log.warn("[Assembler] Degrading to minimal block for session {} ({}): {}",
                    safeRequest.getSessionId(), roleName(safeRequest.getRole()), e.getMessage());
            block = minimalBlock(safeRequest, effective, usageFraction, zone, e);
        }

        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
        block.getDiagnostics().put("elapsedMs", elapsedMs);
        if (effective.getLatencyTarget() != null && elapsedMs > effective.getLatencyTarget().toMillis()) {
            log.warn("[Assembler] Assembly for session {} took {} ms (target {} ms)", safeRequest.getSessionId(),
                    elapsedMs, effective.getLatencyTarget().toMillis());
        } else {
            log.debug("[Assembler] Assembled {} package(s) for {} in {} ms, zone {}",
                    block.getIncludedPackages().size(), roleName(safeRequest.getRole()), elapsedMs, block.getZone());
        }
        return block;
    }

    private ContextBlock doAssemble(ContextRequest request, ContextSettings settings, double usageFraction,
            BudgetZone zone) {
        validate(request);
        Map<String, Object> diagnostics = new LinkedHashMap<>();
        StringBuilder sb = new StringBuilder();
        appendHeader(sb, request, zone, usageFraction);

        if (!zone.allowsNewItems()) {
            sb.append("\n").append(zone.requiresCheckpoint() ? CHECKPOINT_MARKER : NO_NEW_CONTEXT_MARKER)
                    .append("\n");
            return finish(sb, request, settings, zone, usageFraction, List.of(), 0, List.of(), List.of(), false,
                    diagnostics);
        }

        List<ContextPackage> candidates = storePort.findPackages(request.getSessionId()).stream()
                .filter(pkg -> pkg != null && inScope(pkg, request))
                .toList();
        RankingQuery query = new RankingQuery(request.getSessionId(), request.getGroupId(), request.getRole(),
                clock.instant(), request.hasRecentErrors());
        List<ScoredPackage> ranked = relevanceRanker.rank(candidates, query, settings.getRankingWeights());
        if (zone.requiresHighPriority()) {
            ranked = ranked.stream()
                    .filter(scored -> scored.effectivePriority().isAtLeast(PackagePriority.HIGH))
                    .toList();
        }

        int limit = settings.retrievalLimitFor(request.getRole());
        List<ScoredPackage> selected = ranked.subList(0, Math.min(limit, ranked.size()));
        int overflow = Math.max(0, ranked.size() - limit);
        diagnostics.put("candidates", candidates.size());
        diagnostics.put("eligible", ranked.size());
        diagnostics.put("limit", limit);

        List<ContextPackage> included = new ArrayList<>();
        if (!selected.isEmpty()) {
            sb.append("\n## Context Packages\n");
            appendPackages(sb, selected, request, settings, zone, included, diagnostics);
        }

        List<ErrorHint> hints = errorHints(request, settings, diagnostics);
        if (!hints.isEmpty()) {
            sb.append("\n## Known Error Patterns\n");
            for (ErrorHint hint : hints) {
                sb.append("- (confidence ")
                        .append(String.format(Locale.ROOT, "%.2f", hint.getConfidence()))
                        .append(", seen ").append(hint.getOccurrences()).append("x");
                if (hint.getLanguage() != null && !hint.getLanguage().isBlank()) {
                    sb.append(", ").append(hint.getLanguage());
                }
                sb.append(") ").append(hint.getSolution()).append("\n");
            }
        }

        List<Strategy> strategies = zone.allowsStrategies() ? strategies(request, settings, diagnostics) : List.of();
        if (!strategies.isEmpty()) {
            sb.append("\n## Strategies\n");
            for (Strategy strategy : strategies) {
                sb.append("- ").append(strategy.getTopic()).append(": ").append(strategy.getInsight()).append("\n");
            }
        }

        if (overflow > 0) {
            sb.append("\n+").append(overflow).append(" more context package(s) available\n");
        }

        recordConsumption(request, included, diagnostics);
        return finish(sb, request, settings, zone, usageFraction, included, overflow, hints, strategies, false,
                diagnostics);
    }

    private void appendPackages(StringBuilder sb, List<ScoredPackage> selected, ContextRequest request,
            ContextSettings settings, BudgetZone zone, List<ContextPackage> included,
            Map<String, Object> diagnostics) {
        int window = tokenEstimator.contextWindow(request.getModelId(), settings);
        long softLimit = (long) Math.floor(window * settings.getZoneBoundaries().softWarning());
        long runningTokens = Math.max(0L, request.getCurrentTokenUsage())
                + tokenEstimator.estimate(sb.toString(), request.getModelId(), settings.getSafetyMargin());
        boolean bodiesAllowed = zone.allowsFullBodies();
        int summariesOnly = 0;

        for (ScoredPackage scored : selected) {
            ContextPackage pkg = scored.contextPackage();
            StringBuilder item = new StringBuilder();
            item.append("- [").append(scored.effectivePriority().name()).append("] ");
            if (zone.requiresHighPriority()) {
                item.append(truncate(pkg.getSummary(), settings.getConservativeSummaryChars()));
            } else {
                item.append(pkg.getSummary());
            }
            if (pkg.getPackageType() != null) {
                item.append(" (").append(pkg.getPackageType().getWireName()).append(")");
            }
            item.append("\n");

            if (bodiesAllowed) {
                Optional<String> body = readBody(pkg, request, settings);
                if (body.isPresent()) {
                    String indented = "  " + body.get().strip().replace("\n", "\n  ") + "\n";
                    long bodyTokens = tokenEstimator.estimate(indented, request.getModelId(),
                            settings.getSafetyMargin());
                    long itemTokens = tokenEstimator.estimate(item.toString(), request.getModelId(),
                            settings.getSafetyMargin());
                    if (runningTokens + itemTokens + bodyTokens > softLimit) {
                        bodiesAllowed = false;
                        summariesOnly++;
                    } else {
                        item.append(indented);
                    }
                }
            } else if (zone.allowsFullBodies()) {
                summariesOnly++;
            }

            runningTokens += tokenEstimator.estimate(item.toString(), request.getModelId(),
                    settings.getSafetyMargin());
            sb.append(item);
            included.add(pkg);
        }
        if (summariesOnly > 0) {
            diagnostics.put("summaryFallbacks", summariesOnly);
        }
    }

    private Optional<String> readBody(ContextPackage pkg, ContextRequest request, ContextSettings settings) {
        try {
            return packageContentPort.readContent(pkg.getContentPath())
                    .filter(body -> !body.isBlank())
                    .map(body -> tokenEstimator.truncateToTokens(body, request.getModelId(),
                            settings.getBodyTokenLimit(), settings.getSafetyMargin()));
        } catch (RuntimeException e) {
            log.warn("[Assembler] Failed to read body of package {}: {}", pkg.getId(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<ErrorHint> errorHints(ContextRequest request, ContextSettings settings,
            Map<String, Object> diagnostics) {
        if (!request.hasRecentErrors()) {
            return List.of();
        }
        try {
            return errorPatternService.matchAll(projectScope(request), request.getRecentErrors(), settings);
        } catch (RuntimeException e) {
            log.warn("[Assembler] Error hints skipped: {}", e.getMessage());
            diagnostics.put("errorHints", "skipped");
            return List.of();
        }
    }

    private List<Strategy> strategies(ContextRequest request, ContextSettings settings,
            Map<String, Object> diagnostics) {
        if (settings.getMaxStrategies() <= 0) {
            return List.of();
        }
        try {
            return strategyService.topStrategies(projectScope(request), request.getLanguage(),
                    settings.getMaxStrategies());
        } catch (RuntimeException e) {
            log.warn("[Assembler] Strategies skipped: {}", e.getMessage());
            diagnostics.put("strategies", "skipped");
            return List.of();
        }
    }

    private void recordConsumption(ContextRequest request, List<ContextPackage> included,
            Map<String, Object> diagnostics) {
        if (included.isEmpty()) {
            return;
        }
        try {
            int recorded = consumptionTracker.recordAll(request.getSessionId(), request.getGroupId(),
                    request.getRole(), request.getIteration(), included.stream().map(ContextPackage::getId).toList());
            diagnostics.put("consumptionRecorded", recorded);
        } catch (RuntimeException e) {
            log.warn("[Assembler] Consumption not recorded: {}", e.getMessage());
            diagnostics.put("consumptionRecorded", "failed");
        }
    }

    private ContextBlock finish(StringBuilder sb, ContextRequest request, ContextSettings settings, BudgetZone zone,
            double usageFraction, List<ContextPackage> included, int overflow, List<ErrorHint> hints,
            List<Strategy> strategies, boolean degraded, Map<String, Object> diagnostics) {
        String rendered = sb.toString();
        return ContextBlock.builder()
                .renderedContext(rendered)
                .zone(zone)
                .usageFraction(usageFraction)
                .includedPackages(new ArrayList<>(included))
                .overflowCount(overflow)
                .errorHints(new ArrayList<>(hints))
                .strategies(new ArrayList<>(strategies))
                .estimatedTokens(tokenEstimator.estimate(rendered, request.getModelId(), settings.getSafetyMargin()))
                .degraded(degraded)
                .diagnostics(diagnostics)
                .build();
    }

    private ContextBlock minimalBlock(ContextRequest request, ContextSettings settings, double usageFraction,
            BudgetZone zone, RuntimeException cause) {
        StringBuilder sb = new StringBuilder();
        appendHeader(sb, request, zone, usageFraction);
        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("error", cause.getClass().getSimpleName());
        String rendered = sb.toString();
        return ContextBlock.builder()
                .renderedContext(rendered)
                .zone(zone)
                .usageFraction(usageFraction)
                .estimatedTokens(safeEstimate(rendered, request, settings))
                .degraded(true)
                .diagnostics(diagnostics)
                .build();
    }

    private void appendHeader(StringBuilder sb, ContextRequest request, BudgetZone zone, double usageFraction) {
        sb.append("# Context for ").append(roleName(request.getRole())).append("\n");
        if (request.getTaskDescription() != null && !request.getTaskDescription().isBlank()) {
            sb.append("Task: ").append(request.getTaskDescription().strip()).append("\n");
        }
        sb.append("Zone: ").append(zone.name())
                .append(" (").append(zone.getDescription()).append(", ")
                .append(Math.round(usageFraction * 100)).append("% of context window used)\n");
    }

    private void validate(ContextRequest request) {
        if (request.getSessionId() == null || request.getSessionId().isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        if (request.getRole() == null) {
            throw new IllegalArgumentException("role is required");
        }
    }

    private boolean inScope(ContextPackage pkg, ContextRequest request) {
        if (!pkg.isIntendedFor(request.getRole())) {
            return false;
        }
        String requestGroup = request.getGroupId();
        String packageGroup = pkg.getGroupId();
        return requestGroup == null || requestGroup.isBlank()
                || packageGroup == null || packageGroup.isBlank()
                || packageGroup.equals(requestGroup);
    }

    private int safeEstimate(String text, ContextRequest request, ContextSettings settings) {
        try {
            return tokenEstimator.estimate(text, request.getModelId(), settings.getSafetyMargin());
        } catch (RuntimeException e) {
            return 0;
        }
    }

    private static String projectScope(ContextRequest request) {
        String projectId = request.getProjectId();
        return projectId != null && !projectId.isBlank() ? projectId : request.getSessionId();
    }

    private static String roleName(AgentRole role) {
        return role != null ? role.getWireName() : "agent";
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "";
        }
        if (maxLen <= 3 || text.length() <= maxLen) {
            return text;
        }
        return text.substring(0, maxLen - 3) + "...";
    }
}
