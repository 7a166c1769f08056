package me.golemcore.contextengine.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.contextengine.domain.model.ErrorHint;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextBlockResponse {
    private String context;
    private String zone;
    private double usageFraction;
    private boolean checkpointRequired;
    private List<String> packageIds;
    private int overflowCount;
    private List<ErrorHint> errorHints;
    private List<StrategyDto> strategies;
    private int estimatedTokens;
    private boolean degraded;
    private Map<String, Object> diagnostics;
}
