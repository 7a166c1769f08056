package me.golemcore.contextengine.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.contextengine.domain.model.Strategy;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyDto {
    private String id;
    private String projectId;
    private String topic;
    private String insight;
    private int helpfulness;
    private String language;
    private String framework;
    private Instant updatedAt;

    public static StrategyDto from(Strategy strategy) {
        return StrategyDto.builder()
                .id(strategy.getId())
                .projectId(strategy.getProjectId())
                .topic(strategy.getTopic())
                .insight(strategy.getInsight())
                .helpfulness(strategy.getHelpfulness())
                .language(strategy.getLanguage())
                .framework(strategy.getFramework())
                .updatedAt(strategy.getUpdatedAt())
                .build();
    }
}
