package me.golemcore.contextengine.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorPatternDto {
    private String patternHash;
    private String projectId;
    private String category;
    private String solution;
    private double confidence;
    private int occurrences;
    private String language;
    private String state;
    private Instant lastSeen;
}
