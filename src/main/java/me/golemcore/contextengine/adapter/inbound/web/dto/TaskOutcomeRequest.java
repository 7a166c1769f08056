package me.golemcore.contextengine.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.contextengine.domain.model.ErrorSignature;

/**
 * One half of a fail-then-succeed pair. {@code kind} is {@code failure} or
 * {@code success}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskOutcomeRequest {
    private String kind;
    private String attemptId;
    private String projectId;
    private ErrorSignature signature;
    private String solution;
    private String language;
    private String appliedPatternHash;
}
