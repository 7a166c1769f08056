package me.golemcore.contextengine.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code outcome} is {@code helpful} or {@code false_lead}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternFeedbackRequest {
    private String outcome;
}
