package me.golemcore.contextengine.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.contextengine.domain.model.ErrorSignature;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssembleContextRequest {
    private String sessionId;
    private String groupId;
    private String role;
    private String modelId;
    private long currentTokenUsage;
    private int iteration;
    private String projectId;
    private String taskDescription;
    private String language;
    @Builder.Default
    private List<ErrorSignature> recentErrors = new ArrayList<>();
}
