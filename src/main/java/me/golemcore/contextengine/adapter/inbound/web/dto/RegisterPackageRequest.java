package me.golemcore.contextengine.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterPackageRequest {
    private String id;
    private String sessionId;
    private String groupId;
    private String packageType;
    private String priority;
    private String summary;
    private String contentPath;
    private String producerRole;
    @Builder.Default
    private List<String> consumerRoles = new ArrayList<>();
}
