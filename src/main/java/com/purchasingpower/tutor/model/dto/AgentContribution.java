package com.purchasingpower.tutor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentContribution {

    private Long agentId;
    private String agentName;
    private String displayName;
    private String reply;
    private String model;
    private Long responseTimeMs;
    private Long assistantMessageId;
}
