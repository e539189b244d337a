package com.purchasingpower.tutor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SetActiveAgentRequest {
    private Long agentId;
}
