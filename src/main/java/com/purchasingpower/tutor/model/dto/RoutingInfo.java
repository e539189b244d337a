package com.purchasingpower.tutor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Why a router-mode turn went to the agent it went to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingInfo {

    private Long selectedAgentId;
    private String selectedAgent;
    private String reason;
    private double confidence;

    @Builder.Default
    private List<String> alternatives = new ArrayList<>();
}
