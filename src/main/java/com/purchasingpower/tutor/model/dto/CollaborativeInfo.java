package com.purchasingpower.tutor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a fan-out: who answered, who failed, and the composed view of all answers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollaborativeInfo {

    private String style;
    private int requestedAgents;

    @Builder.Default
    private List<AgentContribution> participants = new ArrayList<>();

    @Builder.Default
    private List<FailedAgent> failed = new ArrayList<>();

    private String composedResponse;
}
