package com.purchasingpower.tutor.model.dto;

import com.purchasingpower.tutor.model.agent.Agent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public view of an agent. The system prompt and rule lists are never exposed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSummary {

    private Long id;
    private String name;
    private String displayName;
    private String description;
    private String welcomeMessage;
    private String personality;
    private String avatarUrl;

    public static AgentSummary from(Agent agent) {
        return AgentSummary.builder()
            .id(agent.getId())
            .name(agent.getName())
            .displayName(agent.getDisplayName())
            .description(agent.getDescription())
            .welcomeMessage(agent.getWelcomeMessage())
            .personality(agent.getPersonality())
            .avatarUrl(agent.getAvatarUrl())
            .build();
    }
}
