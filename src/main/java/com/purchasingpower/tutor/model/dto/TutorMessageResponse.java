package com.purchasingpower.tutor.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.tutor.model.conversation.TutorMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one send. routingInfo is present only for router-mode turns,
 * collaborativeInfo only for fan-out turns.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TutorMessageResponse {

    private TutorMessage userMessage;
    private TutorMessage assistantMessage;
    private AgentSummary agent;
    private String model;
    private Long responseTimeMs;
    private RoutingInfo routingInfo;
    private CollaborativeInfo collaborativeInfo;
}
