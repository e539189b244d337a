package com.purchasingpower.tutor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSummary {

    private Long id;
    private Long agentId;
    private AgentSummary agent;
    private int messageCount;
    private LocalDateTime lastMessageAt;

    /**
     * Start of the newest message, null for an empty conversation.
     */
    private String lastMessagePreview;

    private LocalDateTime createdAt;
}
