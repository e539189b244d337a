package com.purchasingpower.tutor.model.dto;

import com.purchasingpower.tutor.model.conversation.TutorMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationDetail {

    private Long id;
    private Long userId;
    private Long agentId;
    private AgentSummary agent;
    private LocalDateTime createdAt;

    @Builder.Default
    private List<TutorMessage> messages = new ArrayList<>();
}
