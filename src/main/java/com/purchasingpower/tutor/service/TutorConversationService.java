package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.model.dto.ClientContext;
import com.purchasingpower.tutor.model.dto.ConversationDetail;
import com.purchasingpower.tutor.model.dto.ConversationSummary;

import java.util.List;

public interface TutorConversationService {

    /**
     * The user's conversations, most recent activity first, each with a preview of its last message.
     */
    List<ConversationSummary> listConversations(Long userId);

    /**
     * Full ordered history with the agent, creating the conversation on first access.
     */
    ConversationDetail getOrCreateConversation(Long userId, Long agentId);

    /**
     * @return number of messages deleted
     * @throws com.purchasingpower.tutor.exception.ResourceNotFoundException when the user never talked to the agent
     */
    int clearConversation(Long userId, Long agentId, ClientContext client);
}
