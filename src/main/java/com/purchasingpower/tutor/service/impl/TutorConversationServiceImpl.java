package com.purchasingpower.tutor.service.impl;

import com.purchasingpower.tutor.exception.ResourceNotFoundException;
import com.purchasingpower.tutor.model.agent.Agent;
import com.purchasingpower.tutor.model.audit.InteractionEventType;
import com.purchasingpower.tutor.model.audit.InteractionLog;
import com.purchasingpower.tutor.model.conversation.TutorConversation;
import com.purchasingpower.tutor.model.conversation.TutorMessage;
import com.purchasingpower.tutor.model.dto.AgentSummary;
import com.purchasingpower.tutor.model.dto.ClientContext;
import com.purchasingpower.tutor.model.dto.ConversationDetail;
import com.purchasingpower.tutor.model.dto.ConversationSummary;
import com.purchasingpower.tutor.repository.AgentRepository;
import com.purchasingpower.tutor.repository.TutorSessionRepository;
import com.purchasingpower.tutor.service.AgentCatalogService;
import com.purchasingpower.tutor.service.ConversationStore;
import com.purchasingpower.tutor.service.InteractionAuditLogger;
import com.purchasingpower.tutor.service.TutorConversationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class TutorConversationServiceImpl implements TutorConversationService {

    private static final int PREVIEW_LENGTH = 100;

    private final ConversationStore conversationStore;
    private final AgentCatalogService agentCatalog;
    private final AgentRepository agentRepository;
    private final TutorSessionRepository sessionRepository;
    private final InteractionAuditLogger auditLogger;

    @Override
    public List<ConversationSummary> listConversations(Long userId) {
        List<TutorConversation> conversations = conversationStore.listForUser(userId);
        // Inactive agents still own history, so look them up regardless of status
        Map<Long, Agent> agents = agentRepository.findAllById(
                        conversations.stream().map(TutorConversation::getAgentId).distinct().toList())
                .stream()
                .collect(Collectors.toMap(Agent::getId, Function.identity()));

        return conversations.stream()
                .map(conversation -> summarize(conversation, agents.get(conversation.getAgentId())))
                .toList();
    }

    @Override
    public ConversationDetail getOrCreateConversation(Long userId, Long agentId) {
        Agent agent = agentCatalog.requireActive(agentId);
        TutorConversation conversation = conversationStore.getOrCreate(userId, agentId);

        return ConversationDetail.builder()
                .id(conversation.getId())
                .userId(userId)
                .agentId(agentId)
                .agent(AgentSummary.from(agent))
                .createdAt(conversation.getCreatedAt())
                .messages(conversationStore.allMessages(conversation.getId()))
                .build();
    }

    @Override
    public int clearConversation(Long userId, Long agentId, ClientContext client) {
        TutorConversation conversation = conversationStore.find(userId, agentId)
                .orElseThrow(() -> new ResourceNotFoundException("Conversation not found"));

        int deleted = conversationStore.clear(conversation.getId());

        sessionRepository.findByUserId(userId).ifPresent(session ->
                auditLogger.logBestEffort(InteractionLog.builder()
                        .userId(userId)
                        .sessionId(session.getId())
                        .eventType(InteractionEventType.CONVERSATION_CLEAR)
                        .mode(session.getMode())
                        .agentId(agentId)
                        .agentName(agentRepository.findById(agentId).map(Agent::getName).orElse(null))
                        .userAgent(client.getUserAgent())
                        .deviceType(client.getDeviceType())
                        .browserName(client.getBrowserName())
                        .build()));
        return deleted;
    }

    private ConversationSummary summarize(TutorConversation conversation, Agent agent) {
        String preview = conversationStore.lastMessage(conversation.getId())
                .map(TutorMessage::getContent)
                .map(content -> content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) + "..." : content)
                .orElse(null);

        return ConversationSummary.builder()
                .id(conversation.getId())
                .agentId(conversation.getAgentId())
                .agent(agent != null ? AgentSummary.from(agent) : null)
                .messageCount(conversation.getMessageCount())
                .lastMessageAt(conversation.getLastMessageAt())
                .lastMessagePreview(preview)
                .createdAt(conversation.getCreatedAt())
                .build();
    }
}
