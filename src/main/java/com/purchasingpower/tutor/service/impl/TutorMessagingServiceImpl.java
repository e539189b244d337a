package com.purchasingpower.tutor.service.impl;

import com.purchasingpower.tutor.client.ProviderAdapterRegistry;
import com.purchasingpower.tutor.client.ProviderReply;
import com.purchasingpower.tutor.client.ProviderRequest;
import com.purchasingpower.tutor.exception.ConfigurationException;
import com.purchasingpower.tutor.exception.ProviderException;
import com.purchasingpower.tutor.exception.ValidationException;
import com.purchasingpower.tutor.model.agent.Agent;
import com.purchasingpower.tutor.model.conversation.TutorConversation;
import com.purchasingpower.tutor.model.conversation.TutorMessage;
import com.purchasingpower.tutor.model.dto.AgentSummary;
import com.purchasingpower.tutor.model.dto.ClientContext;
import com.purchasingpower.tutor.model.dto.CollaborativeSettings;
import com.purchasingpower.tutor.model.dto.RoutingInfo;
import com.purchasingpower.tutor.model.dto.SendMessageRequest;
import com.purchasingpower.tutor.model.dto.TutorMessageResponse;
import com.purchasingpower.tutor.model.provider.ProviderSelection;
import com.purchasingpower.tutor.model.session.TutorMode;
import com.purchasingpower.tutor.model.session.TutorSession;
import com.purchasingpower.tutor.service.AgentCatalogService;
import com.purchasingpower.tutor.service.AgentRoute;
import com.purchasingpower.tutor.service.AgentSelector;
import com.purchasingpower.tutor.service.ConversationStore;
import com.purchasingpower.tutor.service.MultiAgentCollaborationEngine;
import com.purchasingpower.tutor.service.ProviderConfigResolver;
import com.purchasingpower.tutor.service.RecordedTurn;
import com.purchasingpower.tutor.service.TurnExchange;
import com.purchasingpower.tutor.service.TurnRecorder;
import com.purchasingpower.tutor.service.TutorMessagingService;
import com.purchasingpower.tutor.service.TutorPromptBuilder;
import com.purchasingpower.tutor.service.TutorSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Send path: validate, resolve agent and provider, get or create the session, read history,
 * call the backend (outside any transaction), then record the turn atomically. A request
 * rejected before the session step writes nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TutorMessagingServiceImpl implements TutorMessagingService {

    private final TutorSessionService sessionService;
    private final AgentCatalogService agentCatalog;
    private final AgentSelector agentSelector;
    private final ProviderConfigResolver providerResolver;
    private final ProviderAdapterRegistry adapterRegistry;
    private final ConversationStore conversationStore;
    private final TutorPromptBuilder promptBuilder;
    private final TurnRecorder turnRecorder;
    private final MultiAgentCollaborationEngine collaborationEngine;

    @Override
    public TutorMessageResponse sendMessage(Long userId, Long agentId, SendMessageRequest request,
                                            ClientContext client) {
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            throw new ValidationException("Message is required");
        }
        CollaborativeSettings collaboration = request.getCollaborativeSettings();
        if (collaboration != null) {
            collaborationEngine.validate(collaboration);
        }
        String message = request.getMessage().trim();

        Agent addressed = agentCatalog.requireActive(agentId);
        ProviderSelection selection = providerResolver.resolve()
                .orElseThrow(() -> new ConfigurationException("No AI provider configured"));

        TutorSession session = sessionService.getOrCreateSession(userId, client);

        if (collaboration != null) {
            return collaborationEngine.collaborate(session, addressed, message, request.getContext(),
                    collaboration, selection, client);
        }

        Agent agent = addressed;
        RoutingInfo routing = null;
        if (session.getMode() == TutorMode.ROUTER) {
            AgentRoute route = agentSelector.select(message, agentCatalog.listActive(), addressed);
            agent = route.agent();
            routing = route.info();
            log.info("Router sent message of user {} to {} ({})", userId, agent.getName(), routing.getReason());
        }

        return sendToAgent(session, agent, message, request.getContext(), routing, selection, client);
    }

    private TutorMessageResponse sendToAgent(TutorSession session, Agent agent, String message, String contextNote,
                                             RoutingInfo routing, ProviderSelection selection, ClientContext client) {
        TutorConversation conversation = conversationStore.getOrCreate(session.getUserId(), agent.getId());
        List<TutorMessage> history = conversationStore.recentHistory(conversation.getId());
        ProviderRequest providerRequest = promptBuilder.build(agent, message, contextNote, history);

        ProviderReply reply;
        try {
            reply = adapterRegistry.forProvider(selection.getProvider()).send(selection, providerRequest);
        } catch (ProviderException e) {
            turnRecorder.recordFailure(session, client, agent, message, e);
            throw e;
        }

        RecordedTurn turn = turnRecorder.record(session, client, List.of(TurnExchange.builder()
                .agent(agent)
                .conversationId(conversation.getId())
                .userText(message)
                .reply(reply)
                .routing(routing)
                .build()));
        RecordedTurn.Exchange recorded = turn.exchanges().get(0);

        return TutorMessageResponse.builder()
                .userMessage(recorded.userMessage())
                .assistantMessage(recorded.assistantMessage())
                .agent(AgentSummary.from(agent))
                .model(reply.getModel())
                .responseTimeMs(reply.getResponseTimeMs())
                .routingInfo(routing)
                .build();
    }
}
