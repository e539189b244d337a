package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.client.ProviderAdapter;
import com.purchasingpower.tutor.client.ProviderAdapterRegistry;
import com.purchasingpower.tutor.client.ProviderReply;
import com.purchasingpower.tutor.client.ProviderRequest;
import com.purchasingpower.tutor.configuration.AppProperties;
import com.purchasingpower.tutor.exception.ProviderException;
import com.purchasingpower.tutor.exception.ValidationException;
import com.purchasingpower.tutor.model.agent.Agent;
import com.purchasingpower.tutor.model.conversation.TutorConversation;
import com.purchasingpower.tutor.model.conversation.TutorMessage;
import com.purchasingpower.tutor.model.dto.AgentContribution;
import com.purchasingpower.tutor.model.dto.AgentSummary;
import com.purchasingpower.tutor.model.dto.ClientContext;
import com.purchasingpower.tutor.model.dto.CollaborativeInfo;
import com.purchasingpower.tutor.model.dto.CollaborativeSettings;
import com.purchasingpower.tutor.model.dto.FailedAgent;
import com.purchasingpower.tutor.model.dto.TutorMessageResponse;
import com.purchasingpower.tutor.model.provider.ProviderSelection;
import com.purchasingpower.tutor.model.session.TutorSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Fans one learner message out to several agents at once and joins on all of them.
 *
 * <p>Each participant answers from its own conversation history. A failing participant is
 * reported in {@link CollaborativeInfo#getFailed()} and leaves its conversation untouched;
 * the request fails only when every participant failed. Succeeded exchanges are recorded
 * as one turn.
 */
@Slf4j
@Service
public class MultiAgentCollaborationEngine {

    private final AgentCatalogService agentCatalog;
    private final ConversationStore conversationStore;
    private final TutorPromptBuilder promptBuilder;
    private final ProviderAdapterRegistry adapterRegistry;
    private final TurnRecorder turnRecorder;
    private final ResponseComposer responseComposer;
    private final AppProperties props;
    private final Executor collaborationExecutor;

    public MultiAgentCollaborationEngine(AgentCatalogService agentCatalog,
                                         ConversationStore conversationStore,
                                         TutorPromptBuilder promptBuilder,
                                         ProviderAdapterRegistry adapterRegistry,
                                         TurnRecorder turnRecorder,
                                         ResponseComposer responseComposer,
                                         AppProperties props,
                                         @Qualifier("collaborationExecutor") Executor collaborationExecutor) {
        this.agentCatalog = agentCatalog;
        this.conversationStore = conversationStore;
        this.promptBuilder = promptBuilder;
        this.adapterRegistry = adapterRegistry;
        this.turnRecorder = turnRecorder;
        this.responseComposer = responseComposer;
        this.props = props;
        this.collaborationExecutor = collaborationExecutor;
    }

    /**
     * @throws ValidationException for an unknown style or a maxAgents outside 1..app.tutor.max-collaborating-agents
     */
    public void validate(CollaborativeSettings settings) {
        if (!CollaborativeSettings.STYLE_PARALLEL.equals(settings.getStyle())) {
            throw new ValidationException("Invalid collaboration style. Must be 'parallel'");
        }
        int limit = props.getTutor().getMaxCollaboratingAgents();
        if (settings.getMaxAgents() == null || settings.getMaxAgents() < 1 || settings.getMaxAgents() > limit) {
            throw new ValidationException("maxAgents must be between 1 and " + limit);
        }
    }

    /**
     * Addressed agent first, then the requested agents (or every other active agent by name),
     * distinct, capped at maxAgents.
     */
    public List<Agent> selectParticipants(Agent addressed, CollaborativeSettings settings) {
        List<Agent> pool = settings.getAgentIds() != null && !settings.getAgentIds().isEmpty()
                ? agentCatalog.findActive(settings.getAgentIds())
                : agentCatalog.listActive();

        Map<Long, Agent> participants = new LinkedHashMap<>();
        participants.put(addressed.getId(), addressed);
        for (Agent agent : pool) {
            if (participants.size() >= settings.getMaxAgents()) {
                break;
            }
            participants.putIfAbsent(agent.getId(), agent);
        }
        return new ArrayList<>(participants.values());
    }

    public TutorMessageResponse collaborate(TutorSession session,
                                            Agent addressed,
                                            String message,
                                            String contextNote,
                                            CollaborativeSettings settings,
                                            ProviderSelection selection,
                                            ClientContext client) {
        List<Agent> participants = selectParticipants(addressed, settings);
        log.info("Collaboration for session {}: style={}, agents={}", session.getId(), settings.getStyle(),
                participants.stream().map(Agent::getName).collect(Collectors.joining(", ")));

        ProviderAdapter adapter = adapterRegistry.forProvider(selection.getProvider());
        List<Dispatch> dispatches = new ArrayList<>();
        for (Agent agent : participants) {
            TutorConversation conversation = conversationStore.getOrCreate(session.getUserId(), agent.getId());
            List<TutorMessage> history = conversationStore.recentHistory(conversation.getId());
            ProviderRequest request = promptBuilder.buildCollaborative(agent, message, contextNote, history);
            dispatches.add(new Dispatch(agent, conversation.getId(), submit(adapter, selection, request)));
        }

        List<TurnExchange> exchanges = new ArrayList<>();
        List<FailedAgent> failed = new ArrayList<>();
        Throwable firstFailure = null;
        for (Dispatch dispatch : dispatches) {
            try {
                ProviderReply reply = dispatch.future().join();
                exchanges.add(TurnExchange.builder()
                        .agent(dispatch.agent())
                        .conversationId(dispatch.conversationId())
                        .userText(message)
                        .reply(reply)
                        .build());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                firstFailure = firstFailure != null ? firstFailure : cause;
                log.warn("Agent {} failed in collaboration: {}", dispatch.agent().getName(), cause.getMessage());
                failed.add(FailedAgent.builder()
                        .agentId(dispatch.agent().getId())
                        .agentName(dispatch.agent().getName())
                        .error(cause.getMessage())
                        .build());
                turnRecorder.recordFailure(session, client, dispatch.agent(), message, cause);
            }
        }

        if (exchanges.isEmpty()) {
            String reasons = failed.stream()
                    .map(agent -> agent.getAgentName() + ": " + agent.getError())
                    .collect(Collectors.joining("; "));
            throw new ProviderException(selection.getProvider().getServiceName(), null,
                    "All collaborating agents failed: " + reasons, firstFailure);
        }

        RecordedTurn turn = turnRecorder.record(session, client, exchanges);

        List<AgentContribution> contributions = new ArrayList<>();
        for (int i = 0; i < exchanges.size(); i++) {
            ProviderReply reply = exchanges.get(i).getReply();
            RecordedTurn.Exchange recorded = turn.exchanges().get(i);
            contributions.add(AgentContribution.builder()
                    .agentId(recorded.agent().getId())
                    .agentName(recorded.agent().getName())
                    .displayName(recorded.agent().getDisplayName())
                    .reply(reply.getReply())
                    .model(reply.getModel())
                    .responseTimeMs(reply.getResponseTimeMs())
                    .assistantMessageId(recorded.assistantMessage().getId())
                    .build());
        }

        int primaryIndex = primaryIndex(turn, addressed);
        RecordedTurn.Exchange primary = turn.exchanges().get(primaryIndex);
        ProviderReply primaryReply = exchanges.get(primaryIndex).getReply();

        CollaborativeInfo info = CollaborativeInfo.builder()
                .style(settings.getStyle())
                .requestedAgents(participants.size())
                .participants(contributions)
                .failed(failed)
                .composedResponse(responseComposer.compose(contributions))
                .build();

        log.info("Collaboration turn {} finished: {} succeeded, {} failed", turn.turn(), contributions.size(),
                failed.size());

        return TutorMessageResponse.builder()
                .userMessage(primary.userMessage())
                .assistantMessage(primary.assistantMessage())
                .agent(AgentSummary.from(primary.agent()))
                .model(primaryReply.getModel())
                .responseTimeMs(primaryReply.getResponseTimeMs())
                .collaborativeInfo(info)
                .build();
    }

    private CompletableFuture<ProviderReply> submit(ProviderAdapter adapter, ProviderSelection selection,
                                                    ProviderRequest request) {
        try {
            return CompletableFuture.supplyAsync(() -> adapter.send(selection, request), collaborationExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * The addressed agent's exchange when it succeeded, otherwise the first success.
     */
    private static int primaryIndex(RecordedTurn turn, Agent addressed) {
        for (int i = 0; i < turn.exchanges().size(); i++) {
            if (turn.exchanges().get(i).agent().getId().equals(addressed.getId())) {
                return i;
            }
        }
        return 0;
    }

    private record Dispatch(Agent agent, Long conversationId, CompletableFuture<ProviderReply> future) {
    }
}
