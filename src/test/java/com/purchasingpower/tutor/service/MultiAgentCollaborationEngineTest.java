package com.purchasingpower.tutor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.tutor.client.ProviderAdapter;
import com.purchasingpower.tutor.client.ProviderAdapterRegistry;
import com.purchasingpower.tutor.client.ProviderReply;
import com.purchasingpower.tutor.client.ProviderRequest;
import com.purchasingpower.tutor.configuration.AppProperties;
import com.purchasingpower.tutor.exception.ProviderException;
import com.purchasingpower.tutor.exception.ValidationException;
import com.purchasingpower.tutor.model.agent.Agent;
import com.purchasingpower.tutor.model.conversation.MessageRole;
import com.purchasingpower.tutor.model.conversation.TutorConversation;
import com.purchasingpower.tutor.model.conversation.TutorMessage;
import com.purchasingpower.tutor.model.dto.ClientContext;
import com.purchasingpower.tutor.model.dto.CollaborativeSettings;
import com.purchasingpower.tutor.model.dto.TutorMessageResponse;
import com.purchasingpower.tutor.model.provider.ProviderSelection;
import com.purchasingpower.tutor.model.provider.ProviderType;
import com.purchasingpower.tutor.model.session.TutorMode;
import com.purchasingpower.tutor.model.session.TutorSession;
import com.purchasingpower.tutor.service.impl.AttributedResponseComposer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Multi-agent collaboration")
class MultiAgentCollaborationEngineTest {

    private static final ClientContext CLIENT = ClientContext.unknown();
    private static final ProviderSelection SELECTION = ProviderSelection.builder()
            .provider(ProviderType.OPENAI)
            .apiKey("k")
            .model("gpt-4o-mini")
            .source(ProviderSelection.Source.ENVIRONMENT)
            .build();

    private final Agent agentA = agent(1L, "agent-a", "Agent A");
    private final Agent agentB = agent(2L, "agent-b", "Agent B");
    private final Agent agentC = agent(3L, "agent-c", "Agent C");
    private final TutorSession session = TutorSession.builder().id(10L).userId(7L).mode(TutorMode.MANUAL).build();

    private AgentCatalogService catalog;
    private ConversationStore store;
    private TurnRecorder turnRecorder;
    private ProviderAdapter adapter;
    private MultiAgentCollaborationEngine engine;

    @BeforeEach
    void setUp() {
        catalog = mock(AgentCatalogService.class);
        store = mock(ConversationStore.class);
        turnRecorder = mock(TurnRecorder.class);
        adapter = mock(ProviderAdapter.class);
        when(adapter.getType()).thenReturn(ProviderType.OPENAI);

        engine = new MultiAgentCollaborationEngine(catalog, store, new TutorPromptBuilder(new ObjectMapper()),
                new ProviderAdapterRegistry(List.of(adapter)), turnRecorder, new AttributedResponseComposer(),
                new AppProperties(), Runnable::run);

        when(catalog.listActive()).thenReturn(List.of(agentA, agentB, agentC));
        when(store.getOrCreate(eq(7L), anyLong())).thenAnswer(inv -> TutorConversation.builder()
                .id(100L + (Long) inv.getArgument(1))
                .userId(7L)
                .agentId(inv.getArgument(1))
                .build());
        when(store.recentHistory(anyLong())).thenReturn(List.of());

        AtomicLong ids = new AtomicLong();
        when(turnRecorder.record(any(), any(), anyList())).thenAnswer(inv -> {
            List<TurnExchange> exchanges = inv.getArgument(2);
            List<RecordedTurn.Exchange> recorded = new ArrayList<>();
            for (TurnExchange exchange : exchanges) {
                recorded.add(new RecordedTurn.Exchange(exchange.getAgent(),
                        message(ids.incrementAndGet(), MessageRole.USER, exchange.getUserText()),
                        message(ids.incrementAndGet(), MessageRole.ASSISTANT, exchange.getReply().getReply())));
            }
            return new RecordedTurn(1, recorded);
        });
    }

    @Test
    @DisplayName("One failing agent is reported while the others still answer")
    void collaborate_PartialFailure_ShouldReportFailedAgent() {
        // Given
        when(adapter.send(eq(SELECTION), any(ProviderRequest.class))).thenAnswer(inv -> {
            ProviderRequest request = inv.getArgument(1);
            if (request.getSystemPrompt().startsWith("Persona agent-b")) {
                throw new ProviderException("openai", 500, "upstream exploded", null);
            }
            return reply(request.getSystemPrompt().startsWith("Persona agent-a") ? "From A" : "From C");
        });

        // When
        TutorMessageResponse response = engine.collaborate(session, agentA, "What is recursion?", null,
                settings(3, null), SELECTION, CLIENT);

        // Then
        assertThat(response.getCollaborativeInfo().getParticipants())
                .extracting("agentName")
                .containsExactly("agent-a", "agent-c");
        assertThat(response.getCollaborativeInfo().getFailed())
                .singleElement()
                .satisfies(failed -> {
                    assertThat(failed.getAgentName()).isEqualTo("agent-b");
                    assertThat(failed.getError()).contains("upstream exploded");
                });
        assertThat(response.getCollaborativeInfo().getRequestedAgents()).isEqualTo(3);
        assertThat(response.getCollaborativeInfo().getComposedResponse())
                .isEqualTo("**Agent A**:\nFrom A\n\n---\n\n**Agent C**:\nFrom C");
        assertThat(response.getAgent().getName()).isEqualTo("agent-a");
        assertThat(response.getAssistantMessage().getContent()).isEqualTo("From A");
        verify(turnRecorder).recordFailure(eq(session), eq(CLIENT), eq(agentB), eq("What is recursion?"), any());
    }

    @Test
    @DisplayName("Addressed agent failing promotes the first success to primary")
    void collaborate_AddressedFails_ShouldPromoteFirstSuccess() {
        when(adapter.send(eq(SELECTION), any(ProviderRequest.class))).thenAnswer(inv -> {
            ProviderRequest request = inv.getArgument(1);
            if (request.getSystemPrompt().startsWith("Persona agent-a")) {
                throw new ProviderException("openai", "timeout");
            }
            return reply("From B");
        });

        TutorMessageResponse response = engine.collaborate(session, agentA, "hi", null,
                settings(2, null), SELECTION, CLIENT);

        assertThat(response.getAgent().getName()).isEqualTo("agent-b");
        assertThat(response.getAssistantMessage().getContent()).isEqualTo("From B");
    }

    @Test
    @DisplayName("Every agent failing fails the request and records nothing")
    void collaborate_AllFail_ShouldThrow() {
        when(adapter.send(eq(SELECTION), any(ProviderRequest.class)))
                .thenThrow(new ProviderException("openai", "down"));

        assertThatThrownBy(() -> engine.collaborate(session, agentA, "hi", null,
                settings(2, null), SELECTION, CLIENT))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("All collaborating agents failed");
        verify(turnRecorder, never()).record(any(), any(), anyList());
        verify(turnRecorder, times(2)).recordFailure(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Participants keep the addressed agent first and respect maxAgents")
    void selectParticipants_ShouldPutAddressedFirst() {
        when(catalog.findActive(List.of(3L, 2L))).thenReturn(List.of(agentC, agentB));

        assertThat(engine.selectParticipants(agentB, settings(2, null)))
                .extracting(Agent::getName)
                .containsExactly("agent-b", "agent-a");
        assertThat(engine.selectParticipants(agentA, settings(5, List.of(3L, 2L))))
                .extracting(Agent::getName)
                .containsExactly("agent-a", "agent-c", "agent-b");
        assertThat(engine.selectParticipants(agentA, settings(1, null)))
                .extracting(Agent::getName)
                .containsExactly("agent-a");
    }

    @Test
    @DisplayName("Unknown style and out-of-range maxAgents are rejected")
    void validate_ShouldRejectBadSettings() {
        assertThatThrownBy(() -> engine.validate(CollaborativeSettings.builder().style("debate").maxAgents(2).build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> engine.validate(settings(0, null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> engine.validate(settings(6, null)))
                .isInstanceOf(ValidationException.class);
        engine.validate(settings(5, null));
    }

    private static CollaborativeSettings settings(int maxAgents, List<Long> agentIds) {
        return CollaborativeSettings.builder()
                .style(CollaborativeSettings.STYLE_PARALLEL)
                .maxAgents(maxAgents)
                .agentIds(agentIds)
                .build();
    }

    private static Agent agent(Long id, String name, String displayName) {
        return Agent.builder()
                .id(id)
                .name(name)
                .displayName(displayName)
                .systemPrompt("Persona " + name)
                .active(true)
                .build();
    }

    private static ProviderReply reply(String text) {
        return ProviderReply.builder()
                .reply(text)
                .model("gpt-4o-mini")
                .provider(ProviderType.OPENAI)
                .responseTimeMs(12)
                .build();
    }

    private static TutorMessage message(long id, MessageRole role, String content) {
        return TutorMessage.builder().id(id).conversationId(101L).role(role).content(content).build();
    }
}
