package com.purchasingpower.tutor.service;

import com.google.common.base.Preconditions;
import com.purchasingpower.tutor.exception.ResourceNotFoundException;
import com.purchasingpower.tutor.model.agent.Agent;
import com.purchasingpower.tutor.model.audit.InteractionEventType;
import com.purchasingpower.tutor.model.audit.InteractionLog;
import com.purchasingpower.tutor.model.conversation.MessageRole;
import com.purchasingpower.tutor.model.conversation.TutorMessage;
import com.purchasingpower.tutor.model.dto.ClientContext;
import com.purchasingpower.tutor.model.dto.RoutingInfo;
import com.purchasingpower.tutor.model.session.TutorSession;
import com.purchasingpower.tutor.repository.TutorSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists a finished turn atomically: the session row is locked, the next turn number
 * is allocated, and every exchange gets its user message, assistant message and the
 * MESSAGE_SENT / MESSAGE_RECEIVED audit pair. Either all of it commits or none of it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnRecorder {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final TutorSessionRepository sessionRepository;
    private final ConversationStore conversationStore;
    private final InteractionAuditLogger auditLogger;

    @Transactional
    public RecordedTurn record(TutorSession session, ClientContext client, List<TurnExchange> exchanges) {
        Preconditions.checkArgument(!exchanges.isEmpty(), "a turn needs at least one exchange");

        TutorSession locked = sessionRepository.lockById(session.getId())
                .orElseThrow(() -> new ResourceNotFoundException("Session not found: " + session.getId()));
        int turn = auditLogger.nextTurn(locked.getId());

        List<RecordedTurn.Exchange> recorded = new ArrayList<>();
        for (TurnExchange exchange : exchanges) {
            recorded.add(recordExchange(locked, client, turn, exchange));
        }

        log.info("Recorded turn {} for session {} ({} exchange(s))", turn, locked.getId(), recorded.size());
        return new RecordedTurn(turn, recorded);
    }

    /**
     * Best-effort ERROR row for an exchange whose backend call failed. Nothing else of the
     * turn is persisted.
     */
    public void recordFailure(TutorSession session, ClientContext client, Agent agent, String userText,
                              Throwable error) {
        auditLogger.logBestEffort(InteractionLog.builder()
                .userId(session.getUserId())
                .sessionId(session.getId())
                .eventType(InteractionEventType.ERROR)
                .mode(session.getMode())
                .agentId(agent.getId())
                .agentName(agent.getName())
                .userMessage(userText)
                .errorMessage(truncate(error.getMessage()))
                .userAgent(client.getUserAgent())
                .deviceType(client.getDeviceType())
                .browserName(client.getBrowserName())
                .build());
    }

    private RecordedTurn.Exchange recordExchange(TutorSession session, ClientContext client, int turn,
                                                 TurnExchange exchange) {
        RoutingInfo routing = exchange.getRouting();
        String provider = exchange.getReply().getProvider().getServiceName();
        LocalDateTime sentAt = LocalDateTime.now();

        TutorMessage userMessage = conversationStore.append(TutorMessage.builder()
                .conversationId(exchange.getConversationId())
                .role(MessageRole.USER)
                .content(exchange.getUserText())
                .routingReason(routing != null ? routing.getReason() : null)
                .routingConfidence(routing != null ? routing.getConfidence() : null)
                .createdAt(sentAt)
                .build());

        TutorMessage assistantMessage = conversationStore.append(TutorMessage.builder()
                .conversationId(exchange.getConversationId())
                .role(MessageRole.ASSISTANT)
                .content(exchange.getReply().getReply())
                .model(exchange.getReply().getModel())
                .provider(provider)
                .responseTimeMs(exchange.getReply().getResponseTimeMs())
                .temperature(exchange.getAgent().getTemperature())
                .routingReason(routing != null ? routing.getReason() : null)
                .routingConfidence(routing != null ? routing.getConfidence() : null)
                .createdAt(LocalDateTime.now())
                .build());

        auditLogger.log(auditRow(session, client, turn, exchange, InteractionEventType.MESSAGE_SENT)
                .userMessage(exchange.getUserText())
                .build());
        auditLogger.log(auditRow(session, client, turn, exchange, InteractionEventType.MESSAGE_RECEIVED)
                .assistantResponse(exchange.getReply().getReply())
                .model(exchange.getReply().getModel())
                .provider(provider)
                .responseTimeMs(exchange.getReply().getResponseTimeMs())
                .build());

        return new RecordedTurn.Exchange(exchange.getAgent(), userMessage, assistantMessage);
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }

    private static InteractionLog.InteractionLogBuilder auditRow(TutorSession session, ClientContext client, int turn,
                                                                 TurnExchange exchange, InteractionEventType type) {
        return InteractionLog.builder()
                .userId(session.getUserId())
                .sessionId(session.getId())
                .eventType(type)
                .turn(turn)
                .mode(session.getMode())
                .agentId(exchange.getAgent().getId())
                .agentName(exchange.getAgent().getName())
                .userAgent(client.getUserAgent())
                .deviceType(client.getDeviceType())
                .browserName(client.getBrowserName());
    }
}
