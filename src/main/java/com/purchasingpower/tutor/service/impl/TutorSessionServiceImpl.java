package com.purchasingpower.tutor.service.impl;

import com.purchasingpower.tutor.exception.ValidationException;
import com.purchasingpower.tutor.model.agent.Agent;
import com.purchasingpower.tutor.model.audit.InteractionEventType;
import com.purchasingpower.tutor.model.audit.InteractionLog;
import com.purchasingpower.tutor.model.dto.ClientContext;
import com.purchasingpower.tutor.model.dto.SessionOverview;
import com.purchasingpower.tutor.model.session.TutorMode;
import com.purchasingpower.tutor.model.session.TutorSession;
import com.purchasingpower.tutor.repository.TutorSessionRepository;
import com.purchasingpower.tutor.service.AgentCatalogService;
import com.purchasingpower.tutor.service.InteractionAuditLogger;
import com.purchasingpower.tutor.service.TutorConversationService;
import com.purchasingpower.tutor.service.TutorSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TutorSessionServiceImpl implements TutorSessionService {

    private final TutorSessionRepository sessionRepository;
    private final AgentCatalogService agentCatalog;
    private final TutorConversationService conversationService;
    private final InteractionAuditLogger auditLogger;

    @Override
    public TutorSession getOrCreateSession(Long userId, ClientContext client) {
        return sessionRepository.findByUserId(userId)
                .orElseGet(() -> createSession(userId, client));
    }

    private TutorSession createSession(Long userId, ClientContext client) {
        TutorSession session;
        try {
            session = sessionRepository.saveAndFlush(TutorSession.builder()
                    .userId(userId)
                    .mode(TutorMode.MANUAL)
                    .build());
        } catch (DataIntegrityViolationException e) {
            log.debug("Session for user {} created concurrently, reloading", userId);
            return sessionRepository.findByUserId(userId).orElseThrow(() -> e);
        }

        log.info("Created tutor session {} for user {}", session.getId(), userId);
        auditLogger.logBestEffort(event(session, InteractionEventType.SESSION_START, client).build());
        return session;
    }

    @Override
    public SessionOverview getOverview(Long userId, ClientContext client) {
        TutorSession session = getOrCreateSession(userId, client);
        return SessionOverview.builder()
                .session(session)
                .conversations(conversationService.listConversations(userId))
                .agents(agentCatalog.listSummaries())
                .build();
    }

    @Override
    public TutorSession updateMode(Long userId, String mode, ClientContext client) {
        TutorMode newMode = TutorMode.fromValue(mode)
                .orElseThrow(() -> new ValidationException("Invalid mode. Must be 'manual' or 'router'"));

        TutorSession session = getOrCreateSession(userId, client);
        TutorMode previous = session.getMode();
        session.setMode(newMode);
        session = sessionRepository.save(session);

        log.info("User {} switched tutor mode {} -> {}", userId, previous.getValue(), newMode.getValue());
        auditLogger.logBestEffort(event(session, InteractionEventType.MODE_CHANGE, client).build());
        return session;
    }

    @Override
    public TutorSession setActiveAgent(Long userId, Long agentId, ClientContext client) {
        if (agentId == null) {
            throw new ValidationException("agentId is required");
        }
        Agent agent = agentCatalog.requireActive(agentId);

        TutorSession session = getOrCreateSession(userId, client);
        session.setActiveAgentId(agent.getId());
        session = sessionRepository.save(session);

        log.info("User {} switched active agent to {} ({})", userId, agent.getName(), agent.getId());
        auditLogger.logBestEffort(event(session, InteractionEventType.AGENT_SWITCH, client)
                .agentId(agent.getId())
                .agentName(agent.getName())
                .build());
        return session;
    }

    private static InteractionLog.InteractionLogBuilder event(TutorSession session, InteractionEventType type,
                                                              ClientContext client) {
        return InteractionLog.builder()
                .userId(session.getUserId())
                .sessionId(session.getId())
                .eventType(type)
                .mode(session.getMode())
                .userAgent(client.getUserAgent())
                .deviceType(client.getDeviceType())
                .browserName(client.getBrowserName());
    }
}
