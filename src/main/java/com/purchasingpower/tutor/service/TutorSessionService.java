package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.model.dto.ClientContext;
import com.purchasingpower.tutor.model.dto.SessionOverview;
import com.purchasingpower.tutor.model.session.TutorSession;

/**
 * Per-user tutoring session: the mode and the active agent pointer.
 */
public interface TutorSessionService {

    /**
     * Idempotent. A new session starts in manual mode with no active agent.
     */
    TutorSession getOrCreateSession(Long userId, ClientContext client);

    /**
     * Session plus the user's conversations (newest activity first) and the active agents.
     */
    SessionOverview getOverview(Long userId, ClientContext client);

    /**
     * @throws com.purchasingpower.tutor.exception.ValidationException for anything but manual or router
     */
    TutorSession updateMode(Long userId, String mode, ClientContext client);

    /**
     * @throws com.purchasingpower.tutor.exception.ValidationException when agentId is missing
     * @throws com.purchasingpower.tutor.exception.ResourceNotFoundException when the agent is unknown or inactive
     */
    TutorSession setActiveAgent(Long userId, Long agentId, ClientContext client);
}
