package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.model.dto.ClientContext;
import com.purchasingpower.tutor.model.dto.SendMessageRequest;
import com.purchasingpower.tutor.model.dto.TutorMessageResponse;

/**
 * Entry point of a learner message: agent resolution, provider dispatch and turn recording.
 */
public interface TutorMessagingService {

    /**
     * @param agentId the agent the message is addressed to; in router mode the
     *                selector may hand the turn to another agent
     * @throws com.purchasingpower.tutor.exception.ValidationException     blank message or bad collaboration settings
     * @throws com.purchasingpower.tutor.exception.ResourceNotFoundException unknown or inactive agent
     * @throws com.purchasingpower.tutor.exception.ConfigurationException  no provider configured
     * @throws com.purchasingpower.tutor.exception.ProviderException       the backend call failed
     */
    TutorMessageResponse sendMessage(Long userId, Long agentId, SendMessageRequest request, ClientContext client);
}
