package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.client.ProviderReply;
import com.purchasingpower.tutor.model.agent.Agent;
import com.purchasingpower.tutor.model.dto.RoutingInfo;
import lombok.Builder;
import lombok.Value;

/**
 * One agent's completed exchange, ready to be persisted.
 */
@Value
@Builder
public class TurnExchange {

    Agent agent;

    Long conversationId;

    String userText;

    ProviderReply reply;

    /** Null outside router mode. */
    RoutingInfo routing;
}
