package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.model.agent.Agent;
import com.purchasingpower.tutor.model.dto.RoutingInfo;

/**
 * Agent chosen for a router-mode turn and the explanation returned to the caller.
 */
public record AgentRoute(Agent agent, RoutingInfo info) {
}
