package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.model.agent.Agent;

import java.util.List;

/**
 * Chooses which agent answers an unaddressed message in router mode.
 */
public interface AgentSelector {

    /**
     * @param message    the learner's message
     * @param candidates active agents, never empty
     * @param fallback   agent to use when nothing in the message points elsewhere, may be null
     */
    AgentRoute select(String message, List<Agent> candidates, Agent fallback);
}
