package com.purchasingpower.tutor.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.tutor.configuration.AppProperties;
import com.purchasingpower.tutor.model.agent.Agent;
import com.purchasingpower.tutor.model.dto.RoutingInfo;
import com.purchasingpower.tutor.service.AgentRoute;
import com.purchasingpower.tutor.service.AgentSelector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Routes on {@code app.tutor.router.keywords}: the first configured agent (in configuration order)
 * that is active and has a keyword contained in the message wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeywordAgentSelector implements AgentSelector {

    static final double KEYWORD_CONFIDENCE = 0.8;
    static final double FALLBACK_CONFIDENCE = 0.5;

    private static final int MAX_ALTERNATIVES = 3;

    private final AppProperties props;

    @Override
    public AgentRoute select(String message, List<Agent> candidates, Agent fallback) {
        Preconditions.checkArgument(!candidates.isEmpty(), "no candidate agents");
        String text = message.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, List<String>> entry : props.getTutor().getRouter().getKeywords().entrySet()) {
            Optional<Agent> agent = candidates.stream()
                    .filter(candidate -> candidate.getName().equals(entry.getKey()))
                    .findFirst();
            if (agent.isEmpty()) {
                continue;
            }
            for (String keyword : entry.getValue()) {
                if (text.contains(keyword.toLowerCase(Locale.ROOT))) {
                    log.debug("Router matched keyword '{}' -> {}", keyword, agent.get().getName());
                    return route(agent.get(), "Matched keyword '" + keyword + "' for " + agent.get().getDisplayName(),
                            KEYWORD_CONFIDENCE, candidates);
                }
            }
        }

        Agent chosen = fallback != null ? fallback : candidates.get(0);
        return route(chosen, "Default selection", FALLBACK_CONFIDENCE, candidates);
    }

    private AgentRoute route(Agent agent, String reason, double confidence, List<Agent> candidates) {
        List<String> alternatives = candidates.stream()
                .filter(candidate -> !candidate.getId().equals(agent.getId()))
                .map(Agent::getName)
                .limit(MAX_ALTERNATIVES)
                .toList();

        RoutingInfo info = RoutingInfo.builder()
                .selectedAgentId(agent.getId())
                .selectedAgent(agent.getName())
                .reason(reason)
                .confidence(confidence)
                .alternatives(alternatives)
                .build();
        return new AgentRoute(agent, info);
    }
}
