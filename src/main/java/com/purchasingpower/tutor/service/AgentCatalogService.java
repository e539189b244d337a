package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.exception.ResourceNotFoundException;
import com.purchasingpower.tutor.model.agent.Agent;
import com.purchasingpower.tutor.model.dto.AgentSummary;
import com.purchasingpower.tutor.repository.AgentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only view over the agents that learners may talk to.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AgentCatalogService {

    private final AgentRepository agentRepository;

    public List<Agent> listActive() {
        return agentRepository.findByActiveTrueOrderByNameAsc();
    }

    public List<AgentSummary> listSummaries() {
        return listActive().stream()
                .map(AgentSummary::from)
                .toList();
    }

    /**
     * @throws ResourceNotFoundException when the agent does not exist or is inactive
     */
    public Agent requireActive(Long agentId) {
        return agentRepository.findByIdAndActiveTrue(agentId)
                .orElseThrow(() -> new ResourceNotFoundException("Agent not found or inactive: " + agentId));
    }

    /**
     * Active agents among {@code ids}, in the order given. Unknown and inactive ids are dropped.
     */
    public List<Agent> findActive(List<Long> ids) {
        Map<Long, Agent> byId = agentRepository.findByIdInAndActiveTrue(ids).stream()
                .collect(Collectors.toMap(Agent::getId, Function.identity()));
        return ids.stream()
                .distinct()
                .map(byId::get)
                .filter(Objects::nonNull)
                .toList();
    }
}
