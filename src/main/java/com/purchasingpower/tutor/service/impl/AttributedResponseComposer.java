package com.purchasingpower.tutor.service.impl;

import com.purchasingpower.tutor.model.dto.AgentContribution;
import com.purchasingpower.tutor.service.ResponseComposer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps every reply verbatim under its agent's name, separated by horizontal rules.
 */
@Component
public class AttributedResponseComposer implements ResponseComposer {

    static final String SEPARATOR = "\n\n---\n\n";

    @Override
    public String compose(List<AgentContribution> contributions) {
        return contributions.stream()
                .map(contribution -> "**" + contribution.getDisplayName() + "**:\n" + contribution.getReply())
                .collect(Collectors.joining(SEPARATOR));
    }
}
