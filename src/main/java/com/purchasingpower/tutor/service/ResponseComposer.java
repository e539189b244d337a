package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.model.dto.AgentContribution;

import java.util.List;

/**
 * Turns the replies of a fan-out into one caller-facing text.
 */
public interface ResponseComposer {

    String compose(List<AgentContribution> contributions);
}
