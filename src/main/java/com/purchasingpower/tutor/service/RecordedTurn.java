package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.model.agent.Agent;
import com.purchasingpower.tutor.model.conversation.TutorMessage;

import java.util.List;

public record RecordedTurn(int turn, List<Exchange> exchanges) {

    public record Exchange(Agent agent, TutorMessage userMessage, TutorMessage assistantMessage) {
    }
}
