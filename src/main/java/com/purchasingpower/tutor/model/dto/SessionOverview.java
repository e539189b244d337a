package com.purchasingpower.tutor.model.dto;

import com.purchasingpower.tutor.model.session.TutorSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a tutoring page needs on load.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionOverview {

    private TutorSession session;

    @Builder.Default
    private List<ConversationSummary> conversations = new ArrayList<>();

    @Builder.Default
    private List<AgentSummary> agents = new ArrayList<>();
}
