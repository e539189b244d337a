package com.purchasingpower.tutor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-request fan-out instruction. Its presence alone triggers collaboration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollaborativeSettings {

    public static final String STYLE_PARALLEL = "parallel";

    private String style;

    private Integer maxAgents;

    /**
     * Explicit participants besides the addressed agent. When empty, other active agents are used.
     */
    private List<Long> agentIds;
}
