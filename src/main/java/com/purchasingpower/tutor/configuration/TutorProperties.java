package com.purchasingpower.tutor.configuration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class TutorProperties {

    /**
     * Number of most recent stored messages sent to the provider as context.
     */
    @Min(1)
    @Max(200)
    private int historyWindow = 20;

    /**
     * Row cap applied to interaction log queries when the caller gives none.
     */
    @Min(1)
    private int defaultLogLimit = 100;

    /**
     * Upper bound for collaborativeSettings.maxAgents.
     */
    @Min(1)
    @Max(10)
    private int maxCollaboratingAgents = 5;

    private RouterProperties router = new RouterProperties();

    @Data
    public static class RouterProperties {

        /**
         * Agent name to trigger keywords, evaluated in insertion order.
         */
        private Map<String, List<String>> keywords = new LinkedHashMap<>();
    }
}
