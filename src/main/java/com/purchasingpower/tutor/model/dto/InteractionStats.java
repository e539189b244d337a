package com.purchasingpower.tutor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionStats {

    private long totalSessions;
    private long totalMessages;

    /**
     * Mean assistant reply latency in ms, 0 when no reply is in the window.
     */
    private double averageResponseTime;

    private long activeUsers;

    @Builder.Default
    private Map<String, Long> messagesByMode = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Long> messagesByAgent = new LinkedHashMap<>();

    private LocalDateTime startDate;
    private LocalDateTime endDate;
}
