package com.purchasingpower.tutor.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDateTime;

/**
 * Filters for the admin log listing; every non-null field narrows the result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionLogQuery {

    private Long userId;
    private Long sessionId;
    private String eventType;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
    private LocalDateTime startDate;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
    private LocalDateTime endDate;

    private Integer limit;
}
