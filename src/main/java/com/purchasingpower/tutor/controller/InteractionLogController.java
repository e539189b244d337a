package com.purchasingpower.tutor.controller;

import com.purchasingpower.tutor.model.audit.InteractionLog;
import com.purchasingpower.tutor.model.dto.ApiResponse;
import com.purchasingpower.tutor.model.dto.InteractionLogQuery;
import com.purchasingpower.tutor.model.dto.InteractionStats;
import com.purchasingpower.tutor.service.InteractionAuditLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Admin-only reporting over the interaction audit trail. Access is checked by
 * {@link com.purchasingpower.tutor.configuration.AdminAccessInterceptor} before any parameter binding.
 *
 * Endpoints:
 * - GET /api/tutors/logs        - filtered rows (userId, sessionId, eventType, startDate, endDate, limit)
 * - GET /api/tutors/logs/stats  - aggregates over an optional date window
 */
@Slf4j
@RestController
@RequestMapping("/api/tutors/logs")
@RequiredArgsConstructor
public class InteractionLogController {

    private final InteractionAuditLogger auditLogger;

    @GetMapping
    public ResponseEntity<ApiResponse<List<InteractionLog>>> getLogs(
            @ModelAttribute InteractionLogQuery query) {

        log.debug("Interaction log query: {}", query);
        return ResponseEntity.ok(ApiResponse.ok(auditLogger.query(query)));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<InteractionStats>> getStats(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate) {

        return ResponseEntity.ok(ApiResponse.ok(auditLogger.stats(startDate, endDate)));
    }
}
