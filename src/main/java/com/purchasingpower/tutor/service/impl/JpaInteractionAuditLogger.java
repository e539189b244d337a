package com.purchasingpower.tutor.service.impl;

import com.google.common.base.Preconditions;
import com.purchasingpower.tutor.configuration.AppProperties;
import com.purchasingpower.tutor.exception.ValidationException;
import com.purchasingpower.tutor.model.audit.InteractionEventType;
import com.purchasingpower.tutor.model.audit.InteractionLog;
import com.purchasingpower.tutor.model.dto.InteractionLogQuery;
import com.purchasingpower.tutor.model.dto.InteractionStats;
import com.purchasingpower.tutor.model.session.TutorMode;
import com.purchasingpower.tutor.repository.InteractionLogRepository;
import com.purchasingpower.tutor.service.InteractionAuditLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaInteractionAuditLogger implements InteractionAuditLogger {

    // Open window bounds used when stats are requested without dates
    private static final LocalDateTime EARLIEST = LocalDateTime.of(1970, 1, 1, 0, 0);
    private static final LocalDateTime LATEST = LocalDateTime.of(9999, 12, 31, 23, 59, 59);

    private static final EnumSet<InteractionEventType> MESSAGE_EVENTS =
            EnumSet.of(InteractionEventType.MESSAGE_SENT, InteractionEventType.MESSAGE_RECEIVED);

    private final InteractionLogRepository logRepository;
    private final AppProperties props;

    @Override
    @Transactional
    public InteractionLog log(InteractionLog entry) {
        Preconditions.checkNotNull(entry.getSessionId(), "sessionId is required");
        Preconditions.checkNotNull(entry.getEventType(), "eventType is required");
        InteractionLog saved = logRepository.save(entry);
        log.debug("Audit {} session={} turn={}", saved.getEventType().getValue(), saved.getSessionId(), saved.getTurn());
        return saved;
    }

    @Override
    public void logBestEffort(InteractionLog entry) {
        try {
            logRepository.save(entry);
        } catch (Exception e) {
            log.error("Failed to write {} audit row for session {}",
                    entry.getEventType(), entry.getSessionId(), e);
        }
    }

    @Override
    @Transactional
    public int nextTurn(Long sessionId) {
        return logRepository.findMaxTurn(sessionId) + 1;
    }

    @Override
    @Transactional(readOnly = true)
    public List<InteractionLog> query(InteractionLogQuery query) {
        int limit = query.getLimit() != null ? query.getLimit() : props.getTutor().getDefaultLogLimit();
        if (limit < 1) {
            throw new ValidationException("limit must be a positive number");
        }
        checkWindow(query.getStartDate(), query.getEndDate());

        List<Specification<InteractionLog>> filters = new ArrayList<>();
        if (query.getUserId() != null) {
            filters.add((root, q, cb) -> cb.equal(root.get("userId"), query.getUserId()));
        }
        if (query.getSessionId() != null) {
            filters.add((root, q, cb) -> cb.equal(root.get("sessionId"), query.getSessionId()));
        }
        if (query.getEventType() != null && !query.getEventType().isBlank()) {
            InteractionEventType type = InteractionEventType.fromValue(query.getEventType())
                    .orElseThrow(() -> new ValidationException("Invalid event type: " + query.getEventType()));
            filters.add((root, q, cb) -> cb.equal(root.get("eventType"), type));
        }
        if (query.getStartDate() != null) {
            filters.add((root, q, cb) -> cb.greaterThanOrEqualTo(root.get("timestamp"), query.getStartDate()));
        }
        if (query.getEndDate() != null) {
            filters.add((root, q, cb) -> cb.lessThanOrEqualTo(root.get("timestamp"), query.getEndDate()));
        }

        PageRequest page = PageRequest.of(0, limit,
                Sort.by(Sort.Direction.DESC, "timestamp").and(Sort.by(Sort.Direction.DESC, "id")));

        List<InteractionLog> rows = logRepository.findAll(Specification.allOf(filters), page).getContent();
        log.debug("Interaction log query {} returned {} rows", query, rows.size());
        return rows;
    }

    @Override
    @Transactional(readOnly = true)
    public InteractionStats stats(LocalDateTime startDate, LocalDateTime endDate) {
        checkWindow(startDate, endDate);
        LocalDateTime start = startDate != null ? startDate : EARLIEST;
        LocalDateTime end = endDate != null ? endDate : LATEST;

        Double avg = logRepository.averageResponseTime(InteractionEventType.MESSAGE_RECEIVED, start, end);

        return InteractionStats.builder()
                .totalSessions(logRepository.countDistinctSessions(start, end))
                .totalMessages(logRepository.countByTypes(MESSAGE_EVENTS, start, end))
                .averageResponseTime(avg != null ? avg : 0.0)
                .activeUsers(logRepository.countDistinctUsers(start, end))
                .messagesByMode(byMode(start, end))
                .messagesByAgent(byAgent(start, end))
                .startDate(startDate)
                .endDate(endDate)
                .build();
    }

    private Map<String, Long> byMode(LocalDateTime start, LocalDateTime end) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object[] row : logRepository.countByModeGrouped(InteractionEventType.MESSAGE_RECEIVED, start, end)) {
            String key = row[0] != null ? ((TutorMode) row[0]).getValue() : "unknown";
            counts.merge(key, ((Number) row[1]).longValue(), Long::sum);
        }
        return counts;
    }

    private Map<String, Long> byAgent(LocalDateTime start, LocalDateTime end) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object[] row : logRepository.countByAgentGrouped(InteractionEventType.MESSAGE_RECEIVED, start, end)) {
            String key = row[0] != null ? (String) row[0] : "unknown";
            counts.merge(key, ((Number) row[1]).longValue(), Long::sum);
        }
        return counts;
    }

    private static void checkWindow(LocalDateTime startDate, LocalDateTime endDate) {
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new ValidationException("startDate must not be after endDate");
        }
    }
}
