package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.model.audit.InteractionLog;
import com.purchasingpower.tutor.model.dto.InteractionLogQuery;
import com.purchasingpower.tutor.model.dto.InteractionStats;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Append-only audit trail of tutoring interactions plus its admin read side.
 */
public interface InteractionAuditLogger {

    /**
     * Appends one row, joining the caller's transaction. Failures propagate.
     */
    InteractionLog log(InteractionLog entry);

    /**
     * Appends one row outside any turn. Failures are logged and swallowed.
     */
    void logBestEffort(InteractionLog entry);

    /**
     * Highest turn recorded for the session plus one. Callers hold the session lock.
     */
    int nextTurn(Long sessionId);

    /**
     * Rows matching every supplied filter, newest first, capped at the query limit
     * (default from {@code app.tutor.default-log-limit}).
     */
    List<InteractionLog> query(InteractionLogQuery query);

    /**
     * Aggregates over the window; a null bound leaves that side open.
     */
    InteractionStats stats(LocalDateTime startDate, LocalDateTime endDate);
}
