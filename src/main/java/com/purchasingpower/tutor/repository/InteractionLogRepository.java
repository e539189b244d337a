package com.purchasingpower.tutor.repository;

import com.purchasingpower.tutor.model.audit.InteractionEventType;
import com.purchasingpower.tutor.model.audit.InteractionLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Audit trail storage. Filtered listing goes through {@link JpaSpecificationExecutor};
 * the aggregates below back the admin statistics endpoint.
 */
@Repository
public interface InteractionLogRepository extends JpaRepository<InteractionLog, Long>,
        JpaSpecificationExecutor<InteractionLog> {

    /**
     * Highest turn recorded for a session, 0 when none.
     */
    @Query("SELECT COALESCE(MAX(l.turn), 0) FROM InteractionLog l WHERE l.sessionId = :sessionId")
    int findMaxTurn(@Param("sessionId") Long sessionId);

    List<InteractionLog> findBySessionIdOrderByIdAsc(Long sessionId);

    /**
     * Count distinct sessions in window
     */
    @Query("SELECT COUNT(DISTINCT l.sessionId) FROM InteractionLog l WHERE l.timestamp BETWEEN :start AND :end")
    long countDistinctSessions(@Param("start") LocalDateTime start, @Param("end") LocalDateTime end);

    /**
     * Count distinct users in window
     */
    @Query("SELECT COUNT(DISTINCT l.userId) FROM InteractionLog l WHERE l.timestamp BETWEEN :start AND :end")
    long countDistinctUsers(@Param("start") LocalDateTime start, @Param("end") LocalDateTime end);

    @Query("SELECT COUNT(l) FROM InteractionLog l WHERE l.eventType IN :types AND l.timestamp BETWEEN :start AND :end")
    long countByTypes(@Param("types") Collection<InteractionEventType> types,
                      @Param("start") LocalDateTime start,
                      @Param("end") LocalDateTime end);

    @Query("SELECT AVG(l.responseTimeMs) FROM InteractionLog l " +
            "WHERE l.eventType = :type AND l.responseTimeMs IS NOT NULL AND l.timestamp BETWEEN :start AND :end")
    Double averageResponseTime(@Param("type") InteractionEventType type,
                               @Param("start") LocalDateTime start,
                               @Param("end") LocalDateTime end);

    /**
     * Rows of [mode, count] for one event type.
     */
    @Query("SELECT l.mode, COUNT(l) FROM InteractionLog l " +
            "WHERE l.eventType = :type AND l.timestamp BETWEEN :start AND :end GROUP BY l.mode")
    List<Object[]> countByModeGrouped(@Param("type") InteractionEventType type,
                                      @Param("start") LocalDateTime start,
                                      @Param("end") LocalDateTime end);

    /**
     * Rows of [agentName, count] for one event type.
     */
    @Query("SELECT l.agentName, COUNT(l) FROM InteractionLog l " +
            "WHERE l.eventType = :type AND l.timestamp BETWEEN :start AND :end GROUP BY l.agentName")
    List<Object[]> countByAgentGrouped(@Param("type") InteractionEventType type,
                                       @Param("start") LocalDateTime start,
                                       @Param("end") LocalDateTime end);
}
