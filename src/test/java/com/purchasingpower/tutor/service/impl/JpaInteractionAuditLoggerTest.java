package com.purchasingpower.tutor.service.impl;

import com.purchasingpower.tutor.configuration.AppProperties;
import com.purchasingpower.tutor.exception.ValidationException;
import com.purchasingpower.tutor.model.audit.DeviceType;
import com.purchasingpower.tutor.model.audit.InteractionEventType;
import com.purchasingpower.tutor.model.audit.InteractionLog;
import com.purchasingpower.tutor.model.dto.InteractionLogQuery;
import com.purchasingpower.tutor.model.dto.InteractionStats;
import com.purchasingpower.tutor.model.session.TutorMode;
import com.purchasingpower.tutor.repository.InteractionLogRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@Import(JpaInteractionAuditLogger.class)
@EnableConfigurationProperties(AppProperties.class)
@DisplayName("Interaction audit logger")
class JpaInteractionAuditLoggerTest {

    private static final LocalDateTime DAY_1 = LocalDateTime.of(2024, 5, 1, 9, 0);
    private static final LocalDateTime DAY_2 = LocalDateTime.of(2024, 5, 2, 9, 0);

    @Autowired
    private JpaInteractionAuditLogger auditLogger;

    @Autowired
    private InteractionLogRepository logRepository;

    @Test
    @DisplayName("Turn numbers start at 1 and follow the highest recorded turn")
    void nextTurn_ShouldFollowMaximum() {
        assertThat(auditLogger.nextTurn(100L)).isEqualTo(1);

        auditLogger.log(row(1L, 100L, InteractionEventType.MESSAGE_SENT, 3, DAY_1));
        auditLogger.log(row(1L, 100L, InteractionEventType.MESSAGE_RECEIVED, 3, DAY_1));
        auditLogger.log(row(1L, 100L, InteractionEventType.MODE_CHANGE, null, DAY_1));
        auditLogger.log(row(2L, 200L, InteractionEventType.MESSAGE_SENT, 9, DAY_1));

        assertThat(auditLogger.nextTurn(100L)).isEqualTo(4);
    }

    @Test
    @DisplayName("Filters combine as AND, newest first")
    void query_ShouldApplyAllFilters() {
        // Given
        auditLogger.log(row(1L, 10L, InteractionEventType.MESSAGE_SENT, 1, DAY_1));
        auditLogger.log(row(1L, 10L, InteractionEventType.MESSAGE_RECEIVED, 1, DAY_1));
        auditLogger.log(row(1L, 10L, InteractionEventType.MESSAGE_SENT, 2, DAY_2));
        auditLogger.log(row(2L, 20L, InteractionEventType.MESSAGE_SENT, 1, DAY_2));

        // When
        List<InteractionLog> rows = auditLogger.query(InteractionLogQuery.builder()
                .userId(1L)
                .eventType("message_sent")
                .build());
        List<InteractionLog> windowed = auditLogger.query(InteractionLogQuery.builder()
                .sessionId(10L)
                .startDate(DAY_1.minusHours(1))
                .endDate(DAY_1.plusHours(1))
                .build());

        // Then
        assertThat(rows).extracting(InteractionLog::getTurn).containsExactly(2, 1);
        assertThat(rows).allSatisfy(row -> assertThat(row.getUserId()).isEqualTo(1L));
        assertThat(windowed).hasSize(2);
    }

    @Test
    @DisplayName("Without a limit at most 100 rows come back")
    void query_WithoutLimit_ShouldCapAtDefault() {
        for (int i = 0; i < 105; i++) {
            auditLogger.log(row(3L, 30L, InteractionEventType.MESSAGE_SENT, i + 1, DAY_1.plusMinutes(i)));
        }

        assertThat(auditLogger.query(new InteractionLogQuery())).hasSize(100);
        assertThat(auditLogger.query(InteractionLogQuery.builder().limit(5).build()))
                .extracting(InteractionLog::getTurn)
                .containsExactly(105, 104, 103, 102, 101);
    }

    @Test
    @DisplayName("Bad filters are rejected")
    void query_BadFilters_ShouldFailValidation() {
        assertThatThrownBy(() -> auditLogger.query(InteractionLogQuery.builder().eventType("chatting").build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> auditLogger.query(InteractionLogQuery.builder().limit(0).build()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> auditLogger.query(InteractionLogQuery.builder()
                .startDate(DAY_2).endDate(DAY_1).build()))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Stats aggregate over the whole history or a window")
    void stats_ShouldAggregate() {
        // Given
        auditLogger.log(row(1L, 10L, InteractionEventType.SESSION_START, null, DAY_1));
        auditLogger.log(row(1L, 10L, InteractionEventType.MESSAGE_SENT, 1, DAY_1));
        auditLogger.log(received(1L, 10L, 1, DAY_1, 100L, TutorMode.MANUAL, "socratic-tutor"));
        auditLogger.log(row(2L, 20L, InteractionEventType.MESSAGE_SENT, 1, DAY_2));
        auditLogger.log(received(2L, 20L, 1, DAY_2, 300L, TutorMode.ROUTER, "helper-tutor"));

        // When
        InteractionStats all = auditLogger.stats(null, null);
        InteractionStats day2 = auditLogger.stats(DAY_2.minusHours(1), DAY_2.plusHours(1));

        // Then
        assertThat(all.getTotalSessions()).isEqualTo(2);
        assertThat(all.getTotalMessages()).isEqualTo(4);
        assertThat(all.getAverageResponseTime()).isEqualTo(200.0);
        assertThat(all.getActiveUsers()).isEqualTo(2);
        assertThat(all.getMessagesByMode()).containsEntry("manual", 1L).containsEntry("router", 1L);
        assertThat(all.getMessagesByAgent()).containsEntry("socratic-tutor", 1L).containsEntry("helper-tutor", 1L);

        assertThat(day2.getTotalSessions()).isEqualTo(1);
        assertThat(day2.getTotalMessages()).isEqualTo(2);
        assertThat(day2.getAverageResponseTime()).isEqualTo(300.0);
    }

    @Test
    @DisplayName("Empty history yields zeroes")
    void stats_Empty_ShouldBeZero() {
        InteractionStats stats = auditLogger.stats(null, null);

        assertThat(stats.getTotalSessions()).isZero();
        assertThat(stats.getTotalMessages()).isZero();
        assertThat(stats.getAverageResponseTime()).isZero();
        assertThat(stats.getActiveUsers()).isZero();
    }

    @Test
    @DisplayName("Best-effort writes persist like normal ones")
    void logBestEffort_ShouldPersist() {
        auditLogger.logBestEffort(row(4L, 40L, InteractionEventType.MODE_CHANGE, null, DAY_1));

        assertThat(logRepository.findBySessionIdOrderByIdAsc(40L))
                .extracting(InteractionLog::getEventType)
                .containsExactly(InteractionEventType.MODE_CHANGE);
    }

    private static InteractionLog row(Long userId, Long sessionId, InteractionEventType type, Integer turn,
                                      LocalDateTime at) {
        return InteractionLog.builder()
                .userId(userId)
                .sessionId(sessionId)
                .eventType(type)
                .turn(turn)
                .deviceType(DeviceType.DESKTOP)
                .browserName("Chrome")
                .timestamp(at)
                .build();
    }

    private static InteractionLog received(Long userId, Long sessionId, int turn, LocalDateTime at,
                                           long responseTimeMs, TutorMode mode, String agentName) {
        InteractionLog row = row(userId, sessionId, InteractionEventType.MESSAGE_RECEIVED, turn, at);
        row.setResponseTimeMs(responseTimeMs);
        row.setMode(mode);
        row.setAgentName(agentName);
        return row;
    }
}
