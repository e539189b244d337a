package com.purchasingpower.tutor.model.audit;

import com.purchasingpower.tutor.model.session.TutorMode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only audit row. One per logical event; a recorded turn yields a
 * MESSAGE_SENT and a MESSAGE_RECEIVED row sharing {@link #turn}.
 */
@Data
@Entity
@Table(name = "TUTOR_INTERACTION_LOGS", indexes = {
        @Index(name = "idx_tutor_log_session_turn", columnList = "session_id, turn_number"),
        @Index(name = "idx_tutor_log_user_ts", columnList = "user_id, event_timestamp")
})
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // ================================================================
    // CORRELATION
    // ================================================================

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 30)
    private InteractionEventType eventType;

    /**
     * Per-session turn counter, null for events outside a message exchange.
     */
    @Column(name = "turn_number")
    private Integer turn;

    @Enumerated(EnumType.STRING)
    @Column(name = "tutor_mode", length = 20)
    private TutorMode mode;

    @Column(name = "agent_id")
    private Long agentId;

    @Column(name = "agent_name", length = 100)
    private String agentName;

    // ================================================================
    // PAYLOAD SNAPSHOT
    // ================================================================

    @Lob
    @Column(name = "user_message")
    private String userMessage;

    @Lob
    @Column(name = "assistant_response")
    private String assistantResponse;

    @Column(name = "ai_model", length = 100)
    private String model;

    @Column(name = "ai_provider", length = 50)
    private String provider;

    @Column(name = "response_time_ms")
    private Long responseTimeMs;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    // ================================================================
    // CLIENT CONTEXT
    // ================================================================

    @Column(name = "user_agent", length = 1000)
    private String userAgent;

    @Enumerated(EnumType.STRING)
    @Column(name = "device_type", length = 20)
    private DeviceType deviceType;

    @Column(name = "browser_name", length = 50)
    private String browserName;

    @Column(name = "event_timestamp", nullable = false, updatable = false)
    private LocalDateTime timestamp;

    @PrePersist
    public void prePersist() {
        if (timestamp == null) {
            timestamp = LocalDateTime.now();
        }
    }
}
