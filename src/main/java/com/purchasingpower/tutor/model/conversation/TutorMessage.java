package com.purchasingpower.tutor.model.conversation;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Immutable once written. Ordered by (createdAt, id) inside its conversation.
 */
@Data
@Entity
@Table(name = "TUTOR_MESSAGES",
        indexes = @Index(name = "idx_tutor_msg_conv_created", columnList = "conversation_id, created_at"))
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TutorMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "conversation_id", nullable = false)
    private Long conversationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private MessageRole role;

    @Lob
    @Column(name = "content", nullable = false)
    private String content;

    @Column(name = "ai_model", length = 100)
    private String model;

    @Column(name = "ai_provider", length = 50)
    private String provider;

    @Column(name = "response_time_ms")
    private Long responseTimeMs;

    @Column(name = "temperature")
    private Double temperature;

    @Column(name = "routing_reason", length = 500)
    private String routingReason;

    @Column(name = "routing_confidence")
    private Double routingConfidence;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
