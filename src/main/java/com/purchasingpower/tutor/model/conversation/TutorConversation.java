package com.purchasingpower.tutor.model.conversation;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Message thread between one user and one agent.
 *
 * Clearing deletes the messages but keeps this row, so the id stays stable
 * for the lifetime of the (user, agent) pair.
 */
@Data
@Entity
@Table(name = "TUTOR_CONVERSATIONS",
        uniqueConstraints = @UniqueConstraint(name = "uk_tutor_conv_user_agent", columnNames = {"user_id", "agent_id"}))
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TutorConversation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "agent_id", nullable = false)
    private Long agentId;

    @Column(name = "message_count", nullable = false)
    private int messageCount;

    @Column(name = "last_message_at")
    private LocalDateTime lastMessageAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    /**
     * Bookkeeping for one appended message.
     */
    public void recordMessage(LocalDateTime at) {
        this.messageCount++;
        this.lastMessageAt = at;
    }

    public void reset() {
        this.messageCount = 0;
        this.lastMessageAt = null;
    }
}
