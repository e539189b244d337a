package com.purchasingpower.tutor.model.session;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One per user, created lazily on first access and never deleted.
 *
 * The session id is also the correlation id of every interaction log row
 * the user produces, and the scope of the turn counter.
 */
@Data
@Entity
@Table(name = "TUTOR_SESSIONS")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TutorSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "tutor_mode", nullable = false, length = 20)
    private TutorMode mode;

    /**
     * Agent the learner last picked. Stored for clients; sends always go to the agent in the request path.
     */
    @Column(name = "active_agent_id")
    private Long activeAgentId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    public void prePersist() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        if (mode == null) {
            mode = TutorMode.MANUAL;
        }
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
