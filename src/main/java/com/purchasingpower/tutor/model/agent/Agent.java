package com.purchasingpower.tutor.model.agent;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Tutor persona configuration. Maintained by the administration side of the platform;
 * this service only reads it.
 */
@Data
@Entity
@Table(name = "CHATBOTS")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Agent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "display_name", nullable = false, length = 200)
    private String displayName;

    @Column(name = "description", length = 1000)
    private String description;

    @Lob
    @Column(name = "system_prompt", nullable = false)
    private String systemPrompt;

    @Column(name = "welcome_message", length = 2000)
    private String welcomeMessage;

    @Column(name = "personality", length = 500)
    private String personality;

    @Column(name = "avatar_url", length = 500)
    private String avatarUrl;

    /**
     * Sampling temperature for this persona, null to leave it to the backend.
     */
    @Column(name = "temperature")
    private Double temperature;

    /**
     * Model that overrides the resolved provider default, null for the default.
     */
    @Column(name = "model_preference", length = 100)
    private String modelPreference;

    /**
     * JSON array of behaviour rules appended to the system prompt.
     */
    @Lob
    @Column(name = "dos_rules")
    private String dosRules;

    @Lob
    @Column(name = "donts_rules")
    private String dontsRules;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
