package com.purchasingpower.tutor.model.provider;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persisted credential for one LLM backend. Rows are edited from the admin console;
 * this service only reads active ones.
 */
@Data
@Entity
@Table(name = "API_CONFIGURATIONS")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiConfiguration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Provider id, see {@link ProviderType#getServiceName()}.
     */
    @Column(name = "service_name", nullable = false, unique = true, length = 50)
    private String serviceName;

    @Column(name = "api_key", length = 500)
    private String apiKey;

    @Column(name = "default_model", length = 100)
    private String defaultModel;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    public void touch() {
        updatedAt = LocalDateTime.now();
    }
}
