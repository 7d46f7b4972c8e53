package com.heronix.callgate.model.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Protection flag of record for one (self-identity, selector) pair of a proxy-hosted integration.
 *
 * A missing row means the flag is disabled.
 */
@Entity
@Table(name = "function_protection",
    uniqueConstraints = @UniqueConstraint(name = "uk_protection_identity_selector",
            columnNames = {"identity", "selector"}),
    indexes = @Index(name = "idx_protection_identity", columnList = "identity"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FunctionProtection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "identity", nullable = false, length = 42)
    private Address identity;

    @NotNull
    @Column(name = "selector", nullable = false, length = 10)
    private Selector selector;

    @Column(name = "enabled", nullable = false)
    private boolean enabled;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
