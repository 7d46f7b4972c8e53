package com.heronix.callgate.model.domain;

import java.time.LocalDateTime;

import com.heronix.callgate.model.enums.AuthorizationStatus;
import com.heronix.callgate.model.enums.RegistrationStatus;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ledger entry holding the registration and authorization status of one integration identity.
 *
 * Identities are either logic-unit self-identities or the front address of a proxy.
 * Rows are only written by the GateKeeper.
 */
@Entity
@Table(name = "integrations", indexes = {
    @Index(name = "idx_integration_identity", columnList = "identity", unique = true),
    @Index(name = "idx_integration_registration", columnList = "registration_status"),
    @Index(name = "idx_integration_authorization", columnList = "authorization_status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IntegrationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "identity", nullable = false, unique = true, length = 42)
    private Address identity;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "registration_status", nullable = false, length = 15)
    @Builder.Default
    private RegistrationStatus registrationStatus = RegistrationStatus.UNREGISTERED;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "authorization_status", nullable = false, length = 15)
    @Builder.Default
    private AuthorizationStatus authorizationStatus = AuthorizationStatus.INACTIVE;

    /**
     * Logic unit this identity has pre-authorized as its replacement, if any.
     */
    @Column(name = "successor", length = 42)
    private Address successor;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isRegistered() {
        return registrationStatus == RegistrationStatus.REGISTERED;
    }

    public static IntegrationRecord unregistered(Address identity) {
        return IntegrationRecord.builder()
                .identity(identity)
                .build();
    }
}
