package com.heronix.callgate.model.domain;

import java.time.LocalDateTime;

import com.heronix.callgate.model.enums.ProtocolEventType;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted protocol notification. Written in the same transaction as the state change it describes.
 */
@Entity
@Table(name = "protocol_events", indexes = {
    @Index(name = "idx_event_integration", columnList = "integration"),
    @Index(name = "idx_event_type", columnList = "event_type"),
    @Index(name = "idx_event_occurred", columnList = "occurred_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProtocolEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40)
    private ProtocolEventType eventType;

    /**
     * Identity the event is about (integration self-identity or proxy front)
     */
    @Column(name = "integration", nullable = false, length = 42)
    private Address integration;

    @Column(name = "detail", nullable = false, length = 2000)
    private String detail;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;

    @PrePersist
    protected void onCreate() {
        if (this.occurredAt == null) {
            this.occurredAt = LocalDateTime.now();
        }
    }
}
