package com.preciousledger.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Allocation event waiting to be published to Kafka.
 *
 * Written in the same transaction as the contributions it describes and
 * drained by {@link com.preciousledger.domain.service.OutboxPublisher}.
 */
@Entity
@Table(name = "allocation_outbox", indexes = {
    @Index(name = "idx_outbox_status_created", columnList = "status,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEventEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID eventId;

    @Column(nullable = false, length = 50)
    private String eventType;

    @Column(nullable = false, length = 30)
    private String aggregateType;

    @Column(nullable = false, length = 100)
    private String aggregateId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EventStatus status = EventStatus.PENDING;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant publishedAt;

    @Column
    @Builder.Default
    private Integer attempts = 0;

    @Column(length = 500)
    private String lastError;

    public enum EventStatus {
        PENDING,
        PUBLISHED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (eventId == null) {
            eventId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (attempts == null) {
            attempts = 0;
        }
    }

    public void markPublished() {
        this.status = EventStatus.PUBLISHED;
        this.publishedAt = Instant.now();
        this.attempts++;
    }

    /**
     * Records a failed publish. The event stays PENDING until {@code maxAttempts}
     * publishes have failed.
     */
    public void markFailed(String error, int maxAttempts) {
        this.attempts++;
        this.lastError = error == null ? null : error.substring(0, Math.min(error.length(), 500));
        if (attempts >= maxAttempts) {
            this.status = EventStatus.FAILED;
        }
    }
}
