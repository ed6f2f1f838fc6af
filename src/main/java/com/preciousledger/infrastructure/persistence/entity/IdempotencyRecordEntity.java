package com.preciousledger.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Cached outcome of an accepted contribution submission, keyed by the
 * submitter's idempotency key. Redelivered submissions get the cached result.
 */
@Entity
@Table(name = "submission_idempotency", indexes = {
    @Index(name = "idx_submission_idempotency_key", columnList = "idempotencyKey", unique = true),
    @Index(name = "idx_submission_expires_at", columnList = "expiresAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyRecordEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID recordId;

    @Column(nullable = false, unique = true, length = 255)
    private String idempotencyKey;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID submissionId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String response;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant expiresAt;

    @PrePersist
    protected void onCreate() {
        if (recordId == null) {
            recordId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }
}
