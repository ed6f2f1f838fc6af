package com.preciousledger.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only record that a unit was contributed to a contract.
 */
@Entity
@Table(name = "contract_unit_history", indexes = {
    @Index(name = "idx_history_unit", columnList = "unit_id"),
    @Index(name = "idx_history_contract", columnList = "contract_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractUnitHistoryEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID historyId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "unit_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private UnitEntity unit;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "contract_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private CoOwnershipContractEntity contract;

    @Column(precision = 10, scale = 3)
    private BigDecimal contributedWeight;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant deletedAt;

    @PrePersist
    protected void onCreate() {
        if (historyId == null) {
            historyId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
