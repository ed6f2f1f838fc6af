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
 * Weight drawn from a unit during manufacturing.
 *
 * Points either at the unit directly or at the contract history row under
 * which the unit was used.
 */
@Entity
@Table(name = "production_allocations", indexes = {
    @Index(name = "idx_allocation_unit", columnList = "unit_id"),
    @Index(name = "idx_allocation_history", columnList = "contract_history_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductionAllocationEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID allocationId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID productionPaymentId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "unit_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private UnitEntity unit;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "contract_history_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private ContractUnitHistoryEntity contractHistory;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "contract_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private CoOwnershipContractEntity contract;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal weight;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant deletedAt;

    @PrePersist
    protected void onCreate() {
        if (allocationId == null) {
            allocationId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
