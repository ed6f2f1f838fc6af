package com.preciousledger.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * One physical unit of a purchase lot.
 *
 * The sale, contract and pool references mark where the unit is currently
 * allocated. They are cleared when the allocation ends, so the full contract
 * trail lives in {@link ContractUnitHistoryEntity}.
 */
@Entity
@Table(name = "units",
        uniqueConstraints = @UniqueConstraint(name = "uk_unit_lot_serial",
                columnNames = {"purchase_lot_id", "serialNumber"}),
        indexes = {
            @Index(name = "idx_unit_lot", columnList = "purchase_lot_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnitEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID unitId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "purchase_lot_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private PurchaseLotEntity purchaseLot;

    @Column(nullable = false, length = 100)
    private String serialNumber;

    @Column(length = 100)
    private String systemSerialNumber;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "sale_lot_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private PurchaseLotEntity saleLot;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "contract_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private CoOwnershipContractEntity contract;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pool_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private PoolEntity pool;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant deletedAt;

    @PrePersist
    protected void onCreate() {
        if (unitId == null) {
            unitId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
