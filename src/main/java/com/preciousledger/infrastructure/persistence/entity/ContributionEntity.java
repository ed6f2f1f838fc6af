package com.preciousledger.infrastructure.persistence.entity;

import com.preciousledger.domain.model.ContributionStatus;
import com.preciousledger.domain.model.ContributionType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Units of a purchase lot pledged to exactly one pool, contract or production payment.
 */
@Entity
@Table(name = "contributions", indexes = {
    @Index(name = "idx_contribution_lot", columnList = "purchase_lot_id"),
    @Index(name = "idx_contribution_contract", columnList = "contract_id"),
    @Index(name = "idx_contribution_pool", columnList = "pool_id")
})
@Check(constraints = "(CASE WHEN pool_id IS NULL THEN 0 ELSE 1 END"
        + " + CASE WHEN contract_id IS NULL THEN 0 ELSE 1 END"
        + " + CASE WHEN production_payment_id IS NULL THEN 0 ELSE 1 END) = 1")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContributionEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID contributionId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "purchase_lot_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private PurchaseLotEntity purchaseLot;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID businessId;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ContributionType contributionType;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pool_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private PoolEntity pool;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "contract_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private CoOwnershipContractEntity contract;

    @Column(name = "production_payment_id", columnDefinition = "UUID")
    private UUID productionPaymentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ContributionStatus status = ContributionStatus.PENDING;

    @Column(columnDefinition = "UUID")
    private UUID submissionId;

    @Version
    private Long version;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Column
    private Instant deletedAt;

    @PrePersist
    protected void onCreate() {
        if (contributionId == null) {
            contributionId = UUID.randomUUID();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();
        checkSingleTarget();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
        checkSingleTarget();
    }

    private void checkSingleTarget() {
        int targets = (pool != null ? 1 : 0) + (contract != null ? 1 : 0) + (productionPaymentId != null ? 1 : 0);
        if (targets != 1) {
            throw new IllegalStateException("Contribution must target exactly one of pool, contract or production payment");
        }
    }
}
