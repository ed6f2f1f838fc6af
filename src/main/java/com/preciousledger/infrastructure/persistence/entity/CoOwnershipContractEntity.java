package com.preciousledger.infrastructure.persistence.entity;

import com.preciousledger.domain.model.ContractStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Co-ownership (Musharakah) contract between a jeweler and an investor.
 * Its bill of materials is stored as {@link ContractMaterialLineEntity} rows.
 */
@Entity
@Table(name = "co_ownership_contracts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoOwnershipContractEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID contractId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID jewelerBusinessId;

    @Column(columnDefinition = "UUID")
    private UUID investorBusinessId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private ContractStatus contractStatus = ContractStatus.NOT_ASSIGNED;

    @Version
    private Long version;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (contractId == null) {
            contractId = UUID.randomUUID();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isAwaitingInvestor() {
        return contractStatus == ContractStatus.NOT_ASSIGNED;
    }

    public void assignInvestor(UUID businessId) {
        this.investorBusinessId = businessId;
        this.contractStatus = ContractStatus.ACTIVE;
    }
}
