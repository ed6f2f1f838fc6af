package com.preciousledger.infrastructure.persistence.entity;

import com.preciousledger.domain.model.MaterialSpec;
import com.preciousledger.domain.model.MaterialType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Investment pool collecting one material from many participants up to a target weight.
 */
@Entity
@Table(name = "pools")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID poolId;

    @Column(nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MaterialType materialType;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID materialItemId;

    @Column(nullable = false, length = 100)
    private String materialItemName;

    @Column(columnDefinition = "UUID")
    private UUID caratTypeId;

    @Column(columnDefinition = "UUID")
    private UUID shapeCutId;

    @Column(columnDefinition = "UUID")
    private UUID clarityId;

    @Column(columnDefinition = "UUID")
    private UUID colorId;

    @Column(nullable = false, precision = 12, scale = 3)
    private BigDecimal targetWeight;

    // per participant; null means no minimum
    @Column(precision = 12, scale = 3)
    private BigDecimal minimumInvestmentWeight;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PoolStatus status = PoolStatus.OPEN;

    @Column(nullable = false)
    private Instant createdAt;

    public enum PoolStatus {
        OPEN,
        CLOSED
    }

    @PrePersist
    protected void onCreate() {
        if (poolId == null) {
            poolId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isOpen() {
        return status == PoolStatus.OPEN;
    }

    public MaterialSpec toMaterialSpec() {
        return MaterialSpec.builder()
                .materialType(materialType)
                .materialItemId(materialItemId)
                .materialItemName(materialItemName)
                .caratTypeId(caratTypeId)
                .shapeCutId(shapeCutId)
                .clarityId(clarityId)
                .colorId(colorId)
                .build();
    }
}
