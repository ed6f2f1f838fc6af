package com.preciousledger.infrastructure.persistence.entity;

import com.preciousledger.domain.model.MaterialSpec;
import com.preciousledger.domain.model.MaterialType;
import com.preciousledger.domain.model.RequirementLine;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One material of one design in a contract's bill of materials.
 *
 * {@code weight} is per product, or per stone for stone lines where
 * {@code materialQuantity} stones go into each product.
 */
@Entity
@Table(name = "contract_material_lines", indexes = {
    @Index(name = "idx_material_line_contract", columnList = "contract_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractMaterialLineEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID lineId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "contract_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private CoOwnershipContractEntity contract;

    @Column(nullable = false)
    private Integer lineNumber;

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

    @Column(nullable = false, precision = 10, scale = 3)
    private BigDecimal weight;

    @Column
    private Integer materialQuantity;

    @Column(nullable = false)
    private Integer productQuantity;

    @PrePersist
    protected void onCreate() {
        if (lineId == null) {
            lineId = UUID.randomUUID();
        }
    }

    public RequirementLine toRequirementLine() {
        return RequirementLine.builder()
                .material(toMaterialSpec())
                .weight(weight)
                .materialQuantity(materialQuantity)
                .productQuantity(productQuantity)
                .build();
    }

    private MaterialSpec toMaterialSpec() {
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
