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
 * Catalogue item a lot is bought in, with its material description.
 *
 * {@code unitWeight} is null when the item's material record has not been
 * captured; reads then report zero availability and commits are refused.
 */
@Entity
@Table(name = "precious_items")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreciousItemEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID itemId;

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

    @Column(precision = 18, scale = 10)
    private BigDecimal unitWeight;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (itemId == null) {
            itemId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
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
                .unitWeight(unitWeight)
                .build();
    }
}
