package com.preciousledger.infrastructure.persistence.entity;

import com.preciousledger.domain.model.LotStatus;
import com.preciousledger.domain.model.RequestType;
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
 * A purchase, sale or jewelry design request for a quantity of one precious item.
 *
 * Sale lots point at the purchase lot they sell from through {@code relatedLot}.
 * The row is the lock target when contributions are committed against the lot.
 */
@Entity
@Table(name = "purchase_lots", indexes = {
    @Index(name = "idx_lot_related", columnList = "related_lot_id"),
    @Index(name = "idx_lot_business_status", columnList = "businessId,status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PurchaseLotEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID lotId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID businessId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "precious_item_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private PreciousItemEntity preciousItem;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RequestType requestType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private LotStatus status;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal requestedQuantity;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "related_lot_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private PurchaseLotEntity relatedLot;

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
        if (lotId == null) {
            lotId = UUID.randomUUID();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
