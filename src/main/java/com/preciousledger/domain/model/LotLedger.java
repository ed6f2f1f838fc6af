package com.preciousledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Everything the reconciliation engine needs to know about one purchase lot,
 * loaded up front so that the computation itself performs no I/O.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotLedger {

    private UUID lotId;
    private UUID businessId;
    private RequestType requestType;
    private LotStatus status;
    private BigDecimal requestedQuantity;
    private MaterialSpec material;

    /** Requested quantity of reserving sale children. */
    @Builder.Default
    private BigDecimal totalSold = BigDecimal.ZERO;

    @Builder.Default
    private List<ContributionLedgerEntry> contributions = List.of();

    @Builder.Default
    private List<UnitLedgerEntry> units = List.of();

    public MaterialType getMaterialType() {
        return material == null ? null : material.getMaterialType();
    }

    public BigDecimal getUnitWeight() {
        return material == null ? null : material.getUnitWeight();
    }
}
