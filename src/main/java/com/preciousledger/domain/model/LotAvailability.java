package com.preciousledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Remaining quantity and weight of a lot. Both are null for SALE lots.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotAvailability {

    private UUID lotId;
    private RequestType requestType;
    private LotStatus status;
    private MaterialType materialType;
    private BigDecimal requestedQuantity;
    private BigDecimal remainingQuantity;
    private BigDecimal remainingWeight;
}
