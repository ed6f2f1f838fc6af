package com.preciousledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Used versus unused part of a contribution.
 *
 * Metal splits fill the weight fields, stone splits fill the quantity fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageSplit {

    private MaterialType materialType;

    private BigDecimal totalWeight;
    private BigDecimal usedWeight;
    private BigDecimal unusedWeight;

    private Long usedQuantity;
    private Long unusedQuantity;
}
