package com.preciousledger.domain.service;

import com.preciousledger.domain.model.MaterialSpec;
import com.preciousledger.domain.model.MaterialType;
import com.preciousledger.domain.model.UnitLedgerEntry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Remaining weight of a single unit.
 *
 * A stone unit always counts as 1. A metal unit starts at the item's unit
 * weight and loses whatever production allocations drew from it, directly or
 * through its contract history. The result is never negative.
 */
@Component
public class UnitWeightCalculator {

    public BigDecimal remainingWeight(UnitLedgerEntry unit, MaterialSpec material) {
        if (material.getMaterialType() == MaterialType.STONE) {
            return BigDecimal.ONE;
        }
        if (!material.hasUnitWeight()) {
            return WeightMath.ZERO_2;
        }
        BigDecimal remaining = material.getUnitWeight()
                .subtract(WeightMath.orZero(unit.getDirectConsumedWeight()))
                .subtract(WeightMath.orZero(unit.getHistoryConsumedWeight()));
        return WeightMath.nonNegative(remaining);
    }
}
