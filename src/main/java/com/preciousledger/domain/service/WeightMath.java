package com.preciousledger.domain.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal helpers shared by the reconciliation and validation code.
 *
 * Quantities and requirement weights are kept at 2 decimals, used/unused
 * weights at 3.
 */
public final class WeightMath {

    public static final BigDecimal ZERO_2 = BigDecimal.ZERO.setScale(2);

    private static final int DIVISION_SCALE = 10;

    private WeightMath() {
    }

    public static BigDecimal quantize2(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal quantize3(BigDecimal value) {
        return value.setScale(3, RoundingMode.HALF_UP);
    }

    /**
     * Divides by a unit weight, returning zero when the divisor is missing or not positive.
     */
    public static BigDecimal divideByWeight(BigDecimal dividend, BigDecimal unitWeight) {
        if (!isPositive(unitWeight)) {
            return BigDecimal.ZERO;
        }
        return dividend.divide(unitWeight, DIVISION_SCALE, RoundingMode.HALF_UP);
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    public static BigDecimal nonNegative(BigDecimal value) {
        return value.signum() < 0 ? BigDecimal.ZERO : value;
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
