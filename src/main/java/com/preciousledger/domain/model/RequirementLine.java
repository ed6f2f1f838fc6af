package com.preciousledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One bill-of-materials line: {@code productQuantity} products, each using
 * {@code weight} of the material (per stone for stone lines, with
 * {@code materialQuantity} stones per product).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequirementLine {

    private MaterialSpec material;
    private BigDecimal weight;
    private Integer materialQuantity;
    private int productQuantity;
}
