package com.preciousledger.domain.service;

import com.preciousledger.domain.model.MaterialRequirements;
import com.preciousledger.domain.model.MaterialSpec;
import com.preciousledger.domain.model.MaterialType;
import com.preciousledger.domain.model.RequirementKey;
import com.preciousledger.domain.model.RequirementLine;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Builds requirement maps for contracts and pools.
 */
@Component
public class RequirementAggregator {

    /**
     * Sums a bill of materials into requirement buckets, keeping line order.
     */
    public MaterialRequirements forContract(List<RequirementLine> lines) {
        MaterialRequirements requirements = new MaterialRequirements();
        for (RequirementLine line : lines) {
            requirements.require(RequirementKey.forRequirement(line.getMaterial()), lineWeight(line));
        }
        return requirements;
    }

    /**
     * Single bucket holding what the pool still needs to reach its target.
     */
    public MaterialRequirements forPool(MaterialSpec poolMaterial, BigDecimal targetWeight, BigDecimal pledgedWeight) {
        BigDecimal open = WeightMath.nonNegative(targetWeight.subtract(WeightMath.orZero(pledgedWeight)));
        return new MaterialRequirements()
                .require(RequirementKey.forRequirement(poolMaterial), WeightMath.quantize2(open));
    }

    /**
     * Total weight a line needs: stones are weighed per stone, everything else per product.
     * A stone line without a stone count is taken as one stone per product.
     */
    public BigDecimal lineWeight(RequirementLine line) {
        BigDecimal products = BigDecimal.valueOf(line.getProductQuantity());
        BigDecimal weight = WeightMath.orZero(line.getWeight());
        if (line.getMaterial().getMaterialType() == MaterialType.STONE) {
            int stones = line.getMaterialQuantity() == null ? 1 : line.getMaterialQuantity();
            return WeightMath.quantize2(BigDecimal.valueOf(stones).multiply(products).multiply(weight));
        }
        return WeightMath.quantize2(weight.multiply(products));
    }
}
