package com.preciousledger.domain.service;

import com.preciousledger.domain.model.ContributionLedgerEntry;
import com.preciousledger.domain.model.LotLedger;
import com.preciousledger.domain.model.MaterialSpec;
import com.preciousledger.domain.model.MaterialType;
import com.preciousledger.domain.model.ReconciliationError;
import com.preciousledger.domain.model.ReconciliationOutcome;
import com.preciousledger.domain.model.UnitLedgerEntry;
import com.preciousledger.domain.model.UsageSplit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Splits a contribution into the part already used in production and the part still unused.
 *
 * Metal: the units of the lot that were drawn on by production, or that were
 * handed to the contribution's contract, contribute {@code unitWeight - remaining}
 * each to the used weight. Weights are rounded HALF_UP to 3 decimals.
 *
 * Stone: units drawn on by production are used, the rest unused.
 *
 * This runs on read paths, so it never throws: missing material data or an
 * unexpected failure yields a failed {@link ReconciliationOutcome}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContributionUsageSplitter {

    private final UnitWeightCalculator unitWeightCalculator;

    public ReconciliationOutcome<UsageSplit> split(LotLedger lot, ContributionLedgerEntry contribution) {
        MaterialSpec material = lot.getMaterial();
        if (material == null || material.getMaterialType() == null) {
            return ReconciliationOutcome.failure(ReconciliationError.MISSING_MATERIAL_DATA,
                    "Lot " + lot.getLotId() + " has no material record");
        }
        try {
            if (material.getMaterialType() == MaterialType.METAL) {
                return splitMetal(lot, contribution);
            }
            if (material.getMaterialType() == MaterialType.STONE) {
                return ReconciliationOutcome.success(splitStone(lot));
            }
            return ReconciliationOutcome.failure(ReconciliationError.UNSUPPORTED_MATERIAL,
                    "Unsupported material type " + material.getMaterialType());
        } catch (RuntimeException e) {
            log.warn("Usage split failed for contribution {}: {}", contribution.getContributionId(), e.getMessage(), e);
            return ReconciliationOutcome.failure(ReconciliationError.COMPUTATION_FAILED, e.getMessage());
        }
    }

    private ReconciliationOutcome<UsageSplit> splitMetal(LotLedger lot, ContributionLedgerEntry contribution) {
        MaterialSpec material = lot.getMaterial();
        if (!material.hasUnitWeight()) {
            return ReconciliationOutcome.failure(ReconciliationError.MISSING_MATERIAL_DATA,
                    "Lot " + lot.getLotId() + " has no unit weight");
        }
        BigDecimal unitWeight = material.getUnitWeight();

        BigDecimal used = BigDecimal.ZERO;
        for (UnitLedgerEntry unit : lot.getUnits()) {
            if (unit.hasProductionAllocation() || unit.hasHistoryFor(contribution.getContractId())) {
                used = used.add(unitWeight.subtract(unitWeightCalculator.remainingWeight(unit, material)));
            }
        }

        BigDecimal total = WeightMath.quantize3(contribution.getQuantity().multiply(unitWeight));
        BigDecimal usedWeight = WeightMath.quantize3(used);
        return ReconciliationOutcome.success(UsageSplit.builder()
                .materialType(MaterialType.METAL)
                .totalWeight(total)
                .usedWeight(usedWeight)
                .unusedWeight(WeightMath.quantize3(total.subtract(usedWeight)))
                .build());
    }

    private UsageSplit splitStone(LotLedger lot) {
        long used = lot.getUnits().stream().filter(UnitLedgerEntry::hasProductionAllocation).count();
        return UsageSplit.builder()
                .materialType(MaterialType.STONE)
                .usedQuantity(used)
                .unusedQuantity(lot.getUnits().size() - used)
                .build();
    }
}
