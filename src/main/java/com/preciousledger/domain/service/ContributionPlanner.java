package com.preciousledger.domain.service;

import com.preciousledger.domain.model.ContributionPlan;
import com.preciousledger.domain.model.ContributionProposal;
import com.preciousledger.domain.model.LotLedger;
import com.preciousledger.domain.model.MaterialSpec;
import com.preciousledger.domain.model.MaterialType;
import com.preciousledger.domain.model.RequirementLine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Picks lots to cover a bill of materials automatically.
 *
 * Lots are walked in the order given. Each one contributes as many whole units
 * as it has free and as fit in the weight still required by the line. Metal
 * lots must match the line's item and carat exactly, stone lots its item and
 * shape/cut.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContributionPlanner {

    private final ReconciliationEngine reconciliationEngine;
    private final RequirementAggregator requirementAggregator;

    public ContributionPlan plan(UUID contractId, UUID businessId,
                                 List<RequirementLine> lines, List<LotLedger> candidates) {
        Map<UUID, BigDecimal> freeUnits = freeUnitsByLot(candidates);
        List<ContributionProposal> proposals = new ArrayList<>();
        List<BigDecimal> shortfalls = new ArrayList<>();

        for (RequirementLine line : lines) {
            BigDecimal required = requirementAggregator.lineWeight(line);

            for (LotLedger lot : candidates) {
                if (required.signum() <= 0) {
                    break;
                }
                if (!sameMaterial(line.getMaterial(), lot.getMaterial())) {
                    continue;
                }
                BigDecimal unitWeight = lot.getUnitWeight();
                BigDecimal free = freeUnits.getOrDefault(lot.getLotId(), BigDecimal.ZERO);
                if (!WeightMath.isPositive(unitWeight) || free.signum() <= 0) {
                    continue;
                }
                BigDecimal fitting = required.divide(unitWeight, 0, RoundingMode.DOWN);
                BigDecimal assigned = free.min(fitting);
                if (assigned.signum() <= 0) {
                    continue;
                }

                proposals.add(ContributionProposal.builder()
                        .lotId(lot.getLotId())
                        .material(lot.getMaterial())
                        .quantity(assigned)
                        .build());
                freeUnits.put(lot.getLotId(), free.subtract(assigned));
                required = required.subtract(assigned.multiply(unitWeight));
            }

            shortfalls.add(WeightMath.quantize2(WeightMath.nonNegative(required)));
        }

        boolean fulfillable = shortfalls.stream().allMatch(shortfall -> shortfall.signum() == 0);
        log.debug("Planned {} proposals for contract {}, fulfillable={}", proposals.size(), contractId, fulfillable);

        return ContributionPlan.builder()
                .contractId(contractId)
                .businessId(businessId)
                .fulfillable(fulfillable)
                .proposals(proposals)
                .shortfalls(shortfalls)
                .build();
    }

    private Map<UUID, BigDecimal> freeUnitsByLot(List<LotLedger> candidates) {
        Map<UUID, BigDecimal> freeUnits = new HashMap<>();
        for (LotLedger lot : candidates) {
            BigDecimal remaining = reconciliationEngine.remainingQuantity(lot);
            BigDecimal whole = remaining == null ? BigDecimal.ZERO : remaining.setScale(0, RoundingMode.DOWN);
            freeUnits.put(lot.getLotId(), WeightMath.nonNegative(whole));
        }
        return freeUnits;
    }

    private boolean sameMaterial(MaterialSpec required, MaterialSpec offered) {
        if (offered == null || required.getMaterialType() != offered.getMaterialType()
                || !Objects.equals(required.getMaterialItemId(), offered.getMaterialItemId())) {
            return false;
        }
        if (required.getMaterialType() == MaterialType.METAL) {
            return Objects.equals(required.getCaratTypeId(), offered.getCaratTypeId());
        }
        return Objects.equals(required.getShapeCutId(), offered.getShapeCutId());
    }
}
