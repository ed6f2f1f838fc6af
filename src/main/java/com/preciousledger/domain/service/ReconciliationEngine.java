package com.preciousledger.domain.service;

import com.preciousledger.domain.model.ContributionLedgerEntry;
import com.preciousledger.domain.model.ContributionStatus;
import com.preciousledger.domain.model.LotAvailability;
import com.preciousledger.domain.model.LotLedger;
import com.preciousledger.domain.model.LotStatus;
import com.preciousledger.domain.model.MaterialType;
import com.preciousledger.domain.model.ReconciliationOutcome;
import com.preciousledger.domain.model.RequestType;
import com.preciousledger.domain.model.UnitLedgerEntry;
import com.preciousledger.domain.model.UsageSplit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Computes how much of a purchase lot is still free to sell or contribute.
 *
 * Two independent constraints are reconciled:
 * 1. Ledger: requested quantity minus reserving sales minus consuming contributions
 * 2. Physical: units not pointed at by a sale or pool and not held by a live contract
 *
 * Metal lots convert the physical side from weight to units and return the
 * smaller of the two, at 2 decimals. Stone lots count units and return a whole number.
 *
 * Works on a pre-loaded {@link LotLedger}; no I/O happens here, so repeated
 * calls on the same snapshot give the same answer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationEngine {

    private final UnitWeightCalculator unitWeightCalculator;
    private final ContributionUsageSplitter usageSplitter;

    /**
     * Remaining quantity of the lot, or null for SALE lots.
     */
    public BigDecimal remainingQuantity(LotLedger lot) {
        if (lot.getRequestType() == RequestType.JEWELRY_DESIGN) {
            return lot.getRequestedQuantity();
        }
        if (lot.getRequestType() == RequestType.SALE) {
            return null;
        }
        if (lot.getStatus() == LotStatus.PENDING) {
            return lot.getRequestedQuantity();
        }

        BigDecimal baseRemaining = lot.getRequestedQuantity()
                .subtract(WeightMath.orZero(lot.getTotalSold()))
                .subtract(totalContributed(lot));

        List<UnitLedgerEntry> available = availableUnits(lot);

        if (lot.getMaterialType() == MaterialType.METAL) {
            BigDecimal unitWeight = lot.getUnitWeight();
            if (!WeightMath.isPositive(unitWeight)) {
                log.debug("Lot {} has no usable unit weight, reporting zero remaining", lot.getLotId());
                return WeightMath.ZERO_2;
            }
            BigDecimal remainingWeight = available.stream()
                    .map(unit -> unitWeightCalculator.remainingWeight(unit, lot.getMaterial()))
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal fromWeight = WeightMath.divideByWeight(remainingWeight, unitWeight);
            BigDecimal remaining = fromWeight.min(baseRemaining).setScale(2, RoundingMode.HALF_EVEN);
            return remaining.max(WeightMath.ZERO_2);
        }

        BigDecimal fromUnits = BigDecimal.valueOf(available.size());
        return WeightMath.nonNegative(fromUnits.min(baseRemaining)).setScale(0, RoundingMode.DOWN);
    }

    /**
     * Sum of the remaining weight of the lot's available units, or null for SALE lots.
     * Stone units weigh 1 each. No ledger cross-check is applied.
     */
    public BigDecimal remainingWeight(LotLedger lot) {
        if (lot.getRequestType() == RequestType.SALE) {
            return null;
        }
        if (lot.getMaterial() == null) {
            return WeightMath.ZERO_2;
        }
        return availableUnits(lot).stream()
                .map(unit -> WeightMath.nonNegative(unitWeightCalculator.remainingWeight(unit, lot.getMaterial())))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal unitRemainingWeight(LotLedger lot, UnitLedgerEntry unit) {
        return unitWeightCalculator.remainingWeight(unit, lot.getMaterial());
    }

    public LotAvailability availability(LotLedger lot) {
        return LotAvailability.builder()
                .lotId(lot.getLotId())
                .requestType(lot.getRequestType())
                .status(lot.getStatus())
                .materialType(lot.getMaterialType())
                .requestedQuantity(lot.getRequestedQuantity())
                .remainingQuantity(remainingQuantity(lot))
                .remainingWeight(remainingWeight(lot))
                .build();
    }

    List<UnitLedgerEntry> availableUnits(LotLedger lot) {
        return lot.getUnits().stream()
                .filter(UnitLedgerEntry::isTrulyAvailable)
                .collect(Collectors.toList());
    }

    BigDecimal totalContributed(LotLedger lot) {
        BigDecimal total = BigDecimal.ZERO;
        for (ContributionLedgerEntry contribution : lot.getContributions()) {
            if (!ContributionStatus.CONSUMING.contains(contribution.getStatus())) {
                continue;
            }
            if (contribution.getStatus() == ContributionStatus.TERMINATED) {
                total = total.add(terminatedShare(lot, contribution));
            } else {
                total = total.add(contribution.getQuantity());
            }
        }
        return total;
    }

    /**
     * A terminated contribution keeps holding only the units production used.
     * When the split cannot be computed the whole quantity is held.
     */
    private BigDecimal terminatedShare(LotLedger lot, ContributionLedgerEntry contribution) {
        ReconciliationOutcome<UsageSplit> split = usageSplitter.split(lot, contribution);
        if (!split.isSuccess()) {
            log.warn("Usage of terminated contribution {} unavailable ({}), counting full quantity",
                    contribution.getContributionId(), split);
            return contribution.getQuantity();
        }
        UsageSplit usage = split.value().orElseThrow();
        if (usage.getMaterialType() == MaterialType.METAL) {
            return WeightMath.divideByWeight(usage.getUsedWeight(), lot.getUnitWeight());
        }
        return BigDecimal.valueOf(usage.getUsedQuantity()).min(contribution.getQuantity());
    }
}
