package com.preciousledger.domain.service;

import com.preciousledger.domain.exception.AllocationRejectedException;
import com.preciousledger.domain.exception.AllocationRejectedException.Reason;
import com.preciousledger.domain.model.ContributionProposal;
import com.preciousledger.domain.model.MaterialRequirements;
import com.preciousledger.domain.model.MaterialSpec;
import com.preciousledger.domain.model.RequirementKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Checks proposed contributions against a target's material requirements.
 *
 * Each proposal is matched to its requirement buckets by {@link RequirementKey}
 * (for contracts metal assets ignore carat, so they may match several buckets), its weight
 * must fit in what those buckets still require, and it is then deducted from
 * them. With several metal buckets the one with the most weight outstanding
 * is drawn first.
 *
 * Works on a copy of the requirements; the caller's map is never changed.
 */
@Slf4j
@Component
public class ContributionValidator {

    static final String MATERIAL_MISMATCH_MESSAGE = "The contributed asset does not match any of the required materials.";
    static final String EXCEEDS_LIMIT_MESSAGE = "The asset weight exceeds the required limit for this material.";
    static final String INSUFFICIENT_TOTAL_MESSAGE = "Insufficient assets to meet the contract requirements.";
    static final String TARGET_ACHIEVED_MESSAGE = "The pool has already reached its target weight.";

    /**
     * Validates contributions to a contract. Every requirement must be fully
     * covered once all proposals are deducted, otherwise nothing is accepted.
     *
     * @return the requirements left after deduction, all zero on success
     * @throws AllocationRejectedException on the first rule the proposals break
     */
    public MaterialRequirements validateContributions(MaterialRequirements requirements,
                                                      List<ContributionProposal> proposals) {
        MaterialRequirements remaining = deductAll(requirements, proposals, false);

        for (Map.Entry<RequirementKey, BigDecimal> bucket : remaining.asMap().entrySet()) {
            BigDecimal outstanding = WeightMath.quantize2(bucket.getValue());
            if (outstanding.signum() > 0) {
                log.debug("Requirement {} still short by {}", bucket.getKey(), outstanding);
                throw new AllocationRejectedException(Reason.INSUFFICIENT_TOTAL,
                        INSUFFICIENT_TOTAL_MESSAGE + " Missing " + outstanding + " for " + describe(bucket.getKey()),
                        bucket.getKey());
            }
        }
        return remaining;
    }

    /**
     * Validates contributions to a pool. Unlike contracts a pool names one
     * exact material, so metal must match its carat too. Partial filling is
     * allowed, but not once the target is reached, and a participant must
     * bring at least the pool's minimum weight unless less than that is
     * still open.
     *
     * @param minimumWeight minimum weight per participant, null or zero for none
     * @return the requirements left after deduction
     * @throws AllocationRejectedException on the first rule the proposals break
     */
    public MaterialRequirements validatePoolContribution(MaterialRequirements requirements,
                                                         BigDecimal minimumWeight,
                                                         List<ContributionProposal> proposals) {
        for (ContributionProposal proposal : proposals) {
            checkQuantity(proposal);
        }

        BigDecimal open = WeightMath.quantize2(requirements.asMap().values().stream()
                .map(WeightMath::nonNegative)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
        if (open.signum() <= 0) {
            throw new AllocationRejectedException(Reason.TARGET_ACHIEVED, TARGET_ACHIEVED_MESSAGE);
        }

        if (WeightMath.isPositive(minimumWeight)) {
            BigDecimal offered = WeightMath.quantize2(proposals.stream()
                    .filter(proposal -> proposal.getMaterial() != null && proposal.getMaterial().hasUnitWeight())
                    .map(proposal -> WeightMath.quantize2(
                            proposal.getQuantity().multiply(proposal.getMaterial().getUnitWeight())))
                    .reduce(BigDecimal.ZERO, BigDecimal::add));
            if (open.compareTo(minimumWeight) < 0) {
                // only the last participant may bring less than the minimum
                if (offered.compareTo(open) > 0) {
                    throw new AllocationRejectedException(Reason.EXCEEDS_LIMIT,
                            "Contribution weight (" + grams(offered) + "g) exceeds remaining target ("
                                    + grams(open) + "g)");
                }
            } else if (offered.compareTo(minimumWeight) < 0) {
                throw new AllocationRejectedException(Reason.BELOW_MINIMUM,
                        "Minimum contribution required is " + grams(minimumWeight)
                                + "g, but provided weight is " + grams(offered) + "g");
            }
        }

        return deductAll(requirements, proposals, true);
    }

    /**
     * Deducts proposals from a copy of the requirements without any coverage
     * check. Metal assets may draw from every carat bucket of their item.
     */
    MaterialRequirements deductAll(MaterialRequirements requirements, List<ContributionProposal> proposals) {
        return deductAll(requirements, proposals, false);
    }

    private MaterialRequirements deductAll(MaterialRequirements requirements, List<ContributionProposal> proposals,
                                           boolean exactMatch) {
        MaterialRequirements remaining = requirements.copy();
        for (ContributionProposal proposal : proposals) {
            deduct(remaining, proposal, exactMatch);
        }
        return remaining;
    }

    private void checkQuantity(ContributionProposal proposal) {
        if (proposal.getQuantity() == null || proposal.getQuantity().signum() <= 0) {
            throw new AllocationRejectedException(Reason.INVALID_QUANTITY,
                    "Contribution quantity must be greater than zero for lot " + proposal.getLotId());
        }
    }

    private void deduct(MaterialRequirements remaining, ContributionProposal proposal, boolean exactMatch) {
        MaterialSpec material = proposal.getMaterial();
        checkQuantity(proposal);
        if (material == null || !material.hasUnitWeight()) {
            throw new AllocationRejectedException(Reason.MISSING_MATERIAL_DATA,
                    "Lot " + proposal.getLotId() + " has no recorded unit weight");
        }

        RequirementKey assetKey;
        List<RequirementKey> buckets;
        if (exactMatch) {
            assetKey = RequirementKey.forRequirement(material);
            buckets = remaining.asMap().containsKey(assetKey) ? new ArrayList<>(List.of(assetKey)) : new ArrayList<>();
        } else {
            assetKey = RequirementKey.forAsset(material);
            buckets = remaining.bucketsMatching(assetKey);
        }
        if (buckets.isEmpty()) {
            throw new AllocationRejectedException(Reason.MATERIAL_MISMATCH, MATERIAL_MISMATCH_MESSAGE, assetKey);
        }

        BigDecimal required = WeightMath.quantize2(buckets.stream()
                .map(remaining::get)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
        BigDecimal contributed = WeightMath.quantize2(proposal.getQuantity().multiply(material.getUnitWeight()));

        if (contributed.compareTo(required) > 0) {
            throw new AllocationRejectedException(Reason.EXCEEDS_LIMIT,
                    EXCEEDS_LIMIT_MESSAGE + " Offered " + contributed + ", required " + required, assetKey);
        }

        if (buckets.size() == 1) {
            RequirementKey bucket = buckets.get(0);
            remaining.set(bucket, remaining.get(bucket).subtract(contributed));
            return;
        }

        // stable sort keeps declaration order between equal buckets
        buckets.sort(Comparator.comparing((RequirementKey key) -> remaining.get(key)).reversed());
        BigDecimal toDeduct = contributed;
        for (RequirementKey bucket : buckets) {
            if (toDeduct.signum() <= 0) {
                break;
            }
            BigDecimal available = remaining.get(bucket);
            BigDecimal taken = toDeduct.min(available);
            remaining.set(bucket, available.subtract(taken));
            toDeduct = toDeduct.subtract(taken);
        }
    }

    private String grams(BigDecimal weight) {
        return WeightMath.quantize2(weight).stripTrailingZeros().toPlainString();
    }

    private String describe(RequirementKey key) {
        return key.getMaterialType() + " item " + key.getMaterialItemId();
    }
}
