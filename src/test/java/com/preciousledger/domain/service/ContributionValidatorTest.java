package com.preciousledger.domain.service;

import com.preciousledger.domain.exception.AllocationRejectedException;
import com.preciousledger.domain.exception.AllocationRejectedException.Reason;
import com.preciousledger.domain.model.ContributionProposal;
import com.preciousledger.domain.model.MaterialRequirements;
import com.preciousledger.domain.model.MaterialSpec;
import com.preciousledger.domain.model.RequirementKey;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static com.preciousledger.domain.service.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ContributionValidatorTest {

    private final ContributionValidator validator = new ContributionValidator();

    private static final RequirementKey GOLD_18 = RequirementKey.forRequirement(metal(GOLD, CARAT_18, null));
    private static final RequirementKey GOLD_24 = RequirementKey.forRequirement(metal(GOLD, CARAT_24, null));
    private static final RequirementKey SILVER_ANY = RequirementKey.forRequirement(metal(SILVER, CARAT_21, null));

    @Test
    void metalAssetOfAnyCarat_satisfiesEveryCaratOfItsItem() {
        MaterialRequirements requirements = new MaterialRequirements()
                .require(GOLD_18, new BigDecimal("10.00"))
                .require(GOLD_24, new BigDecimal("10.00"));

        MaterialRequirements left = validator.validateContributions(requirements,
                List.of(proposal(metal(GOLD, CARAT_21, "10"), "2")));

        assertEquals(0, left.get(GOLD_18).signum());
        assertEquals(0, left.get(GOLD_24).signum());
    }

    @Test
    void deduction_drawsFromLargestBucketFirst() {
        MaterialRequirements requirements = new MaterialRequirements()
                .require(GOLD_18, new BigDecimal("4.00"))
                .require(GOLD_24, new BigDecimal("10.00"));

        MaterialRequirements left = validator.deductAll(requirements,
                List.of(proposal(gold("8"), "1")));

        assertEquals(0, left.get(GOLD_18).compareTo(new BigDecimal("4.00")));
        assertEquals(0, left.get(GOLD_24).compareTo(new BigDecimal("2.00")));
    }

    @Test
    void deduction_spillsIntoNextBucket() {
        MaterialRequirements requirements = new MaterialRequirements()
                .require(GOLD_18, new BigDecimal("6.00"))
                .require(GOLD_24, new BigDecimal("10.00"));

        MaterialRequirements left = validator.deductAll(requirements,
                List.of(proposal(gold("12"), "1")));

        assertEquals(0, left.get(GOLD_24).signum());
        assertEquals(0, left.get(GOLD_18).compareTo(new BigDecimal("4.00")));
    }

    @Test
    void partialCoverage_isRejectedAsAWhole() {
        MaterialRequirements requirements = new MaterialRequirements()
                .require(GOLD_24, new BigDecimal("10.00"))
                .require(SILVER_ANY, new BigDecimal("10.00"));

        AllocationRejectedException ex = assertThrows(AllocationRejectedException.class,
                () -> validator.validateContributions(requirements, List.of(
                        proposal(gold("10"), "1"),
                        proposal(metal(SILVER, CARAT_21, "6"), "1"))));

        assertEquals(Reason.INSUFFICIENT_TOTAL, ex.getReason());
        assertEquals(SILVER_ANY, ex.getRequirementKey());
    }

    @Test
    void unknownMaterial_isRejected() {
        MaterialRequirements requirements = new MaterialRequirements().require(GOLD_24, new BigDecimal("10.00"));

        AllocationRejectedException ex = assertThrows(AllocationRejectedException.class,
                () -> validator.validateContributions(requirements,
                        List.of(proposal(metal(PLATINUM, CARAT_24, "10"), "1"))));

        assertEquals(Reason.MATERIAL_MISMATCH, ex.getReason());
        assertEquals(ContributionValidator.MATERIAL_MISMATCH_MESSAGE, ex.getMessage());
    }

    @Test
    void overweightContribution_isRejected() {
        MaterialRequirements requirements = new MaterialRequirements().require(GOLD_24, new BigDecimal("10.00"));

        AllocationRejectedException ex = assertThrows(AllocationRejectedException.class,
                () -> validator.validateContributions(requirements, List.of(proposal(gold("5.5"), "2"))));

        assertEquals(Reason.EXCEEDS_LIMIT, ex.getReason());
    }

    @Test
    void diamonds_mustMatchClarityAndColor() {
        RequirementKey dColor = RequirementKey.forRequirement(diamond(COLOR_D, "0.25"));
        MaterialRequirements requirements = new MaterialRequirements().require(dColor, new BigDecimal("1.00"));

        assertThrows(AllocationRejectedException.class,
                () -> validator.validateContributions(requirements, List.of(proposal(diamond(COLOR_F, "0.25"), "4"))));

        MaterialRequirements left = validator.validateContributions(requirements,
                List.of(proposal(diamond(COLOR_D, "0.25"), "4")));
        assertEquals(0, left.get(dColor).signum());
    }

    @Test
    void stones_matchOnShapeCut() {
        RequirementKey roundRuby = RequirementKey.forRequirement(ruby(ROUND_CUT, "0.5"));
        MaterialRequirements requirements = new MaterialRequirements().require(roundRuby, new BigDecimal("2.00"));

        AllocationRejectedException ex = assertThrows(AllocationRejectedException.class,
                () -> validator.validateContributions(requirements, List.of(proposal(ruby(OVAL_CUT, "0.5"), "4"))));

        assertEquals(Reason.MATERIAL_MISMATCH, ex.getReason());
    }

    @Test
    void lotWithoutUnitWeight_isAHardError() {
        MaterialRequirements requirements = new MaterialRequirements().require(GOLD_24, new BigDecimal("10.00"));

        AllocationRejectedException ex = assertThrows(AllocationRejectedException.class,
                () -> validator.validateContributions(requirements, List.of(proposal(gold(null), "1"))));

        assertEquals(Reason.MISSING_MATERIAL_DATA, ex.getReason());
    }

    @Test
    void callersRequirements_areLeftUntouched() {
        MaterialRequirements requirements = new MaterialRequirements().require(GOLD_24, new BigDecimal("10.00"));

        validator.validateContributions(requirements, List.of(proposal(gold("10"), "1")));

        assertEquals(0, requirements.get(GOLD_24).compareTo(new BigDecimal("10.00")));
    }

    @Test
    void pool_requiresExactCarat() {
        MaterialRequirements pool = new MaterialRequirements().require(GOLD_24, new BigDecimal("100.00"));

        AllocationRejectedException ex = assertThrows(AllocationRejectedException.class,
                () -> validator.validatePoolContribution(pool, null, List.of(proposal(metal(GOLD, CARAT_18, "10"), "2"))));

        assertEquals(Reason.MATERIAL_MISMATCH, ex.getReason());
        assertEquals(GOLD_18, ex.getRequirementKey());

        MaterialRequirements left = validator.validatePoolContribution(pool, null, List.of(proposal(gold("10"), "2")));
        assertEquals(0, left.get(GOLD_24).compareTo(new BigDecimal("80.00")));
    }

    @Test
    void pool_atTarget_isRejected() {
        MaterialRequirements pool = new MaterialRequirements().require(GOLD_24, BigDecimal.ZERO);

        AllocationRejectedException ex = assertThrows(AllocationRejectedException.class,
                () -> validator.validatePoolContribution(pool, null, List.of(proposal(gold("10"), "1"))));

        assertEquals(Reason.TARGET_ACHIEVED, ex.getReason());
        assertEquals(ContributionValidator.TARGET_ACHIEVED_MESSAGE, ex.getMessage());
    }

    @Test
    void pool_belowMinimumInvestment_isRejected() {
        MaterialRequirements pool = new MaterialRequirements().require(GOLD_24, new BigDecimal("100.00"));

        AllocationRejectedException ex = assertThrows(AllocationRejectedException.class,
                () -> validator.validatePoolContribution(pool, new BigDecimal("25.5"),
                        List.of(proposal(gold("10"), "2"))));

        assertEquals(Reason.BELOW_MINIMUM, ex.getReason());
        assertEquals("Minimum contribution required is 25.5g, but provided weight is 20g", ex.getMessage());
    }

    @Test
    void pool_lessOpenThanMinimum_acceptsTheRemainder() {
        MaterialRequirements pool = new MaterialRequirements().require(GOLD_24, new BigDecimal("15.00"));

        MaterialRequirements left = validator.validatePoolContribution(pool, new BigDecimal("25"),
                List.of(proposal(gold("5"), "2")));

        assertEquals(0, left.get(GOLD_24).compareTo(new BigDecimal("5.00")));
    }

    @Test
    void pool_lessOpenThanMinimum_rejectsMoreThanRemains() {
        MaterialRequirements pool = new MaterialRequirements().require(GOLD_24, new BigDecimal("15.00"));

        AllocationRejectedException ex = assertThrows(AllocationRejectedException.class,
                () -> validator.validatePoolContribution(pool, new BigDecimal("25"),
                        List.of(proposal(gold("10"), "2"))));

        assertEquals(Reason.EXCEEDS_LIMIT, ex.getReason());
        assertEquals("Contribution weight (20g) exceeds remaining target (15g)", ex.getMessage());
    }

    private ContributionProposal proposal(MaterialSpec material, String quantity) {
        return ContributionProposal.builder()
                .lotId(UUID.randomUUID())
                .material(material)
                .quantity(new BigDecimal(quantity))
                .build();
    }
}
