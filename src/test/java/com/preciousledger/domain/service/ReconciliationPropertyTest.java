package com.preciousledger.domain.service;

import com.preciousledger.domain.model.ContributionLedgerEntry;
import com.preciousledger.domain.model.ContributionStatus;
import com.preciousledger.domain.model.LotLedger;
import com.preciousledger.domain.model.UnitLedgerEntry;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.preciousledger.domain.service.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ReconciliationPropertyTest {

    private final UnitWeightCalculator calculator = new UnitWeightCalculator();
    private final ReconciliationEngine engine =
            new ReconciliationEngine(calculator, new ContributionUsageSplitter(calculator));

    @Property(tries = 200)
    void stoneRemainingStaysWithinRequested(@ForAll @IntRange(min = 0, max = 40) int requested,
                                            @ForAll @IntRange(min = 0, max = 50) int freeUnits,
                                            @ForAll @IntRange(min = 0, max = 10) int soldUnits,
                                            @ForAll @IntRange(min = 0, max = 45) int sold,
                                            @ForAll("contributionStatuses") List<ContributionStatus> statuses) {
        List<UnitLedgerEntry> units = new ArrayList<>(freeUnits(freeUnits));
        for (int i = 0; i < soldUnits; i++) {
            units.add(soldUnit());
        }
        List<ContributionLedgerEntry> contributions = new ArrayList<>();
        for (ContributionStatus status : statuses) {
            contributions.add(contribution(status, "1"));
        }
        LotLedger lot = purchaseLot(ruby(ROUND_CUT, "0.5"), String.valueOf(requested))
                .totalSold(BigDecimal.valueOf(sold))
                .units(units)
                .contributions(contributions)
                .build();

        BigDecimal remaining = engine.remainingQuantity(lot);

        assertTrue(remaining.signum() >= 0);
        assertTrue(remaining.compareTo(BigDecimal.valueOf(requested)) <= 0);
        assertEquals(0, remaining.scale());
    }

    @Property(tries = 100)
    void metalRemainingIsRepeatableAndNeverNegative(@ForAll @IntRange(min = 1, max = 20) int requested,
                                                    @ForAll @IntRange(min = 0, max = 20) int freeUnits,
                                                    @ForAll @IntRange(min = 0, max = 150) int consumedTenths,
                                                    @ForAll("contributionStatuses") List<ContributionStatus> statuses) {
        List<UnitLedgerEntry> units = new ArrayList<>(freeUnits(freeUnits));
        units.add(consumedUnit(BigDecimal.valueOf(consumedTenths, 1).toPlainString()));
        List<ContributionLedgerEntry> contributions = new ArrayList<>();
        for (ContributionStatus status : statuses) {
            contributions.add(contribution(status, "0.5"));
        }
        LotLedger lot = purchaseLot(gold("10"), String.valueOf(requested))
                .units(units)
                .contributions(contributions)
                .build();

        BigDecimal first = engine.remainingQuantity(lot);

        assertEquals(first, engine.remainingQuantity(lot));
        assertTrue(first.signum() >= 0);
        assertEquals(2, first.scale());
    }

    @Provide
    Arbitrary<List<ContributionStatus>> contributionStatuses() {
        return Arbitraries.of(ContributionStatus.class).list().ofMaxSize(8);
    }
}
