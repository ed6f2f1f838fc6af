package com.preciousledger.domain.service;

import com.preciousledger.domain.exception.AllocationRejectedException;
import com.preciousledger.domain.exception.AllocationRejectedException.Reason;
import com.preciousledger.domain.model.ContributionLedgerEntry;
import com.preciousledger.domain.model.LotAvailability;
import com.preciousledger.domain.model.LotLedger;
import com.preciousledger.domain.model.LotStatus;
import com.preciousledger.domain.model.ReconciliationOutcome;
import com.preciousledger.domain.model.RequestType;
import com.preciousledger.domain.model.UsageSplit;
import com.preciousledger.infrastructure.persistence.repository.ContributionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read side of the reconciliation: availability of lots, usage of
 * contributions and sale capacity checks. Every call recomputes from the
 * current ledger; nothing is cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryReconciliationService {

    private final LotLedgerService lotLedgerService;
    private final ReconciliationEngine reconciliationEngine;
    private final ContributionUsageSplitter usageSplitter;
    private final ContributionRepository contributionRepository;
    private final MeterRegistry meterRegistry;

    @Transactional(readOnly = true)
    public LotAvailability availability(UUID lotId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        LotLedger ledger = loadLedger(lotId);
        LotAvailability availability = reconciliationEngine.availability(ledger);
        sample.stop(Timer.builder("allocation.reconciliation.latency")
                .tag("operation", "availability")
                .register(meterRegistry));
        return availability;
    }

    /**
     * Used/unused split of a contribution. A failed outcome means the split
     * could not be computed, not that nothing was used.
     */
    @Transactional(readOnly = true)
    public ReconciliationOutcome<UsageSplit> usage(UUID contributionId) {
        ContributionLedgerEntry contribution = contributionRepository.findViewById(contributionId, false).stream()
                .findFirst()
                .map(LotLedgerService::toContributionEntry)
                .orElseThrow(() -> new EntityNotFoundException("Contribution not found: " + contributionId));

        ReconciliationOutcome<UsageSplit> outcome = usageSplitter.split(loadLedger(contribution.getLotId()), contribution);
        if (!outcome.isSuccess()) {
            log.warn("Usage of contribution {} could not be computed: {}", contributionId, outcome);
        }
        return outcome;
    }

    /**
     * Checks that {@code quantity} units of a purchase lot can still be put up for sale.
     *
     * @throws AllocationRejectedException when the lot is not sellable or has too little left
     */
    @Transactional(readOnly = true)
    public LotAvailability checkSaleCapacity(UUID lotId, BigDecimal quantity) {
        LotLedger ledger = loadLedger(lotId);

        if (ledger.getRequestType() != RequestType.PURCHASE || !LotStatus.ALLOCATABLE.contains(ledger.getStatus())) {
            throw new AllocationRejectedException(Reason.LOT_NOT_ELIGIBLE,
                    "Lot " + lotId + " is not an approved or completed purchase");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new AllocationRejectedException(Reason.INVALID_QUANTITY, "Requested quantity must be greater than zero");
        }

        LotAvailability availability = reconciliationEngine.availability(ledger);
        BigDecimal remaining = availability.getRemainingQuantity();
        if (remaining.signum() <= 0) {
            throw new AllocationRejectedException(Reason.EXCEEDS_AVAILABLE_QUANTITY,
                    "The purchased quantity has already been fully sold or allocated");
        }
        if (quantity.compareTo(remaining) > 0) {
            throw new AllocationRejectedException(Reason.EXCEEDS_AVAILABLE_QUANTITY,
                    "Requested quantity exceeds the available quantity from the original purchase (only "
                            + remaining + " remaining).");
        }
        return availability;
    }

    private LotLedger loadLedger(UUID lotId) {
        return lotLedgerService.load(lotId)
                .orElseThrow(() -> new EntityNotFoundException("Purchase lot not found: " + lotId));
    }
}
