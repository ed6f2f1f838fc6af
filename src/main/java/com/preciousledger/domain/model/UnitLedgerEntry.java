package com.preciousledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;

/**
 * Snapshot of one physical unit of a lot, with its allocation pointers and
 * the production weight already drawn from it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnitLedgerEntry {

    private UUID unitId;
    private String serialNumber;

    private UUID saleLotId;
    private UUID poolId;
    private UUID contractId;
    private ContractStatus contractStatus;

    /** Contracts the unit has ever been contributed to, by contract id. */
    @Builder.Default
    private Map<UUID, ContractStatus> historyContracts = Map.of();

    /** Production weight drawn against the unit itself. */
    @Builder.Default
    private BigDecimal directConsumedWeight = BigDecimal.ZERO;

    /** Production weight drawn against the unit's contract history rows. */
    @Builder.Default
    private BigDecimal historyConsumedWeight = BigDecimal.ZERO;

    /** Number of production allocations, direct or through history. */
    private long productionAllocationCount;

    public boolean isUnallocated() {
        return saleLotId == null && poolId == null;
    }

    public boolean isHeldByContract() {
        if (contractStatus != null && contractStatus.holdsUnits()) {
            return true;
        }
        return historyContracts.values().stream().anyMatch(ContractStatus::holdsUnits);
    }

    public boolean isTrulyAvailable() {
        return isUnallocated() && !isHeldByContract();
    }

    public boolean hasProductionAllocation() {
        return productionAllocationCount > 0;
    }

    public boolean hasHistoryFor(UUID contractId) {
        return contractId != null && historyContracts.containsKey(contractId);
    }
}
