package com.preciousledger.domain.service;

import com.preciousledger.domain.model.ContractStatus;
import com.preciousledger.domain.model.ContributionLedgerEntry;
import com.preciousledger.domain.model.LotLedger;
import com.preciousledger.domain.model.LotStatus;
import com.preciousledger.domain.model.RequestType;
import com.preciousledger.domain.model.UnitLedgerEntry;
import com.preciousledger.infrastructure.persistence.entity.PurchaseLotEntity;
import com.preciousledger.infrastructure.persistence.repository.ContractUnitHistoryRepository;
import com.preciousledger.infrastructure.persistence.repository.ContributionRepository;
import com.preciousledger.infrastructure.persistence.repository.ProductionAllocationRepository;
import com.preciousledger.infrastructure.persistence.repository.PurchaseLotRepository;
import com.preciousledger.infrastructure.persistence.repository.UnitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Loads {@link LotLedger} snapshots for the reconciliation engine.
 *
 * The number of queries is fixed (seven) whatever the number of lots or
 * units: each query covers all requested lots and aggregates per unit in the
 * database.
 *
 * Runs inside the caller's transaction so that a commit holding lot locks
 * reads the ledger under those locks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LotLedgerService {

    private final PurchaseLotRepository purchaseLotRepository;
    private final UnitRepository unitRepository;
    private final ContributionRepository contributionRepository;
    private final ProductionAllocationRepository productionAllocationRepository;
    private final ContractUnitHistoryRepository historyRepository;

    @Transactional(readOnly = true)
    public Optional<LotLedger> load(UUID lotId) {
        return Optional.ofNullable(loadAll(List.of(lotId), false).get(lotId));
    }

    /**
     * @param includeDeleted whether soft-deleted rows take part in the snapshot
     * @return ledgers keyed by lot id, in the order of {@code lotIds}; unknown ids are absent
     */
    @Transactional(readOnly = true)
    public Map<UUID, LotLedger> loadAll(Collection<UUID> lotIds, boolean includeDeleted) {
        Map<UUID, LotLedger> ledgers = new LinkedHashMap<>();
        if (lotIds.isEmpty()) {
            return ledgers;
        }

        Map<UUID, PurchaseLotEntity> lots = new HashMap<>();
        for (PurchaseLotEntity lot : purchaseLotRepository.findWithItemByIdIn(lotIds, includeDeleted)) {
            lots.put(lot.getLotId(), lot);
        }
        if (lots.isEmpty()) {
            return ledgers;
        }
        Collection<UUID> found = lots.keySet();

        Map<UUID, BigDecimal> sold = new HashMap<>();
        purchaseLotRepository.sumSoldQuantities(found, RequestType.SALE, LotStatus.SALE_RESERVING, includeDeleted)
                .forEach(row -> sold.put(row.getLotId(), row.getQuantity()));

        Map<UUID, List<ContributionLedgerEntry>> contributions = new HashMap<>();
        contributionRepository.findByLotIds(found, includeDeleted)
                .forEach(row -> contributions.computeIfAbsent(row.getLotId(), id -> new ArrayList<>())
                        .add(toContributionEntry(row)));

        Map<UUID, ProductionAllocationRepository.UnitConsumptionView> direct = new HashMap<>();
        productionAllocationRepository.sumDirectConsumption(found, includeDeleted)
                .forEach(row -> direct.put(row.getUnitId(), row));

        Map<UUID, ProductionAllocationRepository.UnitConsumptionView> viaHistory = new HashMap<>();
        productionAllocationRepository.sumHistoryConsumption(found, includeDeleted)
                .forEach(row -> viaHistory.put(row.getUnitId(), row));

        Map<UUID, Map<UUID, ContractStatus>> historyContracts = new HashMap<>();
        historyRepository.findContractsByLotIds(found, includeDeleted)
                .forEach(row -> historyContracts.computeIfAbsent(row.getUnitId(), id -> new HashMap<>())
                        .put(row.getContractId(), row.getContractStatus()));

        Map<UUID, List<UnitLedgerEntry>> units = new HashMap<>();
        for (UnitRepository.UnitPointerView row : unitRepository.findPointersByLotIds(found, includeDeleted)) {
            units.computeIfAbsent(row.getLotId(), id -> new ArrayList<>())
                    .add(toUnitEntry(row, direct.get(row.getUnitId()), viaHistory.get(row.getUnitId()),
                            historyContracts.getOrDefault(row.getUnitId(), Map.of())));
        }

        for (UUID lotId : lotIds) {
            PurchaseLotEntity lot = lots.get(lotId);
            if (lot == null) {
                continue;
            }
            ledgers.put(lotId, LotLedger.builder()
                    .lotId(lotId)
                    .businessId(lot.getBusinessId())
                    .requestType(lot.getRequestType())
                    .status(lot.getStatus())
                    .requestedQuantity(lot.getRequestedQuantity())
                    .material(lot.getPreciousItem().toMaterialSpec())
                    .totalSold(sold.getOrDefault(lotId, BigDecimal.ZERO))
                    .contributions(contributions.getOrDefault(lotId, List.of()))
                    .units(units.getOrDefault(lotId, List.of()))
                    .build());
        }

        log.debug("Loaded {} lot ledgers ({} requested)", ledgers.size(), lotIds.size());
        return ledgers;
    }

    static ContributionLedgerEntry toContributionEntry(ContributionRepository.ContributionView row) {
        return ContributionLedgerEntry.builder()
                .contributionId(row.getContributionId())
                .lotId(row.getLotId())
                .quantity(row.getQuantity())
                .contributionType(row.getContributionType())
                .status(row.getStatus())
                .contractId(row.getContractId())
                .poolId(row.getPoolId())
                .build();
    }

    private UnitLedgerEntry toUnitEntry(UnitRepository.UnitPointerView row,
                                        ProductionAllocationRepository.UnitConsumptionView direct,
                                        ProductionAllocationRepository.UnitConsumptionView viaHistory,
                                        Map<UUID, ContractStatus> historyContracts) {
        return UnitLedgerEntry.builder()
                .unitId(row.getUnitId())
                .serialNumber(row.getSerialNumber())
                .saleLotId(row.getSaleLotId())
                .poolId(row.getPoolId())
                .contractId(row.getContractId())
                .contractStatus(row.getContractStatus())
                .historyContracts(historyContracts)
                .directConsumedWeight(direct == null ? BigDecimal.ZERO : WeightMath.orZero(direct.getConsumedWeight()))
                .historyConsumedWeight(viaHistory == null ? BigDecimal.ZERO : WeightMath.orZero(viaHistory.getConsumedWeight()))
                .productionAllocationCount(count(direct) + count(viaHistory))
                .build();
    }

    private long count(ProductionAllocationRepository.UnitConsumptionView view) {
        return view == null || view.getAllocationCount() == null ? 0L : view.getAllocationCount();
    }
}
