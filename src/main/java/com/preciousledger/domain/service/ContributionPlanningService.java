package com.preciousledger.domain.service;

import com.preciousledger.domain.model.ContributionPlan;
import com.preciousledger.domain.model.LotLedger;
import com.preciousledger.domain.model.LotStatus;
import com.preciousledger.domain.model.RequestType;
import com.preciousledger.domain.model.RequirementLine;
import com.preciousledger.infrastructure.persistence.entity.ContractMaterialLineEntity;
import com.preciousledger.infrastructure.persistence.repository.CoOwnershipContractRepository;
import com.preciousledger.infrastructure.persistence.repository.ContractMaterialLineRepository;
import com.preciousledger.infrastructure.persistence.repository.PurchaseLotRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Proposes which of a business's purchase lots could fund a contract.
 * Nothing is reserved: the plan has to be submitted and committed like any
 * manual submission.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContributionPlanningService {

    private final CoOwnershipContractRepository contractRepository;
    private final ContractMaterialLineRepository materialLineRepository;
    private final PurchaseLotRepository purchaseLotRepository;
    private final LotLedgerService lotLedgerService;
    private final ContributionPlanner contributionPlanner;

    @Transactional(readOnly = true)
    public ContributionPlan planForContract(UUID contractId, UUID businessId) {
        if (!contractRepository.existsById(contractId)) {
            throw new EntityNotFoundException("Contract not found: " + contractId);
        }

        List<RequirementLine> lines = materialLineRepository.findByContractContractIdOrderByLineNumberAsc(contractId)
                .stream()
                .map(ContractMaterialLineEntity::toRequirementLine)
                .collect(Collectors.toList());

        List<UUID> lotIds = purchaseLotRepository.findLotIdsOwnedBy(
                businessId, RequestType.PURCHASE, LotStatus.ALLOCATABLE, false);
        List<LotLedger> candidates = new ArrayList<>(lotLedgerService.loadAll(lotIds, false).values());

        ContributionPlan plan = contributionPlanner.plan(contractId, businessId, lines, candidates);
        if (!plan.isFulfillable()) {
            log.info("Business {} does not hold enough material for contract {}, short by {}",
                    businessId, contractId, plan.getShortfalls());
        }
        return plan;
    }
}
