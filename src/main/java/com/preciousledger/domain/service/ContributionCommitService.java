package com.preciousledger.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.preciousledger.domain.exception.AllocationRejectedException;
import com.preciousledger.domain.exception.AllocationRejectedException.Reason;
import com.preciousledger.domain.model.ContributionCommitResult;
import com.preciousledger.domain.model.ContributionProposal;
import com.preciousledger.domain.model.ContributionStatus;
import com.preciousledger.domain.model.ContributionSubmission;
import com.preciousledger.domain.model.ContributionType;
import com.preciousledger.domain.model.LotLedger;
import com.preciousledger.domain.model.LotStatus;
import com.preciousledger.domain.model.MaterialRequirements;
import com.preciousledger.domain.model.RequestType;
import com.preciousledger.infrastructure.persistence.entity.CoOwnershipContractEntity;
import com.preciousledger.infrastructure.persistence.entity.ContractMaterialLineEntity;
import com.preciousledger.infrastructure.persistence.entity.ContributionEntity;
import com.preciousledger.infrastructure.persistence.entity.OutboxEventEntity;
import com.preciousledger.infrastructure.persistence.entity.PoolEntity;
import com.preciousledger.infrastructure.persistence.entity.PurchaseLotEntity;
import com.preciousledger.infrastructure.persistence.repository.CoOwnershipContractRepository;
import com.preciousledger.infrastructure.persistence.repository.ContractMaterialLineRepository;
import com.preciousledger.infrastructure.persistence.repository.ContributionRepository;
import com.preciousledger.infrastructure.persistence.repository.OutboxEventRepository;
import com.preciousledger.infrastructure.persistence.repository.PoolRepository;
import com.preciousledger.infrastructure.persistence.repository.PurchaseLotRepository;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Commits contribution submissions against purchase lots.
 *
 * Processing Flow:
 * 1. Check idempotency (a redelivered submission gets the cached result)
 * 2. Lock every lot involved, in ascending id order (pessimistic locking)
 * 3. Check idempotency again under the locks
 * 4. Reload the lots' ledgers under the locks and check remaining quantity
 * 5. Lock the target contract or pool and validate against its requirements
 * 6. Insert the contributions (and assign the investor to a contract)
 * 7. Create outbox event and idempotency record
 * 8. Commit (all or nothing)
 *
 * Failure Handling:
 * - Rule violations: REJECTED result, nothing written
 * - Unknown lot, contract or pool: REJECTED result
 * - Failures while writing: exception, transaction rolled back
 * - Lock timeouts, deadlocks, version conflicts, a key accepted concurrently:
 *   retried with exponential backoff
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContributionCommitService {

    static final String EVENT_COMMITTED = "CONTRIBUTION_COMMITTED";

    private final PurchaseLotRepository purchaseLotRepository;
    private final ContributionRepository contributionRepository;
    private final CoOwnershipContractRepository contractRepository;
    private final ContractMaterialLineRepository materialLineRepository;
    private final PoolRepository poolRepository;
    private final OutboxEventRepository outboxEventRepository;
    private final LotLedgerService lotLedgerService;
    private final ReconciliationEngine reconciliationEngine;
    private final RequirementAggregator requirementAggregator;
    private final ContributionValidator contributionValidator;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Transactional
    @Retry(name = "contributionCommit")
    public ContributionCommitResult commit(ContributionSubmission submission) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Map<UUID, PurchaseLotEntity> lockedLots = new TreeMap<>();
        CoOwnershipContractEntity contract = null;
        PoolEntity pool = null;

        // every rule is checked before the first write
        try {
            Optional<ContributionCommitResult> cached = idempotencyService.findAccepted(submission.getIdempotencyKey());
            if (cached.isPresent()) {
                return duplicate(submission, cached.get());
            }

            checkTarget(submission);
            Map<UUID, BigDecimal> quantityByLot = quantityByLot(submission);

            for (UUID lotId : quantityByLot.keySet()) {
                PurchaseLotEntity lot = purchaseLotRepository.findByIdForUpdate(lotId)
                        .orElseThrow(() -> new IllegalArgumentException("Purchase lot not found: " + lotId));
                lockedLots.put(lotId, lot);
            }

            // a concurrent commit under the same key holds the same lot locks, so it has finished by now
            cached = idempotencyService.findAccepted(submission.getIdempotencyKey());
            if (cached.isPresent()) {
                return duplicate(submission, cached.get());
            }

            Map<UUID, LotLedger> ledgers = lotLedgerService.loadAll(quantityByLot.keySet(), false);
            for (Map.Entry<UUID, BigDecimal> entry : quantityByLot.entrySet()) {
                LotLedger ledger = ledgers.get(entry.getKey());
                if (ledger == null) {
                    throw new IllegalArgumentException("Purchase lot not found: " + entry.getKey());
                }
                checkCapacity(ledger, entry.getValue());
            }

            List<ContributionProposal> proposals = submission.getLines().stream()
                    .map(line -> ContributionProposal.builder()
                            .lotId(line.getLotId())
                            .material(ledgers.get(line.getLotId()).getMaterial())
                            .quantity(line.getQuantity())
                            .build())
                    .collect(Collectors.toList());

            if (submission.getContributionType() == ContributionType.CONTRACT) {
                contract = lockOpenContract(submission.getContractId());
                List<ContractMaterialLineEntity> lines =
                        materialLineRepository.findByContractContractIdOrderByLineNumberAsc(contract.getContractId());
                MaterialRequirements requirements = requirementAggregator.forContract(lines.stream()
                        .map(ContractMaterialLineEntity::toRequirementLine)
                        .collect(Collectors.toList()));
                contributionValidator.validateContributions(requirements, proposals);
            } else {
                pool = lockOpenPool(submission.getPoolId());
                BigDecimal pledged = contributionRepository.sumPledgedPoolWeight(
                        pool.getPoolId(), ContributionStatus.REJECTED, false);
                MaterialRequirements requirements = requirementAggregator.forPool(
                        pool.toMaterialSpec(), pool.getTargetWeight(), pledged);
                contributionValidator.validatePoolContribution(
                        requirements, pool.getMinimumInvestmentWeight(), proposals);
            }

        } catch (ConcurrencyFailureException e) {
            log.warn("Lock conflict committing submission {}: {}", submission.getSubmissionId(), e.getMessage());
            countResult("conflict", submission.getContributionType());
            throw e;

        } catch (IllegalArgumentException | IllegalStateException e) {
            log.warn("Contribution submission {} rejected: {}", submission.getSubmissionId(), e.getMessage());
            countResult("rejected", submission.getContributionType());

            return resultFor(submission)
                    .status(ContributionCommitResult.CommitStatus.REJECTED)
                    .contributionIds(List.of())
                    .rejectionReason(e instanceof AllocationRejectedException
                            ? ((AllocationRejectedException) e).getReason() : null)
                    .failureReason(e.getMessage())
                    .build();

        } catch (Exception e) {
            log.error("Error committing contribution submission {}: {}", submission.getSubmissionId(), e.getMessage(), e);
            countResult("error", submission.getContributionType());
            throw new RuntimeException("Contribution commit failed", e);
        }

        // any failure from here on rolls the whole transaction back
        try {
            ContributionCommitResult result = writeAccepted(submission, lockedLots, contract, pool);

            sample.stop(Timer.builder("allocation.contribution.commit.latency")
                    .tag("type", submission.getContributionType().name())
                    .register(meterRegistry));
            countResult("accepted", submission.getContributionType());

            log.info("Contribution submission {} accepted: {} contributions from business {} to {} {}",
                    submission.getSubmissionId(), result.getContributionIds().size(), submission.getBusinessId(),
                    submission.getContributionType(),
                    contract != null ? contract.getContractId() : submission.getPoolId());
            return result;

        } catch (ConcurrencyFailureException | DuplicateKeyException e) {
            log.warn("Conflict writing submission {}: {}", submission.getSubmissionId(), e.getMessage());
            countResult("conflict", submission.getContributionType());
            throw e;

        } catch (Exception e) {
            log.error("Error writing contribution submission {}: {}", submission.getSubmissionId(), e.getMessage(), e);
            countResult("error", submission.getContributionType());
            throw new RuntimeException("Contribution commit failed", e);
        }
    }

    private ContributionCommitResult writeAccepted(ContributionSubmission submission,
                                                   Map<UUID, PurchaseLotEntity> lockedLots,
                                                   CoOwnershipContractEntity contract,
                                                   PoolEntity pool) throws JsonProcessingException {
        List<UUID> contributionIds = new ArrayList<>();
        for (ContributionSubmission.Line line : submission.getLines()) {
            ContributionEntity contribution = contributionRepository.save(ContributionEntity.builder()
                    .purchaseLot(lockedLots.get(line.getLotId()))
                    .businessId(submission.getBusinessId())
                    .quantity(line.getQuantity())
                    .contributionType(submission.getContributionType())
                    .contract(contract)
                    .pool(pool)
                    .status(ContributionStatus.PENDING)
                    .submissionId(submission.getSubmissionId())
                    .build());
            contributionIds.add(contribution.getContributionId());
        }

        if (contract != null) {
            contract.assignInvestor(submission.getBusinessId());
            contractRepository.save(contract);
        }

        ContributionCommitResult result = resultFor(submission)
                .status(ContributionCommitResult.CommitStatus.ACCEPTED)
                .contributionIds(contributionIds)
                .build();

        outboxEventRepository.save(OutboxEventEntity.builder()
                .eventType(EVENT_COMMITTED)
                .aggregateType("SUBMISSION")
                .aggregateId(submission.getSubmissionId().toString())
                .payload(objectMapper.writeValueAsString(result))
                .build());

        idempotencyService.recordAccepted(submission.getIdempotencyKey(), result);
        return result;
    }

    private ContributionCommitResult duplicate(ContributionSubmission submission, ContributionCommitResult cached) {
        log.info("Duplicate contribution submission detected: {}", submission.getSubmissionId());
        countResult("duplicate", submission.getContributionType());
        return cached;
    }

    private void checkTarget(ContributionSubmission submission) {
        if (submission.getLines() == null || submission.getLines().isEmpty()) {
            throw new IllegalArgumentException("Submission has no contribution lines");
        }
        ContributionType type = submission.getContributionType();
        if (type == null) {
            throw new IllegalArgumentException("Submission has no contribution type");
        }
        if (type == ContributionType.CONTRACT && submission.getContractId() == null) {
            throw new IllegalArgumentException("Contract contribution without contract id");
        }
        if (type == ContributionType.POOL && submission.getPoolId() == null) {
            throw new IllegalArgumentException("Pool contribution without pool id");
        }
        if (type == ContributionType.PRODUCTION_PAYMENT) {
            throw new IllegalArgumentException("Production payment contributions are recorded by the payment flow");
        }
    }

    private Map<UUID, BigDecimal> quantityByLot(ContributionSubmission submission) {
        // sorted, so locks are always taken in the same order
        Map<UUID, BigDecimal> quantities = new TreeMap<>();
        for (ContributionSubmission.Line line : submission.getLines()) {
            if (line.getQuantity() == null || line.getQuantity().signum() <= 0) {
                throw new AllocationRejectedException(Reason.INVALID_QUANTITY,
                        "Contribution quantity must be greater than zero for lot " + line.getLotId());
            }
            quantities.merge(line.getLotId(), line.getQuantity(), BigDecimal::add);
        }
        return quantities;
    }

    private void checkCapacity(LotLedger ledger, BigDecimal requested) {
        if (ledger.getRequestType() != RequestType.PURCHASE || !LotStatus.ALLOCATABLE.contains(ledger.getStatus())) {
            throw new AllocationRejectedException(Reason.LOT_NOT_ELIGIBLE,
                    "Lot " + ledger.getLotId() + " is not an approved or completed purchase");
        }
        if (ledger.getMaterial() == null || !ledger.getMaterial().hasUnitWeight()) {
            throw new AllocationRejectedException(Reason.MISSING_MATERIAL_DATA,
                    "Lot " + ledger.getLotId() + " has no recorded unit weight");
        }
        BigDecimal remaining = reconciliationEngine.remainingQuantity(ledger);
        if (requested.compareTo(remaining) > 0) {
            throw new AllocationRejectedException(Reason.EXCEEDS_AVAILABLE_QUANTITY,
                    "Requested quantity exceeds the available quantity of lot " + ledger.getLotId()
                            + " (only " + remaining + " remaining).");
        }
    }

    private CoOwnershipContractEntity lockOpenContract(UUID contractId) {
        CoOwnershipContractEntity contract = contractRepository.findByIdForUpdate(contractId)
                .orElseThrow(() -> new IllegalArgumentException("Contract not found: " + contractId));
        if (!contract.isAwaitingInvestor()
                || contributionRepository.countContractContributions(contractId, ContributionStatus.REJECTED, false) > 0) {
            throw new AllocationRejectedException(Reason.TARGET_NOT_OPEN,
                    "Contract " + contractId + " already has an investor assigned");
        }
        return contract;
    }

    private PoolEntity lockOpenPool(UUID poolId) {
        PoolEntity pool = poolRepository.findByIdForUpdate(poolId)
                .orElseThrow(() -> new IllegalArgumentException("Pool not found: " + poolId));
        if (!pool.isOpen()) {
            throw new AllocationRejectedException(Reason.TARGET_NOT_OPEN, "Pool " + poolId + " is closed");
        }
        return pool;
    }

    private ContributionCommitResult.ContributionCommitResultBuilder resultFor(ContributionSubmission submission) {
        return ContributionCommitResult.builder()
                .submissionId(submission.getSubmissionId())
                .businessId(submission.getBusinessId())
                .contributionType(submission.getContributionType())
                .contractId(submission.getContractId())
                .poolId(submission.getPoolId())
                .processedAt(Instant.now());
    }

    private void countResult(String result, ContributionType type) {
        Counter.builder("allocation.contribution.commit")
                .tag("result", result)
                .tag("type", type == null ? "UNKNOWN" : type.name())
                .register(meterRegistry)
                .increment();
    }
}
