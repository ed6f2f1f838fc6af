package com.preciousledger.domain.model;

import com.preciousledger.domain.exception.AllocationRejectedException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of an allocation commit. Cached under the submission's idempotency
 * key and published as the payload of {@code CONTRIBUTION_COMMITTED} events.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContributionCommitResult {

    private UUID submissionId;
    private UUID businessId;
    private ContributionType contributionType;
    private UUID contractId;
    private UUID poolId;
    private CommitStatus status;
    private List<UUID> contributionIds;
    private AllocationRejectedException.Reason rejectionReason;
    private String failureReason;
    private Instant processedAt;

    public enum CommitStatus {
        ACCEPTED,
        REJECTED
    }
}
