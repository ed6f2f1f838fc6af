package com.preciousledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Automatically generated contribution proposals for a contract.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContributionPlan {

    private UUID contractId;
    private UUID businessId;
    private boolean fulfillable;
    private List<ContributionProposal> proposals;

    /** Weight still uncovered per requirement line, in bill-of-materials order. */
    private List<BigDecimal> shortfalls;
}
