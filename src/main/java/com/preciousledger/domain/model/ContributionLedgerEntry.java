package com.preciousledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContributionLedgerEntry {

    private UUID contributionId;
    private UUID lotId;
    private BigDecimal quantity;
    private ContributionType contributionType;
    private ContributionStatus status;
    private UUID contractId;
    private UUID poolId;
}
