package com.preciousledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A not yet persisted contribution of {@code quantity} units from a lot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContributionProposal {

    private UUID lotId;
    private MaterialSpec material;
    private BigDecimal quantity;
}
