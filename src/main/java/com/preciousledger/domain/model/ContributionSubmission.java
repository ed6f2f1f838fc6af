package com.preciousledger.domain.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Request to contribute units from one or more purchase lots to a pool or to
 * a co-ownership contract.
 *
 * This is the input event that triggers an allocation commit, received over
 * REST or Kafka.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContributionSubmission {

    @NotNull
    private UUID submissionId;

    @NotBlank
    private String idempotencyKey;

    @NotNull
    private UUID businessId;

    @NotNull
    private ContributionType contributionType;

    private UUID contractId;
    private UUID poolId;

    @NotEmpty
    @Valid
    private List<Line> lines;

    private Instant timestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Line {

        @NotNull
        private UUID lotId;

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal quantity;
    }
}
