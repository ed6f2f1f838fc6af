package com.preciousledger.api;

import com.preciousledger.domain.model.ContributionCommitResult;
import com.preciousledger.domain.model.ContributionPlan;
import com.preciousledger.domain.model.ContributionSubmission;
import com.preciousledger.domain.model.ReconciliationOutcome;
import com.preciousledger.domain.model.UsageSplit;
import com.preciousledger.domain.service.ContributionCommitService;
import com.preciousledger.domain.service.ContributionPlanningService;
import com.preciousledger.domain.service.InventoryReconciliationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST API for contributions.
 *
 * Submissions can also arrive over Kafka; both paths share the same
 * idempotent commit.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/contributions")
@RequiredArgsConstructor
public class ContributionController {

    private final ContributionCommitService commitService;
    private final ContributionPlanningService planningService;
    private final InventoryReconciliationService reconciliationService;

    /**
     * Submit contributions for commit.
     *
     * POST /api/v1/contributions
     *
     * 201 when accepted, 422 with the same body when rejected.
     */
    @PostMapping
    public ResponseEntity<ContributionCommitResult> submit(@Valid @RequestBody ContributionSubmission submission) {
        log.info("Received contribution submission: {}", submission.getSubmissionId());

        ContributionCommitResult result = commitService.commit(submission);
        HttpStatus status = result.getStatus() == ContributionCommitResult.CommitStatus.ACCEPTED
                ? HttpStatus.CREATED
                : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(result);
    }

    /**
     * GET /api/v1/contributions/{contributionId}/usage
     *
     * 200 with the split, or 409 when the split cannot be computed from the
     * recorded material data.
     */
    @GetMapping("/{contributionId}/usage")
    public ResponseEntity<UsageSplit> usage(@PathVariable UUID contributionId) {
        ReconciliationOutcome<UsageSplit> outcome = reconciliationService.usage(contributionId);
        return outcome.value()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).build());
    }

    /**
     * GET /api/v1/contributions/plan?contractId=..&businessId=..
     */
    @GetMapping("/plan")
    public ResponseEntity<ContributionPlan> plan(@RequestParam UUID contractId, @RequestParam UUID businessId) {
        return ResponseEntity.ok(planningService.planForContract(contractId, businessId));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
