package com.preciousledger.api;

import com.preciousledger.domain.exception.AllocationRejectedException;
import com.preciousledger.domain.model.ContributionCommitResult;
import com.preciousledger.domain.model.ContributionSubmission;
import com.preciousledger.domain.model.ReconciliationError;
import com.preciousledger.domain.model.ReconciliationOutcome;
import com.preciousledger.domain.model.UsageSplit;
import com.preciousledger.domain.service.ContributionCommitService;
import com.preciousledger.domain.service.ContributionPlanningService;
import com.preciousledger.domain.service.InventoryReconciliationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ContributionController.class)
class ContributionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean private ContributionCommitService commitService;
    @MockBean private ContributionPlanningService planningService;
    @MockBean private InventoryReconciliationService reconciliationService;

    @Test
    void submit_accepted_is201() throws Exception {
        UUID submissionId = UUID.randomUUID();
        when(commitService.commit(any(ContributionSubmission.class))).thenReturn(ContributionCommitResult.builder()
                .submissionId(submissionId)
                .status(ContributionCommitResult.CommitStatus.ACCEPTED)
                .contributionIds(List.of(UUID.randomUUID()))
                .processedAt(Instant.now())
                .build());

        mockMvc.perform(post("/api/v1/contributions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(submissionId)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("ACCEPTED"));
    }

    @Test
    void submit_rejected_is422WithResult() throws Exception {
        UUID submissionId = UUID.randomUUID();
        when(commitService.commit(any(ContributionSubmission.class))).thenReturn(ContributionCommitResult.builder()
                .submissionId(submissionId)
                .status(ContributionCommitResult.CommitStatus.REJECTED)
                .contributionIds(List.of())
                .rejectionReason(AllocationRejectedException.Reason.INSUFFICIENT_TOTAL)
                .failureReason("Contributions do not cover the contract requirements")
                .processedAt(Instant.now())
                .build());

        mockMvc.perform(post("/api/v1/contributions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(submissionId)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.rejectionReason").value("INSUFFICIENT_TOTAL"));
    }

    @Test
    void submit_withoutLines_is400() throws Exception {
        String body = "{\"submissionId\":\"" + UUID.randomUUID() + "\",\"idempotencyKey\":\"k-1\","
                + "\"businessId\":\"" + UUID.randomUUID() + "\",\"contributionType\":\"POOL\","
                + "\"poolId\":\"" + UUID.randomUUID() + "\",\"lines\":[]}";

        mockMvc.perform(post("/api/v1/contributions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.fieldErrors[0].field").value("lines"));
        verifyNoInteractions(commitService);
    }

    @Test
    void usage_failedSplit_is409() throws Exception {
        UUID contributionId = UUID.randomUUID();
        when(reconciliationService.usage(contributionId)).thenReturn(
                ReconciliationOutcome.<UsageSplit>failure(ReconciliationError.MISSING_MATERIAL_DATA, "no unit weight"));

        mockMvc.perform(get("/api/v1/contributions/{id}/usage", contributionId))
                .andExpect(status().isConflict());
    }

    private String body(UUID submissionId) {
        return "{\"submissionId\":\"" + submissionId + "\",\"idempotencyKey\":\"k-" + submissionId + "\","
                + "\"businessId\":\"" + UUID.randomUUID() + "\",\"contributionType\":\"CONTRACT\","
                + "\"contractId\":\"" + UUID.randomUUID() + "\","
                + "\"lines\":[{\"lotId\":\"" + UUID.randomUUID() + "\",\"quantity\":2}]}";
    }
}
