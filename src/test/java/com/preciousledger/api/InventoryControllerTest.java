package com.preciousledger.api;

import com.preciousledger.domain.exception.AllocationRejectedException;
import com.preciousledger.domain.model.LotAvailability;
import com.preciousledger.domain.model.LotStatus;
import com.preciousledger.domain.model.MaterialType;
import com.preciousledger.domain.model.RequestType;
import com.preciousledger.domain.service.InventoryReconciliationService;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.UUID;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InventoryController.class)
class InventoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InventoryReconciliationService reconciliationService;

    @Test
    void availability_returnsRemainingQuantityAndWeight() throws Exception {
        UUID lotId = UUID.randomUUID();
        when(reconciliationService.availability(lotId)).thenReturn(LotAvailability.builder()
                .lotId(lotId)
                .requestType(RequestType.PURCHASE)
                .status(LotStatus.COMPLETED)
                .materialType(MaterialType.METAL)
                .requestedQuantity(new BigDecimal("5.00"))
                .remainingQuantity(new BigDecimal("1.50"))
                .remainingWeight(new BigDecimal("15.00"))
                .build());

        mockMvc.perform(get("/api/v1/lots/{lotId}/availability", lotId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.remainingQuantity").value(1.5))
                .andExpect(jsonPath("$.remainingWeight").value(15.0))
                .andExpect(jsonPath("$.materialType").value("METAL"));
    }

    @Test
    void availability_unknownLot_is404() throws Exception {
        UUID lotId = UUID.randomUUID();
        when(reconciliationService.availability(lotId))
                .thenThrow(new EntityNotFoundException("Purchase lot not found: " + lotId));

        mockMvc.perform(get("/api/v1/lots/{lotId}/availability", lotId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    void saleCapacity_overRemaining_is422WithReason() throws Exception {
        UUID lotId = UUID.randomUUID();
        when(reconciliationService.checkSaleCapacity(lotId, new BigDecimal("6")))
                .thenThrow(new AllocationRejectedException(AllocationRejectedException.Reason.EXCEEDS_AVAILABLE_QUANTITY,
                        "Requested quantity exceeds the available quantity from the original purchase (only 5.00 remaining)."));

        mockMvc.perform(get("/api/v1/lots/{lotId}/sale-capacity", lotId).param("quantity", "6"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("EXCEEDS_AVAILABLE_QUANTITY"))
                .andExpect(jsonPath("$.path").value("/api/v1/lots/" + lotId + "/sale-capacity"));
    }

    @Test
    void saleCapacity_missingQuantity_is400() throws Exception {
        mockMvc.perform(get("/api/v1/lots/{lotId}/sale-capacity", UUID.randomUUID()))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(reconciliationService);
    }
}
