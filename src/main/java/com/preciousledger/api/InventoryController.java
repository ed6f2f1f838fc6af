package com.preciousledger.api;

import com.preciousledger.domain.model.LotAvailability;
import com.preciousledger.domain.service.InventoryReconciliationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read API for lot availability.
 */
@RestController
@RequestMapping("/api/v1/lots")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryReconciliationService reconciliationService;

    /**
     * GET /api/v1/lots/{lotId}/availability
     */
    @GetMapping("/{lotId}/availability")
    public ResponseEntity<LotAvailability> availability(@PathVariable UUID lotId) {
        return ResponseEntity.ok(reconciliationService.availability(lotId));
    }

    /**
     * GET /api/v1/lots/{lotId}/sale-capacity?quantity=3
     *
     * 200 with the current availability when the sale fits, 422 otherwise.
     */
    @GetMapping("/{lotId}/sale-capacity")
    public ResponseEntity<LotAvailability> saleCapacity(@PathVariable UUID lotId,
                                                        @RequestParam BigDecimal quantity) {
        return ResponseEntity.ok(reconciliationService.checkSaleCapacity(lotId, quantity));
    }
}
