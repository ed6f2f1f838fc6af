package com.preciousledger.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a purchase or sale lot.
 */
public enum LotStatus {
    PENDING,
    REJECTED,
    CONFIRMED,
    COMPLETED,
    APPROVED,
    PENDING_SELLER_PRICE,
    PENDING_INVESTOR_CONFIRMATION;

    /**
     * Sale statuses that still hold quantity of the parent purchase lot.
     */
    public static final Set<LotStatus> SALE_RESERVING = EnumSet.of(
            PENDING, APPROVED, COMPLETED, PENDING_SELLER_PRICE, PENDING_INVESTOR_CONFIRMATION);

    /**
     * Purchase statuses from which quantity may be sold or contributed.
     */
    public static final Set<LotStatus> ALLOCATABLE = EnumSet.of(APPROVED, COMPLETED);
}
