package com.preciousledger.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a co-ownership (Musharakah) contract.
 */
public enum ContractStatus {
    NOT_ASSIGNED,
    ACTIVE,
    COMPLETED,
    TERMINATED,
    RENEW,
    CLOSED,
    UNDER_TERMINATION;

    /** A unit held by a contract in one of these statuses is locked. */
    public static final Set<ContractStatus> HOLDING = EnumSet.of(ACTIVE, RENEW, UNDER_TERMINATION);

    public boolean holdsUnits() {
        return HOLDING.contains(this);
    }
}
