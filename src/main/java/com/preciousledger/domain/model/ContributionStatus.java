package com.preciousledger.domain.model;

import java.util.EnumSet;
import java.util.Set;

public enum ContributionStatus {
    PENDING,
    ADMIN_APPROVED,
    APPROVED,
    TERMINATED,
    REJECTED;

    /** Statuses that consume quantity of the contributed lot. */
    public static final Set<ContributionStatus> CONSUMING = EnumSet.of(
            PENDING, ADMIN_APPROVED, APPROVED, TERMINATED);
}
