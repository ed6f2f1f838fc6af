package com.preciousledger.domain.exception;

import com.preciousledger.domain.model.RequirementKey;
import lombok.Getter;

/**
 * A proposed sale or contribution breaks an allocation rule.
 *
 * Extends {@link IllegalStateException} so callers that treat business rule
 * failures as non-retryable keep doing so.
 */
@Getter
public class AllocationRejectedException extends IllegalStateException {

    private final Reason reason;
    private final RequirementKey requirementKey;

    public AllocationRejectedException(Reason reason, String message) {
        this(reason, message, null);
    }

    public AllocationRejectedException(Reason reason, String message, RequirementKey requirementKey) {
        super(message);
        this.reason = reason;
        this.requirementKey = requirementKey;
    }

    public enum Reason {
        MATERIAL_MISMATCH,
        EXCEEDS_LIMIT,
        INSUFFICIENT_TOTAL,
        MISSING_MATERIAL_DATA,
        INVALID_QUANTITY,
        EXCEEDS_AVAILABLE_QUANTITY,
        LOT_NOT_ELIGIBLE,
        TARGET_NOT_OPEN,
        TARGET_ACHIEVED,
        BELOW_MINIMUM
    }
}
