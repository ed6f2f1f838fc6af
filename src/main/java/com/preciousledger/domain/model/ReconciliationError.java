package com.preciousledger.domain.model;

public enum ReconciliationError {
    MISSING_MATERIAL_DATA,
    UNSUPPORTED_MATERIAL,
    COMPUTATION_FAILED
}
