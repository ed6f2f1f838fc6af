package com.preciousledger.domain.model;

public enum ContributionType {
    POOL,
    CONTRACT,
    PRODUCTION_PAYMENT
}
