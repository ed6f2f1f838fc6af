package com.preciousledger.domain.model;

public enum RequestType {
    PURCHASE,
    SALE,
    JEWELRY_DESIGN
}
