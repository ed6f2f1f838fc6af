package com.preciousledger.domain.model;

/**
 * Kind of material a precious item is made of.
 *
 * METAL lots are reconciled by weight, STONE lots by unit count.
 */
public enum MaterialType {
    METAL,
    STONE
}
