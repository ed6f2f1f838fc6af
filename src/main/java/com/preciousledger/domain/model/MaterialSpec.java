package com.preciousledger.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Material description of a precious item or of a requirement line.
 *
 * Metal items carry a carat type, stones carry shape/cut and, for diamonds,
 * clarity and color. {@code unitWeight} is the weight of one unit and is null
 * when no material record exists for the item.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaterialSpec {

    private static final String DIAMOND = "diamond";

    private MaterialType materialType;
    private UUID materialItemId;
    private String materialItemName;
    private UUID caratTypeId;
    private UUID shapeCutId;
    private UUID clarityId;
    private UUID colorId;
    private BigDecimal unitWeight;

    @JsonIgnore
    public boolean isDiamond() {
        return materialType == MaterialType.STONE
                && materialItemName != null
                && DIAMOND.equalsIgnoreCase(materialItemName.trim());
    }

    @JsonIgnore
    public boolean hasUnitWeight() {
        return unitWeight != null;
    }
}
