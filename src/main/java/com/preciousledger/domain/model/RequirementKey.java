package com.preciousledger.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

/**
 * Identity of a material requirement bucket.
 *
 * <ul>
 *   <li>Metal requirements: (METAL, item, carat)</li>
 *   <li>Diamonds: (STONE, item, shape/cut, clarity, color)</li>
 *   <li>Other stones: (STONE, item, shape/cut)</li>
 *   <li>Anything else: (type, item)</li>
 * </ul>
 *
 * Against a contract a contributed metal asset is matched without its carat,
 * so one asset may satisfy several carat rows of the same item. See
 * {@link #matches}. Pools compare {@link #forRequirement} keys exactly.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RequirementKey {

    MaterialType materialType;
    UUID materialItemId;
    UUID caratTypeId;
    UUID shapeCutId;
    UUID clarityId;
    UUID colorId;

    public static RequirementKey forRequirement(MaterialSpec spec) {
        if (spec.getMaterialType() == MaterialType.METAL) {
            return new RequirementKey(MaterialType.METAL, spec.getMaterialItemId(), spec.getCaratTypeId(),
                    null, null, null);
        }
        return forStoneOrGeneric(spec);
    }

    public static RequirementKey forAsset(MaterialSpec spec) {
        if (spec.getMaterialType() == MaterialType.METAL) {
            return new RequirementKey(MaterialType.METAL, spec.getMaterialItemId(), null, null, null, null);
        }
        return forStoneOrGeneric(spec);
    }

    private static RequirementKey forStoneOrGeneric(MaterialSpec spec) {
        if (spec.getMaterialType() == MaterialType.STONE) {
            if (spec.isDiamond()) {
                return new RequirementKey(MaterialType.STONE, spec.getMaterialItemId(), null,
                        spec.getShapeCutId(), spec.getClarityId(), spec.getColorId());
            }
            return new RequirementKey(MaterialType.STONE, spec.getMaterialItemId(), null,
                    spec.getShapeCutId(), null, null);
        }
        return new RequirementKey(spec.getMaterialType(), spec.getMaterialItemId(), null, null, null, null);
    }

    public boolean isMetal() {
        return materialType == MaterialType.METAL;
    }

    /**
     * Whether a requirement bucket with this key accepts an asset with the given asset key.
     */
    public boolean matches(RequirementKey assetKey) {
        if (isMetal() && assetKey.isMetal()) {
            return materialItemId != null && materialItemId.equals(assetKey.getMaterialItemId());
        }
        return equals(assetKey);
    }
}
