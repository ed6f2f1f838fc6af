package com.preciousledger.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered map of requirement buckets to the weight still required.
 *
 * Insertion order is kept; it breaks ties when several buckets have the same
 * remaining weight.
 */
public class MaterialRequirements {

    private final LinkedHashMap<RequirementKey, BigDecimal> remaining;

    public MaterialRequirements() {
        this.remaining = new LinkedHashMap<>();
    }

    private MaterialRequirements(Map<RequirementKey, BigDecimal> source) {
        this.remaining = new LinkedHashMap<>(source);
    }

    /** Adds weight to a bucket, creating it when absent. */
    public MaterialRequirements require(RequirementKey key, BigDecimal weight) {
        remaining.merge(key, weight, BigDecimal::add);
        return this;
    }

    public void set(RequirementKey key, BigDecimal weight) {
        remaining.put(key, weight);
    }

    public BigDecimal get(RequirementKey key) {
        return remaining.getOrDefault(key, BigDecimal.ZERO);
    }

    public List<RequirementKey> bucketsMatching(RequirementKey assetKey) {
        return remaining.keySet().stream()
                .filter(key -> key.matches(assetKey))
                .collect(Collectors.toList());
    }

    public Map<RequirementKey, BigDecimal> asMap() {
        return Collections.unmodifiableMap(remaining);
    }

    public boolean isEmpty() {
        return remaining.isEmpty();
    }

    public MaterialRequirements copy() {
        return new MaterialRequirements(remaining);
    }

    @Override
    public String toString() {
        return "MaterialRequirements" + remaining;
    }
}
