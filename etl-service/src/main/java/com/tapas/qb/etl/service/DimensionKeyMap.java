package com.tapas.qb.etl.service;

import com.tapas.qb.etl.domain.DimensionType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Natural key to surrogate key lookups for the pre-loaded dimensions, built
 * once per run from committed current rows. Immutable after construction and
 * never shared between runs.
 */
public final class DimensionKeyMap {

    private final Map<DimensionType, Map<Long, Long>> keys;
    private final Set<Integer> dateKeys;

    public DimensionKeyMap(Map<Long, Long> customerKeys,
                           Map<Long, Long> productKeys,
                           Map<Long, Long> supplierKeys,
                           Set<Integer> dateKeys) {
        var map = new EnumMap<DimensionType, Map<Long, Long>>(DimensionType.class);
        map.put(DimensionType.CUSTOMER, Map.copyOf(customerKeys));
        map.put(DimensionType.PRODUCT, Map.copyOf(productKeys));
        map.put(DimensionType.SUPPLIER, Map.copyOf(supplierKeys));
        this.keys = map;
        this.dateKeys = Set.copyOf(dateKeys);
    }

    public Optional<Long> surrogateKey(DimensionType type, Long naturalKey) {
        Map<Long, Long> byNaturalKey = keys.get(type);
        if (byNaturalKey == null) {
            throw new IllegalArgumentException(type + " is not resolved through the key map");
        }
        if (naturalKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byNaturalKey.get(naturalKey));
    }

    public boolean containsDateKey(int dateKey) {
        return dateKeys.contains(dateKey);
    }

    public int size(DimensionType type) {
        if (type == DimensionType.DATE) {
            return dateKeys.size();
        }
        Map<Long, Long> byNaturalKey = keys.get(type);
        return byNaturalKey == null ? 0 : byNaturalKey.size();
    }
}
