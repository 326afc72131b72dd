package com.tapas.qb.etl.service;

import com.tapas.qb.etl.domain.DimensionType;
import com.tapas.qb.etl.domain.LocationDimensionRow;
import com.tapas.qb.etl.domain.LocationKey;
import com.tapas.qb.etl.repository.DimensionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps natural keys to surrogate keys for fact loading. Customer, product and
 * supplier keys come only from the run's {@link DimensionKeyMap}; a miss is a
 * resolution failure. Locations are looked up in the warehouse and created on
 * first sight.
 * <p>
 * One instance per run. The location memo lives only as long as the resolver.
 */
public class DimensionResolver {

    private static final Logger log = LoggerFactory.getLogger(DimensionResolver.class);

    private final DimensionKeyMap keyMap;
    private final DimensionRepository dimensions;
    private final RegionClassifier regions;
    private final Map<LocationKey, Long> locationKeys = new HashMap<>();
    private int createdLocations;

    public DimensionResolver(DimensionKeyMap keyMap, DimensionRepository dimensions, RegionClassifier regions) {
        this.keyMap = keyMap;
        this.dimensions = dimensions;
        this.regions = regions;
    }

    public Optional<Long> resolve(DimensionType type, Long naturalKey) {
        if (type == DimensionType.LOCATION || type == DimensionType.DATE) {
            throw new IllegalArgumentException(type + " keys are not resolved by natural id");
        }
        return keyMap.surrogateKey(type, naturalKey);
    }

    public Optional<Integer> resolveDate(LocalDate date) {
        if (date == null) {
            return Optional.empty();
        }
        int dateKey = DateDimensionGenerator.dateKey(date);
        return keyMap.containsDateKey(dateKey) ? Optional.of(dateKey) : Optional.empty();
    }

    /**
     * Returns the key of the current location row matching {@code key},
     * inserting the row first when it does not exist. Calling this again with
     * the same key returns the same surrogate key and never adds a second row.
     */
    public long resolveOrCreateLocation(LocationKey key, String locationType) {
        Long cached = locationKeys.get(key);
        if (cached != null) {
            return cached;
        }

        long locationKey = dimensions.findLocationKey(key)
                .orElseGet(() -> createLocation(key, locationType));
        locationKeys.put(key, locationKey);
        return locationKey;
    }

    public int createdLocations() {
        return createdLocations;
    }

    private long createLocation(LocationKey key, String locationType) {
        String region = regions.classify(key.state());
        int inserted = dimensions.insertLocationIfAbsent(new LocationDimensionRow(key, locationType, region));
        if (inserted > 0) {
            createdLocations++;
            log.debug("Created location {} in region {}", key, region);
        }
        return dimensions.findLocationKey(key)
                .orElseThrow(() -> new IllegalStateException("Location " + key + " missing after insert"));
    }
}
