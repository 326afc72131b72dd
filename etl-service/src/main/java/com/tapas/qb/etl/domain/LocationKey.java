package com.tapas.qb.etl.domain;

/**
 * Composite natural key of the location dimension. Absent components are
 * normalized to the empty string so the unique constraint on
 * (country, state, city, postal_code) also covers partial addresses.
 * <p>
 * An order with no shipping address at all maps to the all-empty key; that
 * row lands in the default region like any other unmapped state.
 */
public record LocationKey(String country, String state, String city, String postalCode) {

    public LocationKey {
        country = normalize(country);
        state = normalize(state);
        city = normalize(city);
        postalCode = normalize(postalCode);
    }

    public static LocationKey of(String country, String state, String city, String postalCode) {
        return new LocationKey(country, state, city, postalCode);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim();
    }
}
