package com.tapas.qb.etl.domain;

public record LocationDimensionRow(LocationKey key, String locationType, String region) {
}
