package com.tapas.qb.etl.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One product's stock position in {@code fact_inventory}, keyed by
 * (product_key, snapshot_date).
 */
public record InventoryFactRow(
        int dateKey,
        long productKey,
        long supplierKey,
        long locationKey,
        long productId,
        int quantityOnHand,
        int reorderLevel,
        Integer reorderQuantity,
        int quantityAvailable,
        BigDecimal stockValue,
        boolean lowStock,
        boolean outOfStock,
        boolean overstocked,
        String warehouseLocation,
        LocalDate lastRestockedDate,
        LocalDate snapshotDate
) {
}
