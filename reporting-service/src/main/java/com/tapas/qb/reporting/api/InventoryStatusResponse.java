package com.tapas.qb.reporting.api;

import com.tapas.qb.reporting.dto.InventoryStatusRow;

import java.math.BigDecimal;
import java.time.LocalDate;

public record InventoryStatusResponse(
        String productName,
        String categoryName,
        Integer quantityOnHand,
        Integer reorderLevel,
        BigDecimal stockValue,
        Boolean lowStock,
        Boolean outOfStock,
        LocalDate snapshotDate
) {
    public static InventoryStatusResponse from(InventoryStatusRow row) {
        return new InventoryStatusResponse(
                row.productName(),
                row.categoryName(),
                row.quantityOnHand(),
                row.reorderLevel(),
                row.stockValue(),
                row.lowStock(),
                row.outOfStock(),
                row.snapshotDate()
        );
    }
}
