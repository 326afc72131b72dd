package com.tapas.qb.reporting.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record InventoryStatusRow(
        String productName,
        String categoryName,
        int quantityOnHand,
        int reorderLevel,
        BigDecimal stockValue,
        boolean lowStock,
        boolean outOfStock,
        LocalDate snapshotDate
) {
}
