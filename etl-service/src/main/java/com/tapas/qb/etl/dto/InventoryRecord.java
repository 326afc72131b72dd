package com.tapas.qb.etl.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record InventoryRecord(
        long productId,
        int quantityOnHand,
        int reorderLevel,
        Integer reorderQuantity,
        LocalDate lastRestockedDate,
        String warehouseLocation,
        Long supplierId,
        BigDecimal costPrice
) {
}
