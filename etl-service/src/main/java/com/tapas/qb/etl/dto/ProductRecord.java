package com.tapas.qb.etl.dto;

import java.math.BigDecimal;

/**
 * Product joined to its category, parent category and supplier.
 */
public record ProductRecord(
        long productId,
        String productCode,
        String productName,
        String description,
        Long categoryId,
        String categoryName,
        Long parentCategoryId,
        String parentCategoryName,
        Long supplierId,
        String supplierName,
        BigDecimal unitPrice,
        BigDecimal costPrice,
        BigDecimal weightKg,
        String dimensions,
        String status
) {
}
