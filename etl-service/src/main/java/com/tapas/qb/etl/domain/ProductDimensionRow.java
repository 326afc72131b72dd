package com.tapas.qb.etl.domain;

import java.math.BigDecimal;

public record ProductDimensionRow(
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
        BigDecimal profitMargin,
        BigDecimal profitMarginPercent,
        BigDecimal weightKg,
        String dimensions,
        String productStatus
) {
}
