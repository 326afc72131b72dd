package com.tapas.qb.reporting.api;

import com.tapas.qb.reporting.dto.ProductSalesRow;

import java.math.BigDecimal;

public record ProductSalesResponse(
        String productName,
        String categoryName,
        Long totalQuantitySold,
        BigDecimal totalRevenue,
        BigDecimal totalProfit
) {
    public static ProductSalesResponse from(ProductSalesRow row) {
        return new ProductSalesResponse(
                row.productName(),
                row.categoryName(),
                row.totalQuantitySold(),
                row.totalRevenue(),
                row.totalProfit()
        );
    }
}
