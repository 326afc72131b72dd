package com.tapas.qb.reporting.api;

import com.tapas.qb.reporting.dto.CategorySalesRow;

import java.math.BigDecimal;

public record CategorySalesResponse(
        String categoryName,
        Long totalQuantitySold,
        BigDecimal totalRevenue,
        BigDecimal totalProfit
) {
    public static CategorySalesResponse from(CategorySalesRow row) {
        return new CategorySalesResponse(
                row.categoryName(),
                row.totalQuantitySold(),
                row.totalRevenue(),
                row.totalProfit()
        );
    }
}
