package com.tapas.qb.reporting.dto;

import java.math.BigDecimal;

public record ProductSalesRow(
        String productName,
        String categoryName,
        long totalQuantitySold,
        BigDecimal totalRevenue,
        BigDecimal totalProfit
) {
}
