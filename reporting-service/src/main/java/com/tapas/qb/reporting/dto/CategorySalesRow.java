package com.tapas.qb.reporting.dto;

import java.math.BigDecimal;

public record CategorySalesRow(
        String categoryName,
        long totalQuantitySold,
        BigDecimal totalRevenue,
        BigDecimal totalProfit
) {
}
