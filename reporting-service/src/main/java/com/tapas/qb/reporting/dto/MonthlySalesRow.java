package com.tapas.qb.reporting.dto;

import java.math.BigDecimal;

public record MonthlySalesRow(
        int year,
        int month,
        String monthName,
        long totalOrders,
        long totalQuantitySold,
        BigDecimal totalRevenue,
        BigDecimal totalProfit,
        BigDecimal avgProfitMarginPercent
) {
}
