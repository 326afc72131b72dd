package com.tapas.qb.reporting.api;

import com.tapas.qb.reporting.dto.MonthlySalesRow;

import java.math.BigDecimal;

public record MonthlySalesResponse(
        String yearMonth,
        String monthName,
        Long totalOrders,
        Long totalQuantitySold,
        BigDecimal totalRevenue,
        BigDecimal totalProfit,
        BigDecimal avgProfitMarginPercent
) {
    public static MonthlySalesResponse from(MonthlySalesRow row) {
        return new MonthlySalesResponse(
                String.format("%d-%02d", row.year(), row.month()),
                row.monthName(),
                row.totalOrders(),
                row.totalQuantitySold(),
                row.totalRevenue(),
                row.totalProfit(),
                row.avgProfitMarginPercent()
        );
    }
}
