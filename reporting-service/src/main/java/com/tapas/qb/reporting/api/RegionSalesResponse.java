package com.tapas.qb.reporting.api;

import com.tapas.qb.reporting.dto.RegionSalesRow;

import java.math.BigDecimal;

public record RegionSalesResponse(
        String region,
        String country,
        Long totalOrders,
        BigDecimal totalRevenue,
        BigDecimal totalProfit
) {
    public static RegionSalesResponse from(RegionSalesRow row) {
        return new RegionSalesResponse(
                row.region(),
                row.country(),
                row.totalOrders(),
                row.totalRevenue(),
                row.totalProfit()
        );
    }
}
