package com.tapas.qb.reporting.dto;

import java.math.BigDecimal;

public record RegionSalesRow(
        String region,
        String country,
        long totalOrders,
        BigDecimal totalRevenue,
        BigDecimal totalProfit
) {
}
