package com.tapas.qb.reporting.dto;

import java.math.BigDecimal;

/**
 * Total line revenue of one customer across all loaded sales.
 */
public record CustomerValueRow(
        long customerKey,
        String customerName,
        BigDecimal lifetimeValue
) {
}
