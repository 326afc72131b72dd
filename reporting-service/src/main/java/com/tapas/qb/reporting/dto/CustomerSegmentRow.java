package com.tapas.qb.reporting.dto;

import com.tapas.qb.reporting.domain.CustomerSegment;

import java.math.BigDecimal;

public record CustomerSegmentRow(
        CustomerSegment segment,
        long customerCount,
        BigDecimal avgLifetimeValue
) {
}
