package com.tapas.qb.reporting.api;

import com.tapas.qb.reporting.dto.CustomerSegmentRow;

import java.math.BigDecimal;

public record CustomerSegmentResponse(
        String customerSegment,
        Long customerCount,
        BigDecimal avgLifetimeValue
) {
    public static CustomerSegmentResponse from(CustomerSegmentRow row) {
        return new CustomerSegmentResponse(
                row.segment().getLabel(),
                row.customerCount(),
                row.avgLifetimeValue()
        );
    }
}
