package com.tapas.qb.reporting.domain;

import java.math.BigDecimal;

/**
 * Lifetime value bands, checked from the highest threshold down.
 */
public enum CustomerSegment {
    VIP("VIP", new BigDecimal("1000")),
    HIGH_VALUE("High Value", new BigDecimal("500")),
    MEDIUM_VALUE("Medium Value", new BigDecimal("200")),
    LOW_VALUE("Low Value", BigDecimal.ZERO);

    private final String label;
    private final BigDecimal threshold;

    CustomerSegment(String label, BigDecimal threshold) {
        this.label = label;
        this.threshold = threshold;
    }

    public String getLabel() {
        return label;
    }

    public static CustomerSegment of(BigDecimal lifetimeValue) {
        if (lifetimeValue == null) {
            return LOW_VALUE;
        }
        for (CustomerSegment segment : values()) {
            if (segment != LOW_VALUE && lifetimeValue.compareTo(segment.threshold) >= 0) {
                return segment;
            }
        }
        return LOW_VALUE;
    }
}
