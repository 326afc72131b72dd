package com.tapas.qb.etl.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One order line item in {@code fact_sales}. All dimension keys are resolved
 * before a row is built.
 */
public record SalesFactRow(
        int dateKey,
        long customerKey,
        long productKey,
        long supplierKey,
        long locationKey,
        long orderId,
        long orderItemId,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal discountAmount,
        BigDecimal discountPercent,
        BigDecimal lineTotal,
        BigDecimal costAmount,
        BigDecimal profitAmount,
        BigDecimal profitMarginPercent,
        BigDecimal taxAmount,
        BigDecimal shippingCost,
        BigDecimal orderTotal,
        String orderStatus,
        String paymentStatus,
        String paymentMethod,
        LocalDateTime orderDate
) {
}
