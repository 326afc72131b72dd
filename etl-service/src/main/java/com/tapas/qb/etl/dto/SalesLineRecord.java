package com.tapas.qb.etl.dto;

import com.tapas.qb.etl.domain.LocationKey;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Order line joined with its order header and the product's cost and supplier.
 */
public record SalesLineRecord(
        long orderId,
        long orderItemId,
        LocalDateTime orderDate,
        String orderStatus,
        String paymentStatus,
        String paymentMethod,
        BigDecimal orderTotal,
        BigDecimal taxAmount,
        BigDecimal shippingCost,
        Long productId,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal discountPercent,
        BigDecimal lineTotal,
        Long customerId,
        LocationKey shippingLocation,
        BigDecimal costPrice,
        Long supplierId
) {
}
