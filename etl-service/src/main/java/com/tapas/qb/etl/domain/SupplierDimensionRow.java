package com.tapas.qb.etl.domain;

public record SupplierDimensionRow(
        long supplierId,
        String supplierName,
        String contactPerson,
        String email,
        String phone,
        String city,
        String state,
        String country,
        String postalCode
) {
}
