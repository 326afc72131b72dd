package com.tapas.qb.etl.dto;

public record SupplierRecord(
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
