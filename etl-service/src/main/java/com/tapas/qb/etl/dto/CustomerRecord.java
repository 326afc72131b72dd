package com.tapas.qb.etl.dto;

import java.time.LocalDate;

/**
 * Row of the operational {@code customers} table.
 */
public record CustomerRecord(
        long customerId,
        String firstName,
        String lastName,
        String email,
        String phone,
        LocalDate dateOfBirth,
        String gender,
        String city,
        String state,
        String country,
        String postalCode,
        LocalDate registrationDate,
        String status
) {
}
