package com.tapas.qb.etl.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record CustomerDimensionRow(
        long customerId,
        String customerFullName,
        String firstName,
        String lastName,
        String email,
        String phone,
        LocalDate dateOfBirth,
        Integer age,
        String ageGroup,
        String gender,
        String city,
        String state,
        String country,
        String postalCode,
        LocalDate registrationDate,
        String customerStatus,
        BigDecimal yearsAsCustomer,
        boolean active
) {
}
