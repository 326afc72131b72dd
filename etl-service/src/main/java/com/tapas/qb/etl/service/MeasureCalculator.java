package com.tapas.qb.etl.service;

import com.tapas.qb.etl.domain.StockStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Derived attributes and measures. Every function is pure; "today" is always
 * passed in. Division by a zero or missing denominator yields zero.
 */
public final class MeasureCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal DAYS_PER_YEAR = new BigDecimal("365.25");
    private static final int SCALE = 2;

    private MeasureCalculator() {
    }

    /**
     * Whole years computed as {@code floor(days / 365)}.
     */
    public static Integer age(LocalDate birthDate, LocalDate today) {
        if (birthDate == null) {
            return null;
        }
        long days = ChronoUnit.DAYS.between(birthDate, today);
        return (int) Math.floorDiv(days, 365L);
    }

    public static String ageGroup(Integer age) {
        if (age == null) {
            return null;
        }
        if (age < 26) {
            return "18-25";
        } else if (age < 36) {
            return "26-35";
        } else if (age < 46) {
            return "36-45";
        } else if (age < 56) {
            return "46-55";
        }
        return "56+";
    }

    public static BigDecimal yearsAsCustomer(LocalDate registrationDate, LocalDate today) {
        if (registrationDate == null) {
            return null;
        }
        long days = ChronoUnit.DAYS.between(registrationDate, today);
        return BigDecimal.valueOf(days).divide(DAYS_PER_YEAR, SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal profitMargin(BigDecimal unitPrice, BigDecimal costPrice) {
        if (unitPrice == null || costPrice == null) {
            return zero();
        }
        return unitPrice.subtract(costPrice).setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal profitMarginPercent(BigDecimal margin, BigDecimal unitPrice) {
        return percentOf(margin, unitPrice);
    }

    public static BigDecimal costAmount(int quantity, BigDecimal costPrice) {
        if (costPrice == null) {
            return zero();
        }
        return costPrice.multiply(BigDecimal.valueOf(quantity)).setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * {@code lineTotal - quantity * costPrice}.
     */
    public static BigDecimal salesProfit(BigDecimal lineTotal, int quantity, BigDecimal costPrice) {
        BigDecimal total = lineTotal == null ? BigDecimal.ZERO : lineTotal;
        return total.subtract(costAmount(quantity, costPrice)).setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal salesProfitPercent(BigDecimal profit, BigDecimal lineTotal) {
        return percentOf(profit, lineTotal);
    }

    public static BigDecimal discountAmount(BigDecimal lineTotal, BigDecimal discountPercent) {
        if (lineTotal == null || discountPercent == null) {
            return zero();
        }
        return lineTotal.multiply(discountPercent)
                .divide(HUNDRED, SCALE, RoundingMode.HALF_UP);
    }

    public static StockStatus stockStatus(int quantityOnHand, int reorderLevel) {
        return new StockStatus(
                quantityOnHand <= reorderLevel,
                quantityOnHand == 0,
                quantityOnHand > reorderLevel * 3);
    }

    public static BigDecimal stockValue(int quantityOnHand, BigDecimal costPrice) {
        return costAmount(quantityOnHand, costPrice);
    }

    private static BigDecimal percentOf(BigDecimal numerator, BigDecimal denominator) {
        if (numerator == null || denominator == null || denominator.signum() <= 0) {
            return zero();
        }
        return numerator.multiply(HUNDRED).divide(denominator, SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE);
    }
}
