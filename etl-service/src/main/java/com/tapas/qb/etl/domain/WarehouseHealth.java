package com.tapas.qb.etl.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Post-load counts over the warehouse. Orphans are fact rows whose key has no
 * matching dimension row.
 */
public record WarehouseHealth(
        long salesFacts,
        long inventoryFacts,
        long orphanedSalesFacts,
        long orphanedInventoryFacts,
        long calendarDays,
        LocalDate firstCalendarDate,
        LocalDate lastCalendarDate,
        BigDecimal totalRevenue
) {

    public boolean hasOrphans() {
        return orphanedSalesFacts > 0 || orphanedInventoryFacts > 0;
    }
}
