package com.tapas.qb.etl.domain;

/**
 * Independent stock flags; out-of-stock always implies low-stock.
 */
public record StockStatus(boolean lowStock, boolean outOfStock, boolean overstocked) {
}
