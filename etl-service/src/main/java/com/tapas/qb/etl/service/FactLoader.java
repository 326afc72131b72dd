package com.tapas.qb.etl.service;

import com.tapas.qb.etl.config.EtlProperties;
import com.tapas.qb.etl.domain.DimensionType;
import com.tapas.qb.etl.domain.InventoryFactRow;
import com.tapas.qb.etl.domain.LoadMode;
import com.tapas.qb.etl.domain.LocationKey;
import com.tapas.qb.etl.domain.SalesFactRow;
import com.tapas.qb.etl.domain.StockStatus;
import com.tapas.qb.etl.dto.InventoryRecord;
import com.tapas.qb.etl.dto.SalesLineRecord;
import com.tapas.qb.etl.session.PipelineSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Loads {@code fact_sales} and {@code fact_inventory}.
 * <p>
 * A source row is only turned into a fact once every dimension key has been
 * resolved. Rows with an unresolvable key are dropped and counted; they are
 * never written with a missing key.
 */
@Service
public class FactLoader {

    private static final Logger log = LoggerFactory.getLogger(FactLoader.class);

    static final String WAREHOUSE_LOCATION = "Warehouse";

    private final Clock clock;
    private final LocationKey defaultInventoryLocation;

    public FactLoader(Clock clock, EtlProperties properties) {
        this.clock = clock;
        EtlProperties.DefaultLocation location = properties.getInventory().getDefaultLocation();
        this.defaultInventoryLocation = LocationKey.of(
                location.getCountry(), location.getState(), location.getCity(), location.getPostalCode());
    }

    /**
     * In {@link LoadMode#INCREMENTAL} mode only orders dated strictly after the
     * latest order date already in {@code fact_sales} are extracted. Lines that
     * arrive later for an order date at or before that watermark are not
     * picked up by an incremental run.
     */
    public StageResult loadSales(PipelineSession session, DimensionResolver resolver, LoadMode mode) {
        log.info("Loading fact_sales ({} mode)...", mode);

        LocalDateTime watermark = null;
        if (mode == LoadMode.INCREMENTAL) {
            watermark = session.facts().findSalesWatermark().orElse(null);
            if (watermark != null) {
                log.info("Incremental load: loading orders after {}", watermark);
            } else {
                log.info("Incremental load: fact_sales is empty, loading all orders");
            }
        }

        List<SalesLineRecord> lines = session.source().findSalesLines(watermark);
        var skips = new SkipCounter();
        var facts = new ArrayList<SalesFactRow>(lines.size());
        for (SalesLineRecord line : lines) {
            toSalesFact(line, resolver, skips).ifPresent(facts::add);
        }

        session.facts().insertSales(facts);

        if (skips.total() > 0) {
            log.warn("Skipped {} of {} order lines with unresolved dimension keys: {}",
                    skips.total(), lines.size(), skips.byDimension());
        }
        log.info("Loaded {} sales records into fact_sales ({} new locations)",
                facts.size(), resolver.createdLocations());
        return StageResult.of(PipelineStage.SALES_FACTS, lines.size(), facts.size(), skips);
    }

    /**
     * Snapshots the current stock of every product for today's date.
     */
    public StageResult loadInventory(PipelineSession session, DimensionResolver resolver) {
        log.info("Loading fact_inventory...");

        LocalDate snapshotDate = LocalDate.now(clock);
        List<InventoryRecord> inventory = session.source().findInventory();
        var skips = new SkipCounter();
        var facts = new ArrayList<InventoryFactRow>(inventory.size());
        for (InventoryRecord record : inventory) {
            toInventoryFact(record, snapshotDate, resolver, skips).ifPresent(facts::add);
        }

        session.facts().upsertInventory(facts);

        if (skips.total() > 0) {
            log.warn("Skipped {} of {} inventory records with unresolved dimension keys: {}",
                    skips.total(), inventory.size(), skips.byDimension());
        }
        log.info("Loaded {} inventory records into fact_inventory for {}", facts.size(), snapshotDate);
        return StageResult.of(PipelineStage.INVENTORY_FACTS, inventory.size(), facts.size(), skips);
    }

    Optional<SalesFactRow> toSalesFact(SalesLineRecord line, DimensionResolver resolver, SkipCounter skips) {
        LocalDate orderDay = line.orderDate() == null ? null : line.orderDate().toLocalDate();
        Optional<Integer> dateKey = resolver.resolveDate(orderDay);
        if (dateKey.isEmpty()) {
            return skip(skips, DimensionType.DATE, line.orderItemId(), orderDay);
        }
        Optional<Long> customerKey = resolver.resolve(DimensionType.CUSTOMER, line.customerId());
        if (customerKey.isEmpty()) {
            return skip(skips, DimensionType.CUSTOMER, line.orderItemId(), line.customerId());
        }
        Optional<Long> productKey = resolver.resolve(DimensionType.PRODUCT, line.productId());
        if (productKey.isEmpty()) {
            return skip(skips, DimensionType.PRODUCT, line.orderItemId(), line.productId());
        }
        Optional<Long> supplierKey = resolver.resolve(DimensionType.SUPPLIER, line.supplierId());
        if (supplierKey.isEmpty()) {
            return skip(skips, DimensionType.SUPPLIER, line.orderItemId(), line.supplierId());
        }
        long locationKey = resolver.resolveOrCreateLocation(line.shippingLocation(), DimensionLoader.SHIPPING_LOCATION);

        BigDecimal costAmount = MeasureCalculator.costAmount(line.quantity(), line.costPrice());
        BigDecimal profit = MeasureCalculator.salesProfit(line.lineTotal(), line.quantity(), line.costPrice());

        return Optional.of(new SalesFactRow(
                dateKey.get(),
                customerKey.get(),
                productKey.get(),
                supplierKey.get(),
                locationKey,
                line.orderId(),
                line.orderItemId(),
                line.quantity(),
                line.unitPrice(),
                MeasureCalculator.discountAmount(line.lineTotal(), line.discountPercent()),
                line.discountPercent(),
                line.lineTotal(),
                costAmount,
                profit,
                MeasureCalculator.salesProfitPercent(profit, line.lineTotal()),
                line.taxAmount(),
                line.shippingCost(),
                line.orderTotal(),
                line.orderStatus(),
                line.paymentStatus(),
                line.paymentMethod(),
                line.orderDate()));
    }

    Optional<InventoryFactRow> toInventoryFact(InventoryRecord record,
                                               LocalDate snapshotDate,
                                               DimensionResolver resolver,
                                               SkipCounter skips) {
        Optional<Integer> dateKey = resolver.resolveDate(snapshotDate);
        if (dateKey.isEmpty()) {
            return skip(skips, DimensionType.DATE, record.productId(), snapshotDate);
        }
        Optional<Long> productKey = resolver.resolve(DimensionType.PRODUCT, record.productId());
        if (productKey.isEmpty()) {
            return skip(skips, DimensionType.PRODUCT, record.productId(), record.productId());
        }
        Optional<Long> supplierKey = resolver.resolve(DimensionType.SUPPLIER, record.supplierId());
        if (supplierKey.isEmpty()) {
            return skip(skips, DimensionType.SUPPLIER, record.productId(), record.supplierId());
        }
        long locationKey = resolver.resolveOrCreateLocation(defaultInventoryLocation, WAREHOUSE_LOCATION);

        StockStatus status = MeasureCalculator.stockStatus(record.quantityOnHand(), record.reorderLevel());

        return Optional.of(new InventoryFactRow(
                dateKey.get(),
                productKey.get(),
                supplierKey.get(),
                locationKey,
                record.productId(),
                record.quantityOnHand(),
                record.reorderLevel(),
                record.reorderQuantity(),
                record.quantityOnHand(),
                MeasureCalculator.stockValue(record.quantityOnHand(), record.costPrice()),
                status.lowStock(),
                status.outOfStock(),
                status.overstocked(),
                record.warehouseLocation(),
                record.lastRestockedDate(),
                snapshotDate));
    }

    private static <T> Optional<T> skip(SkipCounter skips, DimensionType dimension, long rowId, Object naturalKey) {
        skips.skip(dimension);
        log.debug("Skipping source row {}: no current {} row for {}", rowId, dimension, naturalKey);
        return Optional.empty();
    }
}
