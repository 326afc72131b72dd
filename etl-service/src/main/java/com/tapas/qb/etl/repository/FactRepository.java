package com.tapas.qb.etl.repository;

import com.tapas.qb.etl.domain.InventoryFactRow;
import com.tapas.qb.etl.domain.SalesFactRow;
import com.tapas.qb.etl.domain.WarehouseHealth;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static com.tapas.qb.etl.repository.JdbcValues.setDate;
import static com.tapas.qb.etl.repository.JdbcValues.setDecimal;
import static com.tapas.qb.etl.repository.JdbcValues.setInteger;
import static com.tapas.qb.etl.repository.JdbcValues.setString;
import static com.tapas.qb.etl.repository.JdbcValues.setTimestamp;

/**
 * Writes to {@code fact_sales} and {@code fact_inventory}.
 */
public class FactRepository {

    private final JdbcTemplate jdbcTemplate;
    private final int batchSize;

    public FactRepository(JdbcTemplate jdbcTemplate, int batchSize) {
        this.jdbcTemplate = jdbcTemplate;
        this.batchSize = batchSize;
    }

    /**
     * Latest order date already present in {@code fact_sales}; empty when the
     * table has never been loaded.
     */
    public Optional<LocalDateTime> findSalesWatermark() {
        Timestamp watermark = jdbcTemplate.queryForObject(
                "SELECT MAX(order_date) FROM fact_sales", Timestamp.class);
        return Optional.ofNullable(watermark).map(Timestamp::toLocalDateTime);
    }

    /**
     * Counts facts, orphaned fact rows and calendar coverage after a load.
     */
    public WarehouseHealth checkHealth() {
        Long orphanedSales = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM fact_sales f
                LEFT JOIN dim_date d ON f.date_key = d.date_key
                LEFT JOIN dim_customer c ON f.customer_key = c.customer_key
                LEFT JOIN dim_product p ON f.product_key = p.product_key
                LEFT JOIN dim_supplier s ON f.supplier_key = s.supplier_key
                LEFT JOIN dim_location l ON f.location_key = l.location_key
                WHERE d.date_key IS NULL OR c.customer_key IS NULL OR p.product_key IS NULL
                   OR s.supplier_key IS NULL OR l.location_key IS NULL
                """, Long.class);
        Long orphanedInventory = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM fact_inventory f
                LEFT JOIN dim_date d ON f.date_key = d.date_key
                LEFT JOIN dim_product p ON f.product_key = p.product_key
                LEFT JOIN dim_supplier s ON f.supplier_key = s.supplier_key
                LEFT JOIN dim_location l ON f.location_key = l.location_key
                WHERE d.date_key IS NULL OR p.product_key IS NULL
                   OR s.supplier_key IS NULL OR l.location_key IS NULL
                """, Long.class);
        Long inventoryFacts = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM fact_inventory", Long.class);

        return jdbcTemplate.queryForObject("""
                SELECT
                    (SELECT COUNT(*) FROM fact_sales) AS sales_facts,
                    (SELECT CAST(COALESCE(SUM(line_total), 0) AS DECIMAL(14, 2)) FROM fact_sales) AS total_revenue,
                    COUNT(*) AS calendar_days,
                    MIN(full_date) AS first_date,
                    MAX(full_date) AS last_date
                FROM dim_date
                """, (rs, rowNum) -> {
            Date first = rs.getDate("first_date");
            Date last = rs.getDate("last_date");
            BigDecimal revenue = rs.getBigDecimal("total_revenue");
            return new WarehouseHealth(
                    rs.getLong("sales_facts"),
                    inventoryFacts == null ? 0 : inventoryFacts,
                    orphanedSales == null ? 0 : orphanedSales,
                    orphanedInventory == null ? 0 : orphanedInventory,
                    rs.getLong("calendar_days"),
                    first == null ? null : first.toLocalDate(),
                    last == null ? null : last.toLocalDate(),
                    revenue == null ? BigDecimal.ZERO : revenue);
        });
    }

    /**
     * Appends order lines. A line that was already loaded (same
     * {@code order_item_id}) is refreshed in place instead of duplicated.
     */
    public void insertSales(List<SalesFactRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return;
        }

        String sql = """
                INSERT INTO fact_sales (
                    date_key, customer_key, product_key, supplier_key, location_key,
                    order_id, order_item_id, quantity, unit_price, discount_amount, discount_percent,
                    line_total, cost_amount, profit_amount, profit_margin_percent,
                    tax_amount, shipping_cost, order_total, order_status, payment_status,
                    payment_method, order_date)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (order_item_id) DO UPDATE SET
                    date_key              = EXCLUDED.date_key,
                    customer_key          = EXCLUDED.customer_key,
                    product_key           = EXCLUDED.product_key,
                    supplier_key          = EXCLUDED.supplier_key,
                    location_key          = EXCLUDED.location_key,
                    quantity              = EXCLUDED.quantity,
                    unit_price            = EXCLUDED.unit_price,
                    discount_amount       = EXCLUDED.discount_amount,
                    discount_percent      = EXCLUDED.discount_percent,
                    line_total            = EXCLUDED.line_total,
                    cost_amount           = EXCLUDED.cost_amount,
                    profit_amount         = EXCLUDED.profit_amount,
                    profit_margin_percent = EXCLUDED.profit_margin_percent,
                    tax_amount            = EXCLUDED.tax_amount,
                    shipping_cost         = EXCLUDED.shipping_cost,
                    order_total           = EXCLUDED.order_total,
                    order_status          = EXCLUDED.order_status,
                    payment_status        = EXCLUDED.payment_status,
                    payment_method        = EXCLUDED.payment_method,
                    order_date            = EXCLUDED.order_date
                """;

        jdbcTemplate.batchUpdate(sql, rows, batchSize, (ps, row) -> {
            ps.setInt(1, row.dateKey());
            ps.setLong(2, row.customerKey());
            ps.setLong(3, row.productKey());
            ps.setLong(4, row.supplierKey());
            ps.setLong(5, row.locationKey());
            ps.setLong(6, row.orderId());
            ps.setLong(7, row.orderItemId());
            ps.setInt(8, row.quantity());
            setDecimal(ps, 9, row.unitPrice());
            setDecimal(ps, 10, row.discountAmount());
            setDecimal(ps, 11, row.discountPercent());
            setDecimal(ps, 12, row.lineTotal());
            setDecimal(ps, 13, row.costAmount());
            setDecimal(ps, 14, row.profitAmount());
            setDecimal(ps, 15, row.profitMarginPercent());
            setDecimal(ps, 16, row.taxAmount());
            setDecimal(ps, 17, row.shippingCost());
            setDecimal(ps, 18, row.orderTotal());
            setString(ps, 19, row.orderStatus());
            setString(ps, 20, row.paymentStatus());
            setString(ps, 21, row.paymentMethod());
            setTimestamp(ps, 22, row.orderDate());
        });
    }

    /**
     * One row per product and snapshot date; re-running on the same day
     * overwrites the stock figures.
     */
    public void upsertInventory(List<InventoryFactRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return;
        }

        String sql = """
                INSERT INTO fact_inventory (
                    date_key, product_key, supplier_key, location_key,
                    product_id, quantity_on_hand, reorder_level, reorder_quantity,
                    quantity_available, stock_value, is_low_stock, is_out_of_stock,
                    is_overstocked, warehouse_location, last_restocked_date, snapshot_date)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (product_key, snapshot_date) DO UPDATE SET
                    supplier_key        = EXCLUDED.supplier_key,
                    location_key        = EXCLUDED.location_key,
                    quantity_on_hand    = EXCLUDED.quantity_on_hand,
                    reorder_level       = EXCLUDED.reorder_level,
                    reorder_quantity    = EXCLUDED.reorder_quantity,
                    quantity_available  = EXCLUDED.quantity_available,
                    stock_value         = EXCLUDED.stock_value,
                    is_low_stock        = EXCLUDED.is_low_stock,
                    is_out_of_stock     = EXCLUDED.is_out_of_stock,
                    is_overstocked      = EXCLUDED.is_overstocked,
                    warehouse_location  = EXCLUDED.warehouse_location,
                    last_restocked_date = EXCLUDED.last_restocked_date
                """;

        jdbcTemplate.batchUpdate(sql, rows, batchSize, (ps, row) -> {
            ps.setInt(1, row.dateKey());
            ps.setLong(2, row.productKey());
            ps.setLong(3, row.supplierKey());
            ps.setLong(4, row.locationKey());
            ps.setLong(5, row.productId());
            ps.setInt(6, row.quantityOnHand());
            ps.setInt(7, row.reorderLevel());
            setInteger(ps, 8, row.reorderQuantity());
            ps.setInt(9, row.quantityAvailable());
            setDecimal(ps, 10, row.stockValue());
            ps.setBoolean(11, row.lowStock());
            ps.setBoolean(12, row.outOfStock());
            ps.setBoolean(13, row.overstocked());
            setString(ps, 14, row.warehouseLocation());
            setDate(ps, 15, row.lastRestockedDate());
            ps.setDate(16, Date.valueOf(row.snapshotDate()));
        });
    }
}
