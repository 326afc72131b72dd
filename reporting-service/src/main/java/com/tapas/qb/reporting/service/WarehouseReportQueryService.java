package com.tapas.qb.reporting.service;

import com.tapas.qb.reporting.domain.CustomerSegment;
import com.tapas.qb.reporting.dto.CategorySalesRow;
import com.tapas.qb.reporting.dto.CustomerSegmentRow;
import com.tapas.qb.reporting.dto.CustomerValueRow;
import com.tapas.qb.reporting.dto.InventoryStatusRow;
import com.tapas.qb.reporting.dto.MonthlySalesRow;
import com.tapas.qb.reporting.dto.ProductSalesRow;
import com.tapas.qb.reporting.dto.RegionSalesRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Date;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate queries over the star schema. Read-only; the SQL sticks to what
 * PostgreSQL and DuckDB both accept.
 */
@Service
public class WarehouseReportQueryService {

    private static final Logger logger = LoggerFactory.getLogger(WarehouseReportQueryService.class);

    static final int MAX_LIMIT = 100;

    private final JdbcTemplate jdbcTemplate;

    public WarehouseReportQueryService(@Qualifier("warehouseJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<MonthlySalesRow> monthlySales() {
        String sql = """
                SELECT
                    d.year_number,
                    d.month_number,
                    d.month_name,
                    COUNT(DISTINCT fs.order_id)                          AS total_orders,
                    CAST(SUM(fs.quantity) AS BIGINT)                     AS total_quantity,
                    CAST(SUM(fs.line_total) AS DECIMAL(14, 2))           AS total_revenue,
                    CAST(SUM(fs.profit_amount) AS DECIMAL(14, 2))        AS total_profit,
                    CAST(AVG(fs.profit_margin_percent) AS DECIMAL(12, 2)) AS avg_profit_margin
                FROM fact_sales fs
                INNER JOIN dim_date d ON fs.date_key = d.date_key
                GROUP BY d.year_number, d.month_number, d.month_name
                ORDER BY d.year_number, d.month_number
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> new MonthlySalesRow(
                rs.getInt("year_number"),
                rs.getInt("month_number"),
                rs.getString("month_name"),
                rs.getLong("total_orders"),
                rs.getLong("total_quantity"),
                rs.getBigDecimal("total_revenue"),
                rs.getBigDecimal("total_profit"),
                rs.getBigDecimal("avg_profit_margin")));
    }

    public List<ProductSalesRow> topProducts(int limit) {
        String sql = """
                SELECT
                    dp.product_name,
                    dp.category_name,
                    CAST(SUM(fs.quantity) AS BIGINT)              AS total_quantity,
                    CAST(SUM(fs.line_total) AS DECIMAL(14, 2))    AS total_revenue,
                    CAST(SUM(fs.profit_amount) AS DECIMAL(14, 2)) AS total_profit
                FROM fact_sales fs
                INNER JOIN dim_product dp ON fs.product_key = dp.product_key
                GROUP BY dp.product_key, dp.product_name, dp.category_name
                ORDER BY total_revenue DESC, dp.product_name
                LIMIT ?
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> new ProductSalesRow(
                rs.getString("product_name"),
                rs.getString("category_name"),
                rs.getLong("total_quantity"),
                rs.getBigDecimal("total_revenue"),
                rs.getBigDecimal("total_profit")),
                checkLimit(limit));
    }

    public List<CategorySalesRow> salesByCategory() {
        String sql = """
                SELECT
                    dp.category_name,
                    CAST(SUM(fs.quantity) AS BIGINT)              AS total_quantity,
                    CAST(SUM(fs.line_total) AS DECIMAL(14, 2))    AS total_revenue,
                    CAST(SUM(fs.profit_amount) AS DECIMAL(14, 2)) AS total_profit
                FROM fact_sales fs
                INNER JOIN dim_product dp ON fs.product_key = dp.product_key
                GROUP BY dp.category_name
                ORDER BY total_revenue DESC
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> new CategorySalesRow(
                rs.getString("category_name"),
                rs.getLong("total_quantity"),
                rs.getBigDecimal("total_revenue"),
                rs.getBigDecimal("total_profit")));
    }

    public List<CustomerValueRow> customerLifetimeValues() {
        String sql = """
                SELECT
                    dc.customer_key,
                    dc.customer_full_name,
                    CAST(SUM(fs.line_total) AS DECIMAL(14, 2)) AS lifetime_value
                FROM fact_sales fs
                INNER JOIN dim_customer dc ON fs.customer_key = dc.customer_key
                GROUP BY dc.customer_key, dc.customer_full_name
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> new CustomerValueRow(
                rs.getLong("customer_key"),
                rs.getString("customer_full_name"),
                rs.getBigDecimal("lifetime_value")));
    }

    /**
     * Customers banded by lifetime value, highest average first. Segments
     * without customers are left out.
     */
    public List<CustomerSegmentRow> customerSegments() {
        Map<CustomerSegment, List<BigDecimal>> values = new EnumMap<>(CustomerSegment.class);
        for (CustomerValueRow customer : customerLifetimeValues()) {
            values.computeIfAbsent(CustomerSegment.of(customer.lifetimeValue()), s -> new ArrayList<>())
                    .add(customer.lifetimeValue() == null ? BigDecimal.ZERO : customer.lifetimeValue());
        }

        List<CustomerSegmentRow> segments = new ArrayList<>();
        values.forEach((segment, lifetimeValues) -> {
            BigDecimal total = lifetimeValues.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal average = total.divide(BigDecimal.valueOf(lifetimeValues.size()), 2, RoundingMode.HALF_UP);
            segments.add(new CustomerSegmentRow(segment, lifetimeValues.size(), average));
        });
        segments.sort(Comparator.comparing(CustomerSegmentRow::avgLifetimeValue).reversed());

        logger.debug("Customer segments: {}", segments);
        return segments;
    }

    /**
     * Stock of the latest snapshot, most valuable first.
     */
    public List<InventoryStatusRow> latestInventory(int limit) {
        String sql = """
                SELECT
                    dp.product_name,
                    dp.category_name,
                    fi.quantity_on_hand,
                    fi.reorder_level,
                    fi.stock_value,
                    fi.is_low_stock,
                    fi.is_out_of_stock,
                    fi.snapshot_date
                FROM fact_inventory fi
                INNER JOIN dim_product dp ON fi.product_key = dp.product_key
                WHERE fi.snapshot_date = (SELECT MAX(snapshot_date) FROM fact_inventory)
                ORDER BY fi.stock_value DESC, dp.product_name
                LIMIT ?
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            Date snapshotDate = rs.getDate("snapshot_date");
            return new InventoryStatusRow(
                    rs.getString("product_name"),
                    rs.getString("category_name"),
                    rs.getInt("quantity_on_hand"),
                    rs.getInt("reorder_level"),
                    rs.getBigDecimal("stock_value"),
                    rs.getBoolean("is_low_stock"),
                    rs.getBoolean("is_out_of_stock"),
                    snapshotDate == null ? null : snapshotDate.toLocalDate());
        }, checkLimit(limit));
    }

    public List<RegionSalesRow> salesByRegion() {
        String sql = """
                SELECT
                    dl.region,
                    dl.country,
                    COUNT(DISTINCT fs.order_id)                   AS total_orders,
                    CAST(SUM(fs.line_total) AS DECIMAL(14, 2))    AS total_revenue,
                    CAST(SUM(fs.profit_amount) AS DECIMAL(14, 2)) AS total_profit
                FROM fact_sales fs
                INNER JOIN dim_location dl ON fs.location_key = dl.location_key
                GROUP BY dl.region, dl.country
                ORDER BY total_revenue DESC
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> new RegionSalesRow(
                rs.getString("region"),
                rs.getString("country"),
                rs.getLong("total_orders"),
                rs.getBigDecimal("total_revenue"),
                rs.getBigDecimal("total_profit")));
    }

    private static int checkLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ", was " + limit);
        }
        return limit;
    }
}
