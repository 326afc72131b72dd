package com.tapas.qb.etl.repository;

import com.tapas.qb.etl.domain.LocationKey;
import com.tapas.qb.etl.dto.CustomerRecord;
import com.tapas.qb.etl.dto.InventoryRecord;
import com.tapas.qb.etl.dto.ProductRecord;
import com.tapas.qb.etl.dto.SalesLineRecord;
import com.tapas.qb.etl.dto.SupplierRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

import static com.tapas.qb.etl.repository.JdbcValues.getInteger;
import static com.tapas.qb.etl.repository.JdbcValues.getLocalDate;
import static com.tapas.qb.etl.repository.JdbcValues.getLocalDateTime;
import static com.tapas.qb.etl.repository.JdbcValues.getLong;

/**
 * Read-only queries against the operational database.
 */
public class SourceRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(SourceRecordRepository.class);

    private static final String SALES_LINES_SQL = """
            SELECT
                o.order_id, oi.order_item_id, o.order_date, o.order_status,
                o.payment_status, o.payment_method, o.total_amount, o.tax_amount, o.shipping_cost,
                oi.product_id, oi.quantity, oi.unit_price, oi.discount_percent, oi.line_total,
                o.customer_id,
                o.shipping_country, o.shipping_state, o.shipping_city, o.shipping_postal_code,
                p.cost_price, p.supplier_id
            FROM orders o
            INNER JOIN order_items oi ON o.order_id = oi.order_id
            LEFT JOIN products p ON oi.product_id = p.product_id
            """;

    private final JdbcTemplate jdbcTemplate;

    public SourceRecordRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<CustomerRecord> findCustomers() {
        String sql = """
                SELECT customer_id, first_name, last_name, email, phone, date_of_birth,
                       gender, city, state, country, postal_code, registration_date, status
                FROM customers
                ORDER BY customer_id
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            LocalDateTime registeredAt = getLocalDateTime(rs, "registration_date");
            return new CustomerRecord(
                    rs.getLong("customer_id"),
                    rs.getString("first_name"),
                    rs.getString("last_name"),
                    rs.getString("email"),
                    rs.getString("phone"),
                    getLocalDate(rs, "date_of_birth"),
                    rs.getString("gender"),
                    rs.getString("city"),
                    rs.getString("state"),
                    rs.getString("country"),
                    rs.getString("postal_code"),
                    registeredAt == null ? null : registeredAt.toLocalDate(),
                    rs.getString("status"));
        });
    }

    public List<ProductRecord> findProducts() {
        String sql = """
                SELECT
                    p.product_id, p.product_code, p.product_name, p.description,
                    p.category_id, c.category_name, c.parent_category_id,
                    pc.category_name AS parent_category_name,
                    p.supplier_id, s.supplier_name,
                    p.unit_price, p.cost_price, p.weight_kg, p.dimensions, p.status
                FROM products p
                LEFT JOIN categories c ON p.category_id = c.category_id
                LEFT JOIN categories pc ON c.parent_category_id = pc.category_id
                LEFT JOIN suppliers s ON p.supplier_id = s.supplier_id
                ORDER BY p.product_id
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> new ProductRecord(
                rs.getLong("product_id"),
                rs.getString("product_code"),
                rs.getString("product_name"),
                rs.getString("description"),
                getLong(rs, "category_id"),
                rs.getString("category_name"),
                getLong(rs, "parent_category_id"),
                rs.getString("parent_category_name"),
                getLong(rs, "supplier_id"),
                rs.getString("supplier_name"),
                rs.getBigDecimal("unit_price"),
                rs.getBigDecimal("cost_price"),
                rs.getBigDecimal("weight_kg"),
                rs.getString("dimensions"),
                rs.getString("status")));
    }

    public List<SupplierRecord> findSuppliers() {
        String sql = """
                SELECT supplier_id, supplier_name, contact_person, email, phone,
                       city, state, country, postal_code
                FROM suppliers
                ORDER BY supplier_id
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> new SupplierRecord(
                rs.getLong("supplier_id"),
                rs.getString("supplier_name"),
                rs.getString("contact_person"),
                rs.getString("email"),
                rs.getString("phone"),
                rs.getString("city"),
                rs.getString("state"),
                rs.getString("country"),
                rs.getString("postal_code")));
    }

    /**
     * Distinct shipping addresses seen on orders, including partial and
     * missing ones; {@link LocationKey} folds absent parts to the empty string
     * the same way the fact load does.
     */
    public List<LocationKey> findShippingLocations() {
        String sql = """
                SELECT DISTINCT
                    shipping_country, shipping_state, shipping_city, shipping_postal_code
                FROM orders
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> LocationKey.of(
                        rs.getString("shipping_country"),
                        rs.getString("shipping_state"),
                        rs.getString("shipping_city"),
                        rs.getString("shipping_postal_code")))
                .stream()
                .distinct()
                .toList();
    }

    /**
     * Order lines, oldest first. When {@code after} is set only orders dated
     * strictly later are returned.
     */
    public List<SalesLineRecord> findSalesLines(LocalDateTime after) {
        if (after == null) {
            return jdbcTemplate.query(SALES_LINES_SQL + " ORDER BY o.order_date, oi.order_item_id",
                    (rs, rowNum) -> mapSalesLine(rs));
        }
        log.debug("Extracting order lines dated after {}", after);
        return jdbcTemplate.query(
                SALES_LINES_SQL + " WHERE o.order_date > ? ORDER BY o.order_date, oi.order_item_id",
                (rs, rowNum) -> mapSalesLine(rs),
                Timestamp.valueOf(after));
    }

    public List<InventoryRecord> findInventory() {
        String sql = """
                SELECT
                    i.product_id, i.quantity_on_hand, i.reorder_level, i.reorder_quantity,
                    i.last_restocked_date, i.warehouse_location,
                    p.supplier_id, p.cost_price
                FROM inventory i
                INNER JOIN products p ON i.product_id = p.product_id
                ORDER BY i.product_id
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            LocalDateTime restockedAt = getLocalDateTime(rs, "last_restocked_date");
            return new InventoryRecord(
                    rs.getLong("product_id"),
                    rs.getInt("quantity_on_hand"),
                    rs.getInt("reorder_level"),
                    getInteger(rs, "reorder_quantity"),
                    restockedAt == null ? null : restockedAt.toLocalDate(),
                    rs.getString("warehouse_location"),
                    getLong(rs, "supplier_id"),
                    rs.getBigDecimal("cost_price"));
        });
    }

    private static SalesLineRecord mapSalesLine(ResultSet rs) throws SQLException {
        return new SalesLineRecord(
                rs.getLong("order_id"),
                rs.getLong("order_item_id"),
                getLocalDateTime(rs, "order_date"),
                rs.getString("order_status"),
                rs.getString("payment_status"),
                rs.getString("payment_method"),
                rs.getBigDecimal("total_amount"),
                rs.getBigDecimal("tax_amount"),
                rs.getBigDecimal("shipping_cost"),
                getLong(rs, "product_id"),
                rs.getInt("quantity"),
                rs.getBigDecimal("unit_price"),
                rs.getBigDecimal("discount_percent"),
                rs.getBigDecimal("line_total"),
                getLong(rs, "customer_id"),
                LocationKey.of(
                        rs.getString("shipping_country"),
                        rs.getString("shipping_state"),
                        rs.getString("shipping_city"),
                        rs.getString("shipping_postal_code")),
                rs.getBigDecimal("cost_price"),
                getLong(rs, "supplier_id"));
    }
}
