package com.tapas.qb.etl.repository;

import com.tapas.qb.etl.domain.CustomerDimensionRow;
import com.tapas.qb.etl.domain.DateDimensionRow;
import com.tapas.qb.etl.domain.DimensionType;
import com.tapas.qb.etl.domain.LocationDimensionRow;
import com.tapas.qb.etl.domain.LocationKey;
import com.tapas.qb.etl.domain.ProductDimensionRow;
import com.tapas.qb.etl.domain.SupplierDimensionRow;
import com.tapas.qb.etl.service.DimensionKeyMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Date;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.tapas.qb.etl.repository.JdbcValues.setDate;
import static com.tapas.qb.etl.repository.JdbcValues.setDecimal;
import static com.tapas.qb.etl.repository.JdbcValues.setInteger;
import static com.tapas.qb.etl.repository.JdbcValues.setLong;
import static com.tapas.qb.etl.repository.JdbcValues.setString;

/**
 * Writes and key lookups for the warehouse dimension tables.
 * <p>
 * Every upsert relies on the unique constraint of the dimension's natural key;
 * that constraint, not this class, is what keeps concurrent runs from creating
 * duplicate rows.
 */
public class DimensionRepository {

    private static final Logger log = LoggerFactory.getLogger(DimensionRepository.class);

    private static final String INSERT_LOCATION_SQL = """
            INSERT INTO dim_location (country, state, city, postal_code, location_type, region, is_current)
            VALUES (?, ?, ?, ?, ?, ?, TRUE)
            ON CONFLICT (country, state, city, postal_code) DO NOTHING
            """;

    private final JdbcTemplate jdbcTemplate;
    private final int batchSize;

    public DimensionRepository(JdbcTemplate jdbcTemplate, int batchSize) {
        this.jdbcTemplate = jdbcTemplate;
        this.batchSize = batchSize;
    }

    /**
     * Inserts calendar rows; days already present are left untouched.
     */
    public int upsertDates(List<DateDimensionRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }

        String sql = """
                INSERT INTO dim_date (
                    date_key, full_date, day_of_week, day_name, day_of_month, day_of_year,
                    week_of_year, month_number, month_name, quarter_number, quarter_name,
                    year_number, is_weekend, is_holiday)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (date_key) DO NOTHING
                """;

        int[][] counts = jdbcTemplate.batchUpdate(sql, rows, batchSize, (ps, row) -> {
            ps.setInt(1, row.dateKey());
            ps.setDate(2, Date.valueOf(row.fullDate()));
            ps.setInt(3, row.dayOfWeek());
            ps.setString(4, row.dayName());
            ps.setInt(5, row.dayOfMonth());
            ps.setInt(6, row.dayOfYear());
            ps.setInt(7, row.weekOfYear());
            ps.setInt(8, row.monthNumber());
            ps.setString(9, row.monthName());
            ps.setInt(10, row.quarterNumber());
            ps.setString(11, row.quarterName());
            ps.setInt(12, row.yearNumber());
            ps.setBoolean(13, row.weekend());
            ps.setBoolean(14, row.holiday());
        });
        return affected(counts);
    }

    public void upsertCustomers(List<CustomerDimensionRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return;
        }

        String sql = """
                INSERT INTO dim_customer (
                    customer_id, customer_full_name, first_name, last_name, email, phone,
                    date_of_birth, age, age_group, gender, city, state, country, postal_code,
                    registration_date, customer_status, years_as_customer, is_active, is_current)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, TRUE)
                ON CONFLICT (customer_id) DO UPDATE SET
                    customer_full_name = EXCLUDED.customer_full_name,
                    first_name         = EXCLUDED.first_name,
                    last_name          = EXCLUDED.last_name,
                    email              = EXCLUDED.email,
                    phone              = EXCLUDED.phone,
                    age                = EXCLUDED.age,
                    age_group          = EXCLUDED.age_group,
                    city               = EXCLUDED.city,
                    state              = EXCLUDED.state,
                    country            = EXCLUDED.country,
                    postal_code        = EXCLUDED.postal_code,
                    customer_status    = EXCLUDED.customer_status,
                    years_as_customer  = EXCLUDED.years_as_customer,
                    is_active          = EXCLUDED.is_active,
                    is_current         = TRUE
                """;

        jdbcTemplate.batchUpdate(sql, rows, batchSize, (ps, row) -> {
            ps.setLong(1, row.customerId());
            setString(ps, 2, row.customerFullName());
            setString(ps, 3, row.firstName());
            setString(ps, 4, row.lastName());
            setString(ps, 5, row.email());
            setString(ps, 6, row.phone());
            setDate(ps, 7, row.dateOfBirth());
            setInteger(ps, 8, row.age());
            setString(ps, 9, row.ageGroup());
            setString(ps, 10, row.gender());
            setString(ps, 11, row.city());
            setString(ps, 12, row.state());
            setString(ps, 13, row.country());
            setString(ps, 14, row.postalCode());
            setDate(ps, 15, row.registrationDate());
            setString(ps, 16, row.customerStatus());
            setDecimal(ps, 17, row.yearsAsCustomer());
            ps.setBoolean(18, row.active());
        });
    }

    public void upsertProducts(List<ProductDimensionRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return;
        }

        String sql = """
                INSERT INTO dim_product (
                    product_id, product_code, product_name, description, category_id, category_name,
                    parent_category_id, parent_category_name, supplier_id, supplier_name,
                    unit_price, cost_price, profit_margin, profit_margin_percent,
                    weight_kg, dimensions, product_status, is_current)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, TRUE)
                ON CONFLICT (product_id) DO UPDATE SET
                    product_name          = EXCLUDED.product_name,
                    description           = EXCLUDED.description,
                    category_id           = EXCLUDED.category_id,
                    category_name         = EXCLUDED.category_name,
                    parent_category_id    = EXCLUDED.parent_category_id,
                    parent_category_name  = EXCLUDED.parent_category_name,
                    supplier_id           = EXCLUDED.supplier_id,
                    supplier_name         = EXCLUDED.supplier_name,
                    unit_price            = EXCLUDED.unit_price,
                    cost_price            = EXCLUDED.cost_price,
                    profit_margin         = EXCLUDED.profit_margin,
                    profit_margin_percent = EXCLUDED.profit_margin_percent,
                    weight_kg             = EXCLUDED.weight_kg,
                    dimensions            = EXCLUDED.dimensions,
                    product_status        = EXCLUDED.product_status,
                    is_current            = TRUE
                """;

        jdbcTemplate.batchUpdate(sql, rows, batchSize, (ps, row) -> {
            ps.setLong(1, row.productId());
            setString(ps, 2, row.productCode());
            setString(ps, 3, row.productName());
            setString(ps, 4, row.description());
            setLong(ps, 5, row.categoryId());
            setString(ps, 6, row.categoryName());
            setLong(ps, 7, row.parentCategoryId());
            setString(ps, 8, row.parentCategoryName());
            setLong(ps, 9, row.supplierId());
            setString(ps, 10, row.supplierName());
            setDecimal(ps, 11, row.unitPrice());
            setDecimal(ps, 12, row.costPrice());
            setDecimal(ps, 13, row.profitMargin());
            setDecimal(ps, 14, row.profitMarginPercent());
            setDecimal(ps, 15, row.weightKg());
            setString(ps, 16, row.dimensions());
            setString(ps, 17, row.productStatus());
        });
    }

    public void upsertSuppliers(List<SupplierDimensionRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return;
        }

        String sql = """
                INSERT INTO dim_supplier (
                    supplier_id, supplier_name, contact_person, email, phone,
                    city, state, country, postal_code, is_current)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, TRUE)
                ON CONFLICT (supplier_id) DO UPDATE SET
                    supplier_name  = EXCLUDED.supplier_name,
                    contact_person = EXCLUDED.contact_person,
                    email          = EXCLUDED.email,
                    phone          = EXCLUDED.phone,
                    city           = EXCLUDED.city,
                    state          = EXCLUDED.state,
                    country        = EXCLUDED.country,
                    postal_code    = EXCLUDED.postal_code,
                    is_current     = TRUE
                """;

        jdbcTemplate.batchUpdate(sql, rows, batchSize, (ps, row) -> {
            ps.setLong(1, row.supplierId());
            setString(ps, 2, row.supplierName());
            setString(ps, 3, row.contactPerson());
            setString(ps, 4, row.email());
            setString(ps, 5, row.phone());
            setString(ps, 6, row.city());
            setString(ps, 7, row.state());
            setString(ps, 8, row.country());
            setString(ps, 9, row.postalCode());
        });
    }

    /**
     * Inserts locations that are not yet known; existing rows keep their key
     * and attributes.
     *
     * @return number of rows actually inserted
     */
    public int insertLocationsIfAbsent(List<LocationDimensionRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }

        int inserted = 0;
        for (LocationDimensionRow row : rows) {
            inserted += insertLocationIfAbsent(row);
        }
        return inserted;
    }

    public int insertLocationIfAbsent(LocationDimensionRow row) {
        return jdbcTemplate.update(INSERT_LOCATION_SQL,
                row.key().country(),
                row.key().state(),
                row.key().city(),
                row.key().postalCode(),
                row.locationType(),
                row.region());
    }

    /**
     * Locations are never versioned, so the composite key alone identifies the
     * row whatever its {@code is_current} flag says.
     */
    public Optional<Long> findLocationKey(LocationKey key) {
        String sql = """
                SELECT location_key FROM dim_location
                WHERE country = ? AND state = ? AND city = ? AND postal_code = ?
                """;

        List<Long> keys = jdbcTemplate.query(sql,
                (rs, rowNum) -> rs.getLong(1),
                key.country(), key.state(), key.city(), key.postalCode());
        return keys.stream().findFirst();
    }

    /**
     * Reads natural to surrogate key pairs of current rows for customer,
     * product and supplier, plus the calendar keys.
     */
    public DimensionKeyMap loadKeyMap() {
        var keyMap = new DimensionKeyMap(
                currentKeys(DimensionType.CUSTOMER, "customer_key", "customer_id"),
                currentKeys(DimensionType.PRODUCT, "product_key", "product_id"),
                currentKeys(DimensionType.SUPPLIER, "supplier_key", "supplier_id"),
                dateKeys());
        log.info("Dimension key map built: {} customers, {} products, {} suppliers, {} dates",
                keyMap.size(DimensionType.CUSTOMER),
                keyMap.size(DimensionType.PRODUCT),
                keyMap.size(DimensionType.SUPPLIER),
                keyMap.size(DimensionType.DATE));
        return keyMap;
    }

    private Map<Long, Long> currentKeys(DimensionType type, String surrogateColumn, String naturalColumn) {
        String sql = "SELECT " + surrogateColumn + ", " + naturalColumn
                + " FROM " + type.tableName() + " WHERE is_current";

        Map<Long, Long> keys = jdbcTemplate.query(sql, rs -> {
            var map = new HashMap<Long, Long>();
            while (rs.next()) {
                map.put(rs.getLong(2), rs.getLong(1));
            }
            return map;
        });
        return keys != null ? keys : Map.of();
    }

    private Set<Integer> dateKeys() {
        return new HashSet<>(jdbcTemplate.queryForList("SELECT date_key FROM dim_date", Integer.class));
    }

    private static int affected(int[][] counts) {
        return Arrays.stream(counts)
                .flatMapToInt(Arrays::stream)
                .map(count -> Math.max(count, 0))
                .sum();
    }
}
