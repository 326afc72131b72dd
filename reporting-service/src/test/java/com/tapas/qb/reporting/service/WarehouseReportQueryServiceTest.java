package com.tapas.qb.reporting.service;

import com.tapas.qb.reporting.domain.CustomerSegment;
import com.tapas.qb.reporting.dto.CategorySalesRow;
import com.tapas.qb.reporting.dto.CustomerSegmentRow;
import com.tapas.qb.reporting.dto.InventoryStatusRow;
import com.tapas.qb.reporting.dto.MonthlySalesRow;
import com.tapas.qb.reporting.dto.ProductSalesRow;
import com.tapas.qb.reporting.dto.RegionSalesRow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.datasource.init.ScriptUtils;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DriverManager;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WarehouseReportQueryService")
class WarehouseReportQueryServiceTest {

    private Connection connection;
    private WarehouseReportQueryService service;

    @BeforeEach
    void setUp() throws Exception {
        connection = DriverManager.getConnection("jdbc:duckdb:");
        ScriptUtils.executeSqlScript(connection, new ClassPathResource("db/warehouse-fixture.sql"));
        service = new WarehouseReportQueryService(new JdbcTemplate(new SingleConnectionDataSource(connection, true)));
    }

    @AfterEach
    void tearDown() throws Exception {
        connection.close();
    }

    @Test
    @DisplayName("monthly trend is ordered by calendar month")
    void monthlySales() {
        List<MonthlySalesRow> months = service.monthlySales();

        assertEquals(List.of(1, 2, 3), months.stream().map(MonthlySalesRow::month).toList());
        MonthlySalesRow march = months.get(2);
        assertEquals("March", march.monthName());
        assertEquals(3, march.totalOrders());
        assertEquals(14, march.totalQuantitySold());
        assertDecimal("715.00", march.totalRevenue());
        assertDecimal("319.00", march.totalProfit());
        assertDecimal("32.28", march.avgProfitMarginPercent());
    }

    @Test
    @DisplayName("a month of deep-loss lines averages to a large negative margin")
    void monthlySalesWithDeepLoss() {
        var jdbc = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        jdbc.update("INSERT INTO dim_date VALUES (20240410, DATE '2024-04-10', 4, 'April', 2024)");
        jdbc.update("INSERT INTO fact_sales VALUES (1006, 5009, 20240410, 2, 1, 2, 10, 1.00, -2999.00, -299900.00)");

        MonthlySalesRow april = service.monthlySales().get(3);

        assertEquals("April", april.monthName());
        assertDecimal("-2999.00", april.totalProfit());
        assertDecimal("-299900.00", april.avgProfitMarginPercent());
    }

    @Test
    @DisplayName("top products are ranked by revenue and limited")
    void topProducts() {
        List<ProductSalesRow> products = service.topProducts(2);

        assertEquals(List.of("Smartphone", "Novel"), products.stream().map(ProductSalesRow::productName).toList());
        assertDecimal("1475.00", products.get(0).totalRevenue());
        assertEquals(16, products.get(1).totalQuantitySold());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 101})
    @DisplayName("limits outside 1..100 are rejected")
    void rejectsLimit(int limit) {
        assertThrows(IllegalArgumentException.class, () -> service.topProducts(limit));
        assertThrows(IllegalArgumentException.class, () -> service.latestInventory(limit));
    }

    @Test
    @DisplayName("category totals sum their products")
    void salesByCategory() {
        List<CategorySalesRow> categories = service.salesByCategory();

        assertEquals(List.of("Phones", "Books"), categories.stream().map(CategorySalesRow::categoryName).toList());
        assertDecimal("318.00", categories.get(1).totalRevenue());
    }

    @Test
    @DisplayName("customers are banded by lifetime value, highest average first")
    void customerSegments() {
        List<CustomerSegmentRow> segments = service.customerSegments();

        assertEquals(List.of(CustomerSegment.VIP, CustomerSegment.MEDIUM_VALUE, CustomerSegment.LOW_VALUE),
                segments.stream().map(CustomerSegmentRow::segment).toList());
        assertEquals(2, segments.get(1).customerCount());
        assertDecimal("357.50", segments.get(1).avgLifetimeValue());
        assertDecimal("1018.00", segments.get(0).avgLifetimeValue());
    }

    @Test
    @DisplayName("inventory status only shows the latest snapshot")
    void latestInventory() {
        List<InventoryStatusRow> inventory = service.latestInventory(20);

        assertEquals(List.of("Novel", "Sample Booklet", "Smartphone"),
                inventory.stream().map(InventoryStatusRow::productName).toList());
        assertTrue(inventory.stream().allMatch(row -> row.snapshotDate().equals(LocalDate.of(2024, 6, 15))));
        InventoryStatusRow phone = inventory.get(2);
        assertTrue(phone.outOfStock());
        assertTrue(phone.lowStock());
        assertFalse(inventory.get(0).lowStock());
    }

    @Test
    @DisplayName("region totals count distinct orders")
    void salesByRegion() {
        List<RegionSalesRow> regions = service.salesByRegion();

        assertEquals(List.of("West", "South", "East", "Other"), regions.stream().map(RegionSalesRow::region).toList());
        RegionSalesRow east = regions.get(2);
        assertEquals("USA", east.country());
        assertEquals(2, east.totalOrders());
        assertDecimal("300.00", east.totalRevenue());
    }

    private static void assertDecimal(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }
}
