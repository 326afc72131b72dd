package com.tapas.qb.etl.service;

import com.tapas.qb.etl.domain.CustomerDimensionRow;
import com.tapas.qb.etl.domain.LocationDimensionRow;
import com.tapas.qb.etl.domain.LocationKey;
import com.tapas.qb.etl.domain.ProductDimensionRow;
import com.tapas.qb.etl.domain.SupplierDimensionRow;
import com.tapas.qb.etl.dto.CustomerRecord;
import com.tapas.qb.etl.dto.ProductRecord;
import com.tapas.qb.etl.dto.SupplierRecord;
import com.tapas.qb.etl.session.PipelineSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Full re-evaluation of the business dimensions. Each load overwrites the
 * current attribute values by natural key; surrogate keys stay as assigned.
 */
@Service
public class DimensionLoader {

    private static final Logger log = LoggerFactory.getLogger(DimensionLoader.class);

    static final String SHIPPING_LOCATION = "Shipping";

    private final Clock clock;
    private final RegionClassifier regionClassifier;

    public DimensionLoader(Clock clock, RegionClassifier regionClassifier) {
        this.clock = clock;
        this.regionClassifier = regionClassifier;
    }

    public StageResult loadCustomers(PipelineSession session) {
        log.info("Loading dim_customer...");
        List<CustomerRecord> customers = session.source().findCustomers();
        LocalDate today = LocalDate.now(clock);

        var rows = customers.stream()
                .map(customer -> toDimensionRow(customer, today))
                .toList();
        session.dimensions().upsertCustomers(rows);

        log.info("Loaded {} customers into dim_customer", rows.size());
        return StageResult.of(PipelineStage.CUSTOMER_DIMENSION, customers.size(), rows.size());
    }

    public StageResult loadProducts(PipelineSession session) {
        log.info("Loading dim_product...");
        List<ProductRecord> products = session.source().findProducts();

        var rows = products.stream()
                .map(DimensionLoader::toDimensionRow)
                .toList();
        session.dimensions().upsertProducts(rows);

        log.info("Loaded {} products into dim_product", rows.size());
        return StageResult.of(PipelineStage.PRODUCT_DIMENSION, products.size(), rows.size());
    }

    public StageResult loadSuppliers(PipelineSession session) {
        log.info("Loading dim_supplier...");
        List<SupplierRecord> suppliers = session.source().findSuppliers();

        var rows = suppliers.stream()
                .map(s -> new SupplierDimensionRow(
                        s.supplierId(),
                        s.supplierName(),
                        s.contactPerson(),
                        s.email(),
                        s.phone(),
                        s.city(),
                        s.state(),
                        s.country(),
                        s.postalCode()))
                .toList();
        session.dimensions().upsertSuppliers(rows);

        log.info("Loaded {} suppliers into dim_supplier", rows.size());
        return StageResult.of(PipelineStage.SUPPLIER_DIMENSION, suppliers.size(), rows.size());
    }

    /**
     * Seeds dim_location with every shipping address already on an order.
     * Known locations keep their key and region.
     */
    public StageResult loadLocations(PipelineSession session) {
        log.info("Loading dim_location...");
        List<LocationKey> locations = session.source().findShippingLocations();

        var rows = locations.stream()
                .map(key -> new LocationDimensionRow(key, SHIPPING_LOCATION, regionClassifier.classify(key.state())))
                .toList();
        int inserted = session.dimensions().insertLocationsIfAbsent(rows);

        log.info("Found {} shipping locations, {} new in dim_location", locations.size(), inserted);
        return StageResult.of(PipelineStage.LOCATION_DIMENSION, locations.size(), inserted);
    }

    static CustomerDimensionRow toDimensionRow(CustomerRecord customer, LocalDate today) {
        Integer age = MeasureCalculator.age(customer.dateOfBirth(), today);

        return new CustomerDimensionRow(
                customer.customerId(),
                fullName(customer.firstName(), customer.lastName()),
                customer.firstName(),
                customer.lastName(),
                customer.email(),
                customer.phone(),
                customer.dateOfBirth(),
                age,
                MeasureCalculator.ageGroup(age),
                customer.gender(),
                customer.city(),
                customer.state(),
                customer.country(),
                customer.postalCode(),
                customer.registrationDate(),
                customer.status(),
                MeasureCalculator.yearsAsCustomer(customer.registrationDate(), today),
                "Active".equals(customer.status()));
    }

    static ProductDimensionRow toDimensionRow(ProductRecord product) {
        BigDecimal margin = MeasureCalculator.profitMargin(product.unitPrice(), product.costPrice());

        return new ProductDimensionRow(
                product.productId(),
                product.productCode(),
                product.productName(),
                product.description(),
                product.categoryId(),
                product.categoryName(),
                product.parentCategoryId(),
                product.parentCategoryName(),
                product.supplierId(),
                product.supplierName(),
                product.unitPrice(),
                product.costPrice(),
                margin,
                MeasureCalculator.profitMarginPercent(margin, product.unitPrice()),
                product.weightKg(),
                product.dimensions(),
                product.status());
    }

    private static String fullName(String firstName, String lastName) {
        if (firstName == null) {
            return lastName;
        }
        return lastName == null ? firstName : firstName + " " + lastName;
    }
}
