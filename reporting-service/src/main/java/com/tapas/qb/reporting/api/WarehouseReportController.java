package com.tapas.qb.reporting.api;

import com.tapas.qb.reporting.service.WarehouseReportQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/reports")
@Tag(name = "Warehouse reports", description = "Aggregates over the sales star schema")
public class WarehouseReportController {

    private final WarehouseReportQueryService service;

    public WarehouseReportController(WarehouseReportQueryService service) {
        this.service = service;
    }

    @Operation(
            summary = "Monthly sales trend",
            description = "Orders, units, revenue, profit and average margin per calendar month, oldest first.",
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Successful response",
                            content = @Content(
                                    mediaType = "application/json",
                                    schema = @Schema(implementation = MonthlySalesResponse.class),
                                    examples = @ExampleObject(
                                            name = "monthlySalesExample",
                                            value = "[{\n  \"yearMonth\": \"2024-01\",\n  \"monthName\": \"January\",\n  \"totalOrders\": 42,\n  \"totalQuantitySold\": 118,\n  \"totalRevenue\": 15230.50,\n  \"totalProfit\": 4120.10,\n  \"avgProfitMarginPercent\": 27.35\n}]"
                                    )
                            )
                    )
            }
    )
    @GetMapping("/sales/monthly")
    public List<MonthlySalesResponse> monthlySales() {
        return service.monthlySales()
                .stream()
                .map(MonthlySalesResponse::from)
                .toList();
    }

    @Operation(
            summary = "Top products by revenue",
            description = "Best selling products by summed line total."
    )
    @GetMapping("/products/top")
    public List<ProductSalesResponse> topProducts(
            @Parameter(description = "Max number of products to return (1-100)", example = "10")
            @RequestParam(defaultValue = "10") int limit
    ) {
        return service.topProducts(limit)
                .stream()
                .map(ProductSalesResponse::from)
                .toList();
    }

    @Operation(summary = "Sales by category")
    @GetMapping("/sales/by-category")
    public List<CategorySalesResponse> salesByCategory() {
        return service.salesByCategory()
                .stream()
                .map(CategorySalesResponse::from)
                .toList();
    }

    @Operation(
            summary = "Customer value segments",
            description = "Customers banded by lifetime revenue: VIP from 1000, High Value from 500, "
                    + "Medium Value from 200, otherwise Low Value."
    )
    @GetMapping("/customers/segments")
    public List<CustomerSegmentResponse> customerSegments() {
        return service.customerSegments()
                .stream()
                .map(CustomerSegmentResponse::from)
                .toList();
    }

    @Operation(
            summary = "Latest inventory status",
            description = "Stock position from the most recent inventory snapshot, highest stock value first."
    )
    @GetMapping("/inventory/latest")
    public List<InventoryStatusResponse> latestInventory(
            @Parameter(description = "Max number of products to return (1-100)", example = "20")
            @RequestParam(defaultValue = "20") int limit
    ) {
        return service.latestInventory(limit)
                .stream()
                .map(InventoryStatusResponse::from)
                .toList();
    }

    @Operation(summary = "Sales by region and country")
    @GetMapping("/sales/by-region")
    public List<RegionSalesResponse> salesByRegion() {
        return service.salesByRegion()
                .stream()
                .map(RegionSalesResponse::from)
                .toList();
    }
}
