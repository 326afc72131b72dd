package com.tapas.qb.etl.config;

import com.tapas.qb.etl.domain.LoadMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings under the {@code etl} prefix.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "etl")
public class EtlProperties {

    @Valid
    @NotNull
    private Endpoint source = new Endpoint();

    @Valid
    @NotNull
    private Endpoint target = new Endpoint();

    @Valid
    @NotNull
    private DateDimension dateDimension = new DateDimension();

    @Valid
    @NotNull
    private Inventory inventory = new Inventory();

    @NotNull
    private LoadMode loadMode = LoadMode.INCREMENTAL;

    @Min(1)
    private int batchSize = 1000;

    /**
     * State code to sales region. Shared by the bulk location load and the
     * lazy location resolution.
     */
    private Map<String, String> regions = new LinkedHashMap<>();

    @NotBlank
    private String defaultRegion = "Other";

    @Getter
    @Setter
    public static class Endpoint {
        @NotBlank
        private String url;
        private String username;
        private String password;
        private String driverClassName;
    }

    @Getter
    @Setter
    public static class DateDimension {
        @NotNull
        private LocalDate startDate = LocalDate.of(2020, 1, 1);
        @NotNull
        private LocalDate endDate = LocalDate.of(2030, 12, 31);
    }

    @Getter
    @Setter
    public static class Inventory {
        @Valid
        @NotNull
        private DefaultLocation defaultLocation = new DefaultLocation();
    }

    /**
     * Location every inventory snapshot row is booked against.
     */
    @Getter
    @Setter
    public static class DefaultLocation {
        @NotBlank
        private String country = "USA";
        private String state = "";
        private String city = "Main Warehouse";
        private String postalCode = "";
    }
}
