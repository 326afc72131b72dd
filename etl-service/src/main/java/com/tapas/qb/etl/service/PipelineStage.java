package com.tapas.qb.etl.service;

public enum PipelineStage {
    CONNECT,
    DATE_DIMENSION,
    CUSTOMER_DIMENSION,
    PRODUCT_DIMENSION,
    SUPPLIER_DIMENSION,
    LOCATION_DIMENSION,
    SALES_FACTS,
    INVENTORY_FACTS,
    VERIFY
}
