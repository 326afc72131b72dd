package com.tapas.qb.etl.domain;

public enum DimensionType {
    DATE("dim_date"),
    CUSTOMER("dim_customer"),
    PRODUCT("dim_product"),
    SUPPLIER("dim_supplier"),
    LOCATION("dim_location");

    private final String tableName;

    DimensionType(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
