package org.iceforge.strata.semantic.web;

import org.iceforge.strata.semantic.config.StrataProperties;

/**
 * Submit body for the warehouse execution service: where to connect and what to run.
 */
public record WarehouseQueryRequest(Connection jdbc, String sql) {

    public static WarehouseQueryRequest of(StrataProperties.Warehouse warehouse, String sql) {
        return new WarehouseQueryRequest(
                new Connection(warehouse.getJdbcUrl(), warehouse.getUsername(), warehouse.getPassword()), sql);
    }

    public record Connection(String jdbcUrl, String username, String password) {}
}
