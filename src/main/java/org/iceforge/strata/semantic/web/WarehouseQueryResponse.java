package org.iceforge.strata.semantic.web;

/**
 * Conservative shape: the warehouse may return more fields; we only need the row count.
 */
public class WarehouseQueryResponse {
    private String queryId;
    private Long totalRows;

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public Long getTotalRows() {
        return totalRows;
    }

    public void setTotalRows(Long totalRows) {
        this.totalRows = totalRows;
    }
}
