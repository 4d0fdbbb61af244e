package com.mm.chartdata.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Declarative description of one chart's data needs, as posted by the dashboard UI.
 * Field names follow the UI's JSON shape; unknown properties are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChartDataSource {
    private String table;
    private String xAxis;
    private List<String> yAxis;
    private String aggregation;   // sum | avg | count | min | max
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> groupBy; // "col" or ["a", "b"]
    private String orderBy;
    private String orderDirection; // asc | desc
    private Integer limit;
    private List<ChartFilter> filters;
    private String resolution;    // day | month | year
    private String drillDownLabelField;
    private String queryMode;     // simple | custom | import
    private String customQuery;
    private List<Map<String, Object>> importedData;
    private String connectionId;

    public String getTable() { return table; }
    public void setTable(String table) { this.table = table; }

    public String getxAxis() { return xAxis; }
    public void setxAxis(String xAxis) { this.xAxis = xAxis; }

    public List<String> getyAxis() { return yAxis; }
    public void setyAxis(List<String> yAxis) { this.yAxis = yAxis; }

    public String getAggregation() { return aggregation; }
    public void setAggregation(String aggregation) { this.aggregation = aggregation; }

    public List<String> getGroupBy() { return groupBy; }
    public void setGroupBy(List<String> groupBy) { this.groupBy = groupBy; }

    public String getOrderBy() { return orderBy; }
    public void setOrderBy(String orderBy) { this.orderBy = orderBy; }

    public String getOrderDirection() { return orderDirection; }
    public void setOrderDirection(String orderDirection) { this.orderDirection = orderDirection; }

    public Integer getLimit() { return limit; }
    public void setLimit(Integer limit) { this.limit = limit; }

    public List<ChartFilter> getFilters() { return filters; }
    public void setFilters(List<ChartFilter> filters) { this.filters = filters; }

    public String getResolution() { return resolution; }
    public void setResolution(String resolution) { this.resolution = resolution; }

    public String getDrillDownLabelField() { return drillDownLabelField; }
    public void setDrillDownLabelField(String drillDownLabelField) { this.drillDownLabelField = drillDownLabelField; }

    public String getQueryMode() { return queryMode; }
    public void setQueryMode(String queryMode) { this.queryMode = queryMode; }

    public String getCustomQuery() { return customQuery; }
    public void setCustomQuery(String customQuery) { this.customQuery = customQuery; }

    public List<Map<String, Object>> getImportedData() { return importedData; }
    public void setImportedData(List<Map<String, Object>> importedData) { this.importedData = importedData; }

    public String getConnectionId() { return connectionId; }
    public void setConnectionId(String connectionId) { this.connectionId = connectionId; }
}
