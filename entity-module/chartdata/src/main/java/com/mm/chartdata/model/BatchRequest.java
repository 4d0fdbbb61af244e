package com.mm.chartdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchRequest {
    private String widgetId;
    private ChartDataSource config;

    public BatchRequest() {}

    public BatchRequest(String widgetId, ChartDataSource config) {
        this.widgetId = widgetId;
        this.config = config;
    }

    public String getWidgetId() { return widgetId; }
    public void setWidgetId(String widgetId) { this.widgetId = widgetId; }

    public ChartDataSource getConfig() { return config; }
    public void setConfig(ChartDataSource config) { this.config = config; }
}
