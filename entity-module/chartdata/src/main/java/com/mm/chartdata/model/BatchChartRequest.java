package com.mm.chartdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Request envelope of the batch endpoint: {@code {"requests": [{widgetId, config}, ...]}}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchChartRequest {
    private List<BatchRequest> requests;

    public List<BatchRequest> getRequests() { return requests; }
    public void setRequests(List<BatchRequest> requests) { this.requests = requests; }
}
