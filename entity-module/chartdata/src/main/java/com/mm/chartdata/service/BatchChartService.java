package com.mm.chartdata.service;

import com.mm.chartdata.model.BatchRequest;
import com.mm.chartdata.model.BatchResult;

import java.util.List;

public interface BatchChartService {
    /** One result per request, in request order, available once every request has finished. */
    List<BatchResult> runBatch(List<BatchRequest> requests);
}
