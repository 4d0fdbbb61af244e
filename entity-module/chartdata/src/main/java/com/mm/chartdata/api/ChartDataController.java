package com.mm.chartdata.api;

import com.mm.chartdata.model.BatchChartRequest;
import com.mm.chartdata.model.BatchResult;
import com.mm.chartdata.model.ChartDataSource;
import com.mm.chartdata.model.ChartResult;
import com.mm.chartdata.service.BatchChartService;
import com.mm.chartdata.service.ChartDataService;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("api/database/chart-data")
public class ChartDataController {

  private final ChartDataService chartData;
  private final BatchChartService batch;

  public ChartDataController(ChartDataService chartData, BatchChartService batch) {
    this.chartData = chartData;
    this.batch = batch;
  }

  // {success, data: rows, warnings?}
  @PostMapping
  public Map<String, Object> chartData(@RequestBody ChartDataSource spec) {
    ChartResult result = chartData.fetch(spec);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put("data", result.getRows());
    if (!result.getWarnings().isEmpty()) body.put("warnings", result.getWarnings());
    return body;
  }

  // {success, data: {widgetId: rows}, errors?: {widgetId: message}, warnings?: {widgetId: [...]}}
  @PostMapping("/batch")
  public Map<String, Object> batch(@RequestBody BatchChartRequest req) {
    List<BatchResult> results = batch.runBatch(req == null ? null : req.getRequests());

    Map<String, Object> data = new LinkedHashMap<>();
    Map<String, String> errors = new LinkedHashMap<>();
    Map<String, List<String>> warnings = new LinkedHashMap<>();
    for (BatchResult r : results) {
      if (r.isFailed()) {
        errors.put(r.getWidgetId(), r.getError());
      } else {
        data.put(r.getWidgetId(), r.getRows());
        if (!r.getWarnings().isEmpty()) warnings.put(r.getWidgetId(), r.getWarnings());
      }
    }

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put("data", data);
    if (!errors.isEmpty()) body.put("errors", errors);
    if (!warnings.isEmpty()) body.put("warnings", warnings);
    return body;
  }
}
