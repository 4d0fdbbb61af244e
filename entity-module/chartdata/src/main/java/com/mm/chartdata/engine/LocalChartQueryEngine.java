package com.mm.chartdata.engine;

import com.mm.chartdata.model.ChartDataSource;
import com.mm.chartdata.model.ChartResult;
import com.mm.chartdata.model.QueryMode;
import com.mm.chartdata.query.ChartPlan;
import com.mm.chartdata.query.ChartPlanner;
import com.mm.chartdata.query.ChartValidationException;
import com.mm.chartdata.schema.ColumnSet;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/** Import mode: aggregates the rows the caller sent with the chart. */
@Component
public class LocalChartQueryEngine implements ChartQueryEngine {

  @Override
  public QueryMode mode() {
    return QueryMode.IMPORT;
  }

  @Override
  public ChartResult run(ChartDataSource spec) {
    List<Map<String, Object>> rows = spec.getImportedData();
    if (rows == null) throw new ChartValidationException("importedData is required for import mode");
    if (spec.getyAxis() == null || spec.getyAxis().isEmpty()) throw ChartValidationException.noValidYAxis(List.of());
    // nothing to validate columns against
    if (rows.isEmpty()) return new ChartResult(List.of(), List.of());

    ColumnSet columns = ColumnSet.fromRows(rows);
    ChartPlan plan = ChartPlanner.plan(spec, columns);
    return new ChartResult(LocalAggregator.aggregate(rows, plan, columns), plan.warnings());
  }
}
