package com.mm.chartdata.engine;

import com.mm.chartdata.model.ChartDataSource;
import com.mm.chartdata.model.ChartResult;
import com.mm.chartdata.model.QueryMode;

/**
 * One way of producing chart rows from a {@link ChartDataSource}. The SQL and in-memory
 * engines must return the same rows for the same logical data.
 */
public interface ChartQueryEngine {

  QueryMode mode();

  ChartResult run(ChartDataSource spec);
}
