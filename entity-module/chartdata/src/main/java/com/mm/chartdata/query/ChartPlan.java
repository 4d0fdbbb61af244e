package com.mm.chartdata.query;

import com.mm.chartdata.model.Aggregation;
import com.mm.chartdata.model.Resolution;
import com.mm.chartdata.model.SortDirection;
import com.mm.chartdata.security.SqlIdentifier;

import java.util.ArrayList;
import java.util.List;

/**
 * A chart config after validation against a {@link com.mm.chartdata.schema.ColumnSet}.
 * Both the SQL compiler and the in-memory aggregator work from this, never from the raw spec.
 *
 * @param xAxis          null when the chart has no x axis
 * @param resolution     null when x values are used as they are
 * @param drillDownLabel null unless it is a valid column outside xAxis and groupBy
 * @param orderBy        null when no explicit order was resolved
 */
public record ChartPlan(
    SqlIdentifier xAxis,
    List<SqlIdentifier> yAxis,
    List<SqlIdentifier> groupBy,
    Aggregation aggregation,
    Resolution resolution,
    SqlIdentifier drillDownLabel,
    List<PlannedFilter> filters,
    SqlIdentifier orderBy,
    SortDirection orderDirection,
    int limit,
    List<String> warnings) {

  public boolean hasXAxis() {
    return xAxis != null;
  }

  /** Columns every result row carries, in select-list order. */
  public List<SqlIdentifier> outputColumns() {
    List<SqlIdentifier> out = new ArrayList<>();
    if (xAxis != null) out.add(xAxis);
    out.addAll(groupBy);
    if (drillDownLabel != null) out.add(drillDownLabel);
    out.addAll(yAxis);
    return out;
  }

  /** Grouping keys, in GROUP BY order. */
  public List<SqlIdentifier> groupingColumns() {
    List<SqlIdentifier> keys = new ArrayList<>();
    if (xAxis != null) keys.add(xAxis);
    keys.addAll(groupBy);
    return keys;
  }
}
