package com.mm.chartdata.engine;

import com.mm.chartdata.model.Aggregation;
import com.mm.chartdata.query.ChartPlan;
import com.mm.chartdata.query.PlannedFilter;
import com.mm.chartdata.schema.ColumnSet;
import com.mm.chartdata.security.SqlIdentifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a {@link ChartPlan} over rows already in memory, producing what the compiled SQL
 * would return for the same rows: same columns in the same order, same groups, same
 * aggregates, same ordering and limit.
 */
public final class LocalAggregator {

  private LocalAggregator() {}

  /**
   * @param columns column set the plan was built from; maps sanitized names back to row keys
   */
  public static List<Map<String, Object>> aggregate(List<Map<String, Object>> rows, ChartPlan plan, ColumnSet columns) {
    List<SqlIdentifier> keys = plan.groupingColumns();
    Map<List<Object>, Group> groups = new LinkedHashMap<>();

    for (Map<String, Object> row : rows) {
      if (row == null) continue;
      if (plan.xAxis() != null && value(row, plan.xAxis(), columns) == null) continue;
      if (!passesFilters(row, plan.filters(), columns)) continue;

      List<Object> display = new ArrayList<>(keys.size());
      List<Object> groupKey = new ArrayList<>(keys.size());
      for (SqlIdentifier k : keys) {
        Object v = value(row, k, columns);
        if (k.equals(plan.xAxis()) && plan.resolution() != null) v = ChartSemantics.bucket(v, plan.resolution());
        display.add(v);
        groupKey.add(ChartSemantics.groupKey(v));
      }
      groups.computeIfAbsent(groupKey, k -> new Group(display, plan)).add(row, plan, columns);
    }

    // an ungrouped aggregate always yields exactly one row, even over nothing
    if (keys.isEmpty() && groups.isEmpty()) {
      groups.put(List.of(), new Group(List.of(), plan));
    }

    List<Map<String, Object>> out = new ArrayList<>(groups.size());
    for (Group g : groups.values()) out.add(g.toRow(keys, plan));

    if (plan.orderBy() != null) {
      String col = plan.orderBy().name();
      out.sort((a, b) -> ChartSemantics.compareForSort(a.get(col), b.get(col), plan.orderDirection()));
    }
    if (out.size() > plan.limit()) {
      out = new ArrayList<>(out.subList(0, plan.limit()));
    }
    ChartSemantics.applyCompositeLabels(out, plan);
    return out;
  }

  private static boolean passesFilters(Map<String, Object> row, List<PlannedFilter> filters, ColumnSet columns) {
    for (PlannedFilter f : filters) {
      if (!ChartSemantics.matches(value(row, f.field(), columns), f)) return false;
    }
    return true;
  }

  private static Object value(Map<String, Object> row, SqlIdentifier column, ColumnSet columns) {
    return row.get(columns.sourceName(column.name()));
  }

  private static final class Group {
    private final List<Object> keyValues;
    private final List<List<Object>> measures = new ArrayList<>();
    private final List<Object> labels = new ArrayList<>();

    Group(List<Object> keyValues, ChartPlan plan) {
      this.keyValues = keyValues;
      for (int i = 0; i < plan.yAxis().size(); i++) measures.add(new ArrayList<>());
    }

    void add(Map<String, Object> row, ChartPlan plan, ColumnSet columns) {
      for (int i = 0; i < plan.yAxis().size(); i++) {
        measures.get(i).add(value(row, plan.yAxis().get(i), columns));
      }
      if (plan.drillDownLabel() != null) labels.add(value(row, plan.drillDownLabel(), columns));
    }

    Map<String, Object> toRow(List<SqlIdentifier> keys, ChartPlan plan) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 0; i < keys.size(); i++) row.put(keys.get(i).name(), keyValues.get(i));
      if (plan.drillDownLabel() != null) {
        row.put(plan.drillDownLabel().name(), ChartSemantics.aggregate(Aggregation.MAX, labels));
      }
      for (int i = 0; i < plan.yAxis().size(); i++) {
        row.put(plan.yAxis().get(i).name(), ChartSemantics.aggregate(plan.aggregation(), measures.get(i)));
      }
      return row;
    }
  }
}
