package com.mm.chartdata.query;

import com.mm.chartdata.model.Aggregation;
import com.mm.chartdata.model.ChartDataSource;
import com.mm.chartdata.model.ChartFilter;
import com.mm.chartdata.model.FilterOperator;
import com.mm.chartdata.model.Resolution;
import com.mm.chartdata.model.SortDirection;
import com.mm.chartdata.schema.ColumnSet;
import com.mm.chartdata.security.IdentifierSanitizer;
import com.mm.chartdata.security.SqlIdentifier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Validates a {@link ChartDataSource} against a {@link ColumnSet} and normalizes it into a
 * {@link ChartPlan}. Required fields fail with {@link ChartValidationException}; optional
 * fields that don't resolve are dropped and reported as warnings.
 */
public final class ChartPlanner {
  public static final int DEFAULT_LIMIT = 50;

  private ChartPlanner() {}

  public static ChartPlan plan(ChartDataSource spec, ColumnSet columns) {
    List<String> warnings = new ArrayList<>();

    // ---------- Y axis ----------
    List<SqlIdentifier> yAxis = new ArrayList<>();
    List<String> rejected = new ArrayList<>();
    if (spec.getyAxis() != null) {
      for (String y : spec.getyAxis()) {
        if (columns.isValidField(y)) yAxis.add(SqlIdentifier.of(y));
        else rejected.add(String.valueOf(y));
      }
    }
    if (yAxis.isEmpty()) throw ChartValidationException.noValidYAxis(rejected);
    for (String r : rejected) warnings.add("yAxis column '" + r + "' ignored: not found");

    // ---------- X axis ----------
    SqlIdentifier xAxis = null;
    if (notBlank(spec.getxAxis())) {
      if (!columns.isValidField(spec.getxAxis())) throw ChartValidationException.invalidXAxis(spec.getxAxis());
      xAxis = SqlIdentifier.of(spec.getxAxis());
    }

    // ---------- GROUP BY ----------
    Set<SqlIdentifier> groupBy = new LinkedHashSet<>();
    if (spec.getGroupBy() != null) {
      for (String g : spec.getGroupBy()) {
        if (!notBlank(g)) continue;
        if (!columns.isValidField(g)) {
          warnings.add("groupBy column '" + g + "' ignored: not found");
          continue;
        }
        SqlIdentifier id = SqlIdentifier.of(g);
        if (id.equals(xAxis)) {
          warnings.add("groupBy column '" + g + "' ignored: already the x axis");
        } else if (!groupBy.add(id)) {
          warnings.add("groupBy column '" + g + "' ignored: duplicate");
        }
      }
    }

    Aggregation aggregation = Aggregation.parse(spec.getAggregation());
    if (notBlank(spec.getAggregation()) && !aggregation.name().equalsIgnoreCase(spec.getAggregation().trim())) {
      warnings.add("aggregation '" + spec.getAggregation() + "' not supported, using SUM");
    }

    Resolution resolution = null;
    if (notBlank(spec.getResolution())) {
      resolution = Resolution.parse(spec.getResolution());
      if (resolution == null) warnings.add("resolution '" + spec.getResolution() + "' ignored: not supported");
      else if (xAxis == null) resolution = null;
    }

    List<PlannedFilter> filters = planFilters(spec.getFilters(), columns::isValidField, warnings);

    // ---------- drill-down label ----------
    SqlIdentifier label = null;
    if (notBlank(spec.getDrillDownLabelField())) {
      if (!columns.isValidField(spec.getDrillDownLabelField())) {
        warnings.add("drillDownLabelField '" + spec.getDrillDownLabelField() + "' ignored: not found");
      } else {
        SqlIdentifier id = SqlIdentifier.of(spec.getDrillDownLabelField());
        if (!id.equals(xAxis) && !groupBy.contains(id)) label = id;
      }
    }

    // ---------- ORDER BY ----------
    // only result columns: the grouped query has nothing else to order by
    SqlIdentifier orderBy = null;
    if (notBlank(spec.getOrderBy())) {
      if (!columns.isValidField(spec.getOrderBy())) {
        warnings.add("orderBy column '" + spec.getOrderBy() + "' ignored: not found");
      } else {
        SqlIdentifier id = SqlIdentifier.of(spec.getOrderBy());
        boolean inResult = id.equals(xAxis) || groupBy.contains(id) || id.equals(label) || yAxis.contains(id);
        if (inResult) orderBy = id;
        else warnings.add("orderBy column '" + spec.getOrderBy() + "' ignored: not a result column");
      }
    }

    return new ChartPlan(
        xAxis,
        List.copyOf(yAxis),
        List.copyOf(groupBy),
        aggregation,
        resolution,
        label,
        filters,
        orderBy,
        SortDirection.parse(spec.getOrderDirection()),
        effectiveLimit(spec.getLimit()),
        List.copyOf(warnings));
  }

  /**
   * Keeps filters whose field passes {@code isKnownField} and whose operator is supported.
   * Dropped filters are described in {@code warnings}.
   */
  public static List<PlannedFilter> planFilters(List<ChartFilter> raw, Predicate<String> isKnownField, List<String> warnings) {
    List<PlannedFilter> out = new ArrayList<>();
    if (raw == null) return out;
    for (ChartFilter f : raw) {
      if (f == null) continue;
      if (IdentifierSanitizer.sanitize(f.getField()).isEmpty() || !isKnownField.test(f.getField())) {
        warnings.add("filter on '" + f.getField() + "' ignored: unknown field");
        continue;
      }
      FilterOperator op = FilterOperator.fromSymbol(f.getOperator());
      if (op == null) {
        warnings.add("filter on '" + f.getField() + "' ignored: unsupported operator '" + f.getOperator() + "'");
        continue;
      }
      List<Object> values = new ArrayList<>();
      if (op == FilterOperator.IN) {
        if (f.getValue() instanceof Collection<?> c) values.addAll(c);
        else if (f.getValue() != null) values.add(f.getValue());
        if (values.isEmpty()) {
          warnings.add("filter on '" + f.getField() + "' ignored: empty IN list");
          continue;
        }
        if (values.stream().anyMatch(ChartPlanner::isStructured) || f.getValue() instanceof Map<?, ?>) {
          warnings.add("filter on '" + f.getField() + "' ignored: IN list must hold single values");
          continue;
        }
      } else {
        if (isStructured(f.getValue())) {
          warnings.add("filter on '" + f.getField() + "' ignored: operator '" + f.getOperator() + "' needs a single value");
          continue;
        }
        values.add(f.getValue());
      }
      out.add(new PlannedFilter(SqlIdentifier.of(f.getField()), op, Collections.unmodifiableList(values)));
    }
    return List.copyOf(out);
  }

  public static int effectiveLimit(Integer limit) {
    return (limit == null || limit <= 0) ? DEFAULT_LIMIT : limit;
  }

  // lists and objects only bind as IN placeholders
  private static boolean isStructured(Object value) {
    return value instanceof Collection<?> || value instanceof Map<?, ?>;
  }

  private static boolean notBlank(String s) {
    return s != null && !s.isBlank();
  }
}
