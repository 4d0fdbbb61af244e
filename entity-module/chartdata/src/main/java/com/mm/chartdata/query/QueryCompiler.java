package com.mm.chartdata.query;

import com.mm.chartdata.model.FilterOperator;
import com.mm.chartdata.model.SortDirection;
import com.mm.chartdata.schema.TableRef;
import com.mm.chartdata.security.SqlIdentifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link ChartPlan} into parameterized SQL. Pure: no I/O, same input gives the same text.
 * Identifiers arrive as {@link SqlIdentifier} and are quoted by the dialect; values only ever
 * appear as {@code :filterParamN} placeholders.
 */
public final class QueryCompiler {
  static final String PARAM_PREFIX = "filterParam";
  static final String CUSTOM_ALIAS = "_filtered_sub";

  private QueryCompiler() {}

  public static CompiledQuery compile(ChartPlan plan, TableRef table, SqlDialect dialect) {
    List<String> select = new ArrayList<>();
    List<String> groupBy = new ArrayList<>();
    List<String> wheres = new ArrayList<>();
    List<QueryParameter> params = new ArrayList<>();

    // ---------- X axis ----------
    if (plan.xAxis() != null) {
      String col = dialect.quote(plan.xAxis());
      String expr = plan.resolution() == null ? col : dialect.dateBucket(col, plan.resolution());
      // SELECT and GROUP BY must use the identical expression
      select.add(expr + " AS " + col);
      groupBy.add(expr);
      wheres.add(col + " IS NOT NULL");
    }

    // ---------- GROUP BY columns ----------
    for (SqlIdentifier g : plan.groupBy()) {
      String col = dialect.quote(g);
      select.add(col + " AS " + col);
      groupBy.add(col);
    }

    // ---------- drill-down label ----------
    if (plan.drillDownLabel() != null) {
      String col = dialect.quote(plan.drillDownLabel());
      select.add("MAX(" + col + ") AS " + col);
    }

    // ---------- aggregates ----------
    String fn = plan.aggregation().name();
    for (SqlIdentifier y : plan.yAxis()) {
      String col = dialect.quote(y);
      select.add(fn + "(" + col + ") AS " + col);
    }

    // ---------- WHEREs ----------
    appendFilters(plan.filters(), dialect, wheres, params);

    StringBuilder sql = new StringBuilder();
    sql.append("SELECT ").append(dialect.selectPrefix(plan.limit())).append('\n');
    sql.append("  ").append(String.join(", ", select)).append('\n');
    sql.append("FROM ").append(dialect.qualify(table)).append('\n');
    sql.append("WHERE 1=1\n");
    for (String w : wheres) sql.append("  AND ").append(w).append('\n');

    if (!groupBy.isEmpty()) {
      sql.append("GROUP BY\n  ").append(String.join(", ", groupBy)).append('\n');
    }
    if (plan.orderBy() != null) {
      sql.append("ORDER BY\n  ").append(dialect.quote(plan.orderBy()))
          .append(plan.orderDirection() == SortDirection.DESC ? " DESC" : " ASC").append('\n');
    }
    String limit = dialect.limitClause(plan.limit());
    if (!limit.isEmpty()) sql.append(limit).append('\n');

    return new CompiledQuery(tidy(sql.toString()), params);
  }

  /**
   * Layers filters over an already validated custom query by wrapping it as a subquery.
   * Without filters the query is returned untouched.
   */
  public static CompiledQuery compileCustom(String validatedSql, List<PlannedFilter> filters, SqlDialect dialect) {
    if (filters == null || filters.isEmpty()) {
      return new CompiledQuery(validatedSql, List.of());
    }
    List<String> wheres = new ArrayList<>();
    List<QueryParameter> params = new ArrayList<>();
    appendFilters(filters, dialect, wheres, params);

    String inner = validatedSql.trim();
    if (inner.endsWith(";")) inner = inner.substring(0, inner.length() - 1).trim();

    StringBuilder sql = new StringBuilder();
    sql.append("SELECT * FROM (\n").append(inner).append("\n) AS ").append(CUSTOM_ALIAS).append('\n');
    sql.append("WHERE 1=1\n");
    for (String w : wheres) sql.append("  AND ").append(w).append('\n');
    return new CompiledQuery(sql.toString().trim(), params);
  }

  private static void appendFilters(List<PlannedFilter> filters, SqlDialect dialect,
                                    List<String> wheres, List<QueryParameter> params) {
    for (int i = 0; i < filters.size(); i++) {
      PlannedFilter f = filters.get(i);
      String col = dialect.quote(f.field());
      String name = PARAM_PREFIX + i;
      if (f.operator() == FilterOperator.IN) {
        List<String> placeholders = new ArrayList<>();
        for (int j = 0; j < f.values().size(); j++) {
          String n = name + "_" + j;
          placeholders.add(":" + n);
          params.add(new QueryParameter(n, f.values().get(j)));
        }
        wheres.add(col + " IN (" + String.join(", ", placeholders) + ")");
      } else {
        wheres.add(col + " " + f.operator().symbol() + " :" + name);
        params.add(new QueryParameter(name, f.value()));
      }
    }
  }

  private static String tidy(String sql) {
    return sql.replaceAll("[ \\t]+\\n", "\n").trim();
  }
}
