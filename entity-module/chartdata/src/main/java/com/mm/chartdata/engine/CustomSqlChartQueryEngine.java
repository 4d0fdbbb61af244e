package com.mm.chartdata.engine;

import com.mm.chartdata.jdbc.ChartQueryExecutor;
import com.mm.chartdata.jdbc.DataSourceRegistry;
import com.mm.chartdata.model.ChartDataSource;
import com.mm.chartdata.model.ChartResult;
import com.mm.chartdata.model.QueryMode;
import com.mm.chartdata.procedures.ProcedureWhitelistStore;
import com.mm.chartdata.query.ChartPlanner;
import com.mm.chartdata.query.CompiledQuery;
import com.mm.chartdata.query.PlannedFilter;
import com.mm.chartdata.query.QueryCompiler;
import com.mm.chartdata.query.SqlDialect;
import com.mm.chartdata.security.CustomSqlValidator;
import com.mm.chartdata.security.SqlValidationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Custom mode: the caller's SQL runs as written once it passes validation. Filters are
 * layered on top as a parameterized WHERE around it; rows are returned without aggregation.
 */
@Component
public class CustomSqlChartQueryEngine implements ChartQueryEngine {

  private final DataSourceRegistry dataSources;
  private final CustomSqlValidator validator;
  private final ProcedureWhitelistStore whitelist;
  private final ChartQueryExecutor executor;
  private final SqlDialect dialect;

  public CustomSqlChartQueryEngine(DataSourceRegistry dataSources, CustomSqlValidator validator,
                                   ProcedureWhitelistStore whitelist, ChartQueryExecutor executor, SqlDialect dialect) {
    this.dataSources = dataSources;
    this.validator = validator;
    this.whitelist = whitelist;
    this.executor = executor;
    this.dialect = dialect;
  }

  @Override
  public QueryMode mode() {
    return QueryMode.CUSTOM;
  }

  @Override
  public ChartResult run(ChartDataSource spec) {
    SqlValidationResult validated = validator.requireValid(spec.getCustomQuery(), whitelist.current());

    List<String> warnings = new ArrayList<>();
    // no catalog lookup here, so any sanitizable field name is accepted
    List<PlannedFilter> filters = ChartPlanner.planFilters(spec.getFilters(), f -> true, warnings);
    if (!filters.isEmpty() && validated.storedProcedure()) {
      warnings.add("filters ignored: stored procedure results cannot be filtered");
      filters = List.of();
    } else if (!filters.isEmpty() && !dialect.allowsCteInSubquery()
        && CustomSqlValidator.isCommonTableExpression(validated.sanitizedQuery())) {
      warnings.add("filters ignored: WITH queries cannot be wrapped as a subquery on " + dialect.name());
      filters = List.of();
    }

    CompiledQuery query = QueryCompiler.compileCustom(validated.sanitizedQuery(), filters, dialect);
    int maxRows = spec.getLimit() != null && spec.getLimit() > 0 ? spec.getLimit() : 0;
    List<Map<String, Object>> rows = executor.execute(dataSources.resolve(spec.getConnectionId()), query, maxRows);
    return new ChartResult(rows, warnings);
  }
}
