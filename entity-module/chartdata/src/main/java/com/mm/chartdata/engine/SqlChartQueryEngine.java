package com.mm.chartdata.engine;

import com.mm.chartdata.jdbc.ChartQueryExecutor;
import com.mm.chartdata.jdbc.DataSourceRegistry;
import com.mm.chartdata.model.ChartDataSource;
import com.mm.chartdata.model.ChartResult;
import com.mm.chartdata.model.QueryMode;
import com.mm.chartdata.query.ChartPlan;
import com.mm.chartdata.query.ChartPlanner;
import com.mm.chartdata.query.ChartValidationException;
import com.mm.chartdata.query.CompiledQuery;
import com.mm.chartdata.query.QueryCompiler;
import com.mm.chartdata.query.SqlDialect;
import com.mm.chartdata.schema.ColumnSet;
import com.mm.chartdata.schema.SchemaValidator;
import com.mm.chartdata.schema.TableRef;
import com.mm.chartdata.security.IdentifierSanitizer;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.List;
import java.util.Map;

/** Simple mode: resolve table, fetch columns, plan, compile, execute. */
@Component
public class SqlChartQueryEngine implements ChartQueryEngine {

  private final DataSourceRegistry dataSources;
  private final SchemaValidator schema;
  private final ChartQueryExecutor executor;
  private final SqlDialect dialect;

  public SqlChartQueryEngine(DataSourceRegistry dataSources, SchemaValidator schema,
                             ChartQueryExecutor executor, SqlDialect dialect) {
    this.dataSources = dataSources;
    this.schema = schema;
    this.executor = executor;
    this.dialect = dialect;
  }

  @Override
  public QueryMode mode() {
    return QueryMode.SIMPLE;
  }

  @Override
  public ChartResult run(ChartDataSource spec) {
    String table = IdentifierSanitizer.sanitize(spec.getTable());
    if (table.isEmpty()) throw new ChartValidationException("Table name is required");

    DataSource ds = dataSources.resolve(spec.getConnectionId());
    TableRef ref = schema.resolveTable(ds, table);
    ColumnSet columns = schema.fetchColumns(ds, ref);

    ChartPlan plan = ChartPlanner.plan(spec, columns);
    CompiledQuery query = QueryCompiler.compile(plan, ref, dialect);

    List<Map<String, Object>> rows = executor.execute(ds, query, plan.limit());
    ChartSemantics.applyCompositeLabels(rows, plan);
    return new ChartResult(rows, plan.warnings());
  }
}
