package com.mm.chartdata.api;

import com.mm.chartdata.jdbc.ChartQueryExecutor;
import com.mm.chartdata.jdbc.DataSourceRegistry;
import com.mm.chartdata.query.ChartValidationException;
import com.mm.chartdata.query.CompiledQuery;
import com.mm.chartdata.query.SqlDialect;
import com.mm.chartdata.schema.SchemaValidator;
import com.mm.chartdata.schema.TableRef;
import com.mm.chartdata.security.IdentifierSanitizer;
import org.springframework.web.bind.annotation.*;

import javax.sql.DataSource;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Catalog browsing for the chart builder: table list and per-table columns with sample rows. */
@RestController
@RequestMapping("api/database")
public class DatabaseController {
  private static final int SAMPLE_ROWS = 10;

  private final DataSourceRegistry dataSources;
  private final SchemaValidator schema;
  private final ChartQueryExecutor executor;
  private final SqlDialect dialect;

  public DatabaseController(DataSourceRegistry dataSources, SchemaValidator schema,
                            ChartQueryExecutor executor, SqlDialect dialect) {
    this.dataSources = dataSources;
    this.schema = schema;
    this.executor = executor;
    this.dialect = dialect;
  }

  @GetMapping("/tables")
  public Map<String, Object> tables(@RequestParam(required = false) String connectionId) {
    List<TableRef> tables = schema.listTables(dataSources.resolve(connectionId));
    return Map.of("success", true, "tables", tables);
  }

  @GetMapping("/schema/{table}")
  public Map<String, Object> describe(@PathVariable String table,
                                      @RequestParam(required = false) String connectionId) {
    String name = IdentifierSanitizer.sanitize(table);
    if (name.isEmpty()) throw new ChartValidationException("Table name is required");

    DataSource ds = dataSources.resolve(connectionId);
    TableRef ref = schema.resolveTable(ds, name);

    String sql = "SELECT " + dialect.selectPrefix(SAMPLE_ROWS) + "* FROM " + dialect.qualify(ref);
    String limit = dialect.limitClause(SAMPLE_ROWS);
    if (!limit.isEmpty()) sql += " " + limit;

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put("table", ref.name());
    body.put("schema", ref.schema());
    body.put("columns", schema.describeColumns(ds, ref));
    body.put("sampleData", executor.execute(ds, new CompiledQuery(sql, List.of()), SAMPLE_ROWS));
    return body;
  }
}
