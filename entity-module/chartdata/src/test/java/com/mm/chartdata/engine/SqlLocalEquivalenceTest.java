package com.mm.chartdata.engine;

import com.mm.chartdata.config.ConnectionsProperties;
import com.mm.chartdata.jdbc.ChartQueryExecutor;
import com.mm.chartdata.jdbc.DataSourceRegistry;
import com.mm.chartdata.model.ChartDataSource;
import com.mm.chartdata.model.ChartResult;
import com.mm.chartdata.query.PostgresDialect;
import com.mm.chartdata.schema.SchemaValidator;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.mm.chartdata.ChartSpecs.filter;
import static com.mm.chartdata.ChartSpecs.filters;
import static com.mm.chartdata.ChartSpecs.row;
import static com.mm.chartdata.ChartSpecs.spec;
import static org.junit.jupiter.api.Assertions.*;

/**
 * The same logical dataset lives in an H2 table and in an imported row list; every spec
 * must give the same rows through the SQL engine and through the local engine.
 */
final class SqlLocalEquivalenceTest {
  private static final Object[][] SALES = {
      // Region, Channel, OrderDate, Amount, Price, Label
      {"North", "Online", "2024-01-05", 100, "10.50", "N-1"},
      {"North", "Retail", "2024-01-20", 50, "20.00", "N-2"},
      {"South", "Online", "2024-02-03", 70, "5.25", "S-1"},
      {"South", "Online", "2024-02-14", 35, "7.75", "S-2"},
      {"East", "Retail", "2024-03-01", 25, "12.00", "E-1"},
      {"East", "Online", "2023-12-30", 15, "3.50", "E-2"},
      {"West", "Retail", "2024-03-15", 10, "1.00", "W-1"},
      {null, "Online", "2024-01-01", 5, "1.00", "X-1"},
  };

  private static SqlChartQueryEngine sqlEngine;
  private static List<Map<String, Object>> imported;
  private final LocalChartQueryEngine localEngine = new LocalChartQueryEngine();

  @BeforeAll
  static void setUp() {
    DriverManagerDataSource ds = new DriverManagerDataSource("jdbc:h2:mem:chart_equivalence;MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
    JdbcTemplate jdbc = new JdbcTemplate(ds);
    jdbc.execute("DROP TABLE IF EXISTS \"Sales\"");
    jdbc.execute("CREATE TABLE \"Sales\" (\"Region\" VARCHAR(20), \"Channel\" VARCHAR(20), \"OrderDate\" DATE,"
        + " \"Amount\" INTEGER, \"Price\" DECIMAL(10,2), \"Label\" VARCHAR(20))");

    imported = new ArrayList<>();
    for (Object[] r : SALES) {
      jdbc.update("INSERT INTO \"Sales\" VALUES (?, ?, CAST(? AS DATE), ?, ?, ?)",
          r[0], r[1], r[2], r[3], new BigDecimal((String) r[4]), r[5]);
      imported.add(row("Region", r[0], "Channel", r[1], "OrderDate", r[2], "Amount", r[3],
          "Price", Double.valueOf((String) r[4]), "Label", r[5]));
    }

    DataSourceRegistry registry = new DataSourceRegistry(ds, new ConnectionsProperties());
    sqlEngine = new SqlChartQueryEngine(registry, new SchemaValidator(), new ChartQueryExecutor(30), new PostgresDialect());
  }

  private void assertEquivalent(ChartDataSource s) {
    List<Map<String, Object>> viaSql = sqlEngine.run(s).getRows();

    s.setQueryMode("import");
    s.setImportedData(imported);
    List<Map<String, Object>> viaLocal = localEngine.run(s).getRows();

    assertEquals(viaSql.size(), viaLocal.size(), () -> "sql=" + viaSql + " local=" + viaLocal);
    for (int i = 0; i < viaSql.size(); i++) {
      Map<String, Object> a = viaSql.get(i);
      Map<String, Object> b = viaLocal.get(i);
      assertEquals(List.copyOf(a.keySet()), List.copyOf(b.keySet()), "column order of row " + i);
      for (String key : a.keySet()) {
        assertTrue(sameValue(a.get(key), b.get(key)),
            () -> "row " + viaSql.indexOf(a) + " column " + key + ": sql=" + a.get(key) + " local=" + b.get(key));
      }
    }
  }

  private static boolean sameValue(Object a, Object b) {
    if (a instanceof Number && b instanceof Number) {
      BigDecimal x = new BigDecimal(a.toString());
      BigDecimal y = new BigDecimal(b.toString());
      return x.subtract(y).abs().compareTo(new BigDecimal("1e-9")) <= 0;
    }
    return Objects.equals(a, b);
  }

  @Test
  void sumByRegionOrderedByTotal() {
    ChartDataSource s = spec("Sales", "Region", "sum", "Amount");
    s.setOrderBy("Amount");
    s.setOrderDirection("desc");
    assertEquivalent(s);
  }

  @Test
  void groupByWithCompositeLabels() {
    ChartDataSource s = spec("Sales", "Region", "sum", "Amount");
    s.setGroupBy(List.of("Channel"));
    s.setOrderBy("Amount");
    s.setOrderDirection("desc");
    assertEquivalent(s);
  }

  @Test
  void monthResolutionCount() {
    ChartDataSource s = spec("Sales", "OrderDate", "count", "Amount");
    s.setResolution("month");
    s.setOrderBy("OrderDate");
    assertEquivalent(s);
  }

  @Test
  void yearAndDayResolution() {
    ChartDataSource year = spec("Sales", "OrderDate", "sum", "Amount");
    year.setResolution("year");
    year.setOrderBy("OrderDate");
    assertEquivalent(year);

    ChartDataSource day = spec("Sales", "OrderDate", "sum", "Amount");
    day.setResolution("day");
    day.setOrderBy("OrderDate");
    day.setOrderDirection("desc");
    assertEquivalent(day);
  }

  @Test
  void averageOfTwoMeasuresWithEqualityFilter() {
    ChartDataSource s = spec("Sales", "Region", "avg", "Amount", "Price");
    s.setFilters(filters(filter("Channel", "=", "Online")));
    s.setOrderBy("Region");
    assertEquivalent(s);
  }

  @Test
  void maxWithDrillDownLabelAndComparisonFilter() {
    ChartDataSource s = spec("Sales", "Region", "max", "Amount");
    s.setDrillDownLabelField("Label");
    s.setFilters(filters(filter("Amount", ">", 20)));
    s.setOrderBy("Region");
    assertEquivalent(s);
  }

  @Test
  void groupByWithoutXAxisKeepsNullXRows() {
    ChartDataSource s = spec("Sales", null, "min", "Amount");
    s.setGroupBy(List.of("Channel"));
    s.setOrderBy("Channel");
    assertEquivalent(s);
  }

  @Test
  void ungroupedTotals() {
    assertEquivalent(spec("Sales", null, "sum", "Amount", "Price"));

    ChartDataSource nothing = spec("Sales", null, "sum", "Amount");
    nothing.setFilters(filters(filter("Region", "=", "Nowhere")));
    assertEquivalent(nothing);
  }

  @Test
  void inAndLikeFilters() {
    ChartDataSource in = spec("Sales", "Channel", "sum", "Amount");
    in.setFilters(filters(filter("Region", "IN", List.of("North", "East"))));
    in.setOrderBy("Channel");
    assertEquivalent(in);

    ChartDataSource like = spec("Sales", "Region", "sum", "Amount");
    like.setFilters(filters(filter("Region", "LIKE", "No%")));
    assertEquivalent(like);
  }

  @Test
  void limitTruncatesAfterOrdering() {
    ChartDataSource s = spec("Sales", "Region", "sum", "Amount");
    s.setOrderBy("Amount");
    s.setOrderDirection("desc");
    s.setLimit(2);
    assertEquivalent(s);
    assertEquals(2, sqlEngine.run(s).getRows().size());
  }

  @Test
  void orderByOutsideTheResultIsDroppedOnBothPaths() {
    ChartDataSource s = spec("Sales", "Region", "sum", "Amount");
    s.setOrderBy("Price");
    ChartResult viaSql = sqlEngine.run(s);

    s.setQueryMode("import");
    s.setImportedData(imported);
    ChartResult viaLocal = localEngine.run(s);

    List<String> expected = List.of("orderBy column 'Price' ignored: not a result column");
    assertEquals(expected, viaSql.getWarnings());
    assertEquals(expected, viaLocal.getWarnings());

    // without an order the database may return groups in any order
    Comparator<Map<String, Object>> byRegion = Comparator.comparing(r -> String.valueOf(r.get("Region")));
    List<Map<String, Object>> a = new ArrayList<>(viaSql.getRows());
    List<Map<String, Object>> b = new ArrayList<>(viaLocal.getRows());
    a.sort(byRegion);
    b.sort(byRegion);
    assertEquals(4, a.size());
    assertEquals(a.size(), b.size());
    for (int i = 0; i < a.size(); i++) {
      assertEquals(a.get(i).get("Region"), b.get(i).get("Region"));
      assertTrue(sameValue(a.get(i).get("Amount"), b.get(i).get("Amount")));
    }
  }

  @Test
  void noMatchingRowsWithXAxis() {
    ChartDataSource s = spec("Sales", "Region", "sum", "Amount");
    s.setFilters(filters(filter("Region", "=", "Nowhere")));
    assertEquivalent(s);
  }
}
