package com.mm.chartdata.engine;

import com.mm.chartdata.jdbc.ChartQueryExecutor;
import com.mm.chartdata.jdbc.ConnectionNotFoundException;
import com.mm.chartdata.jdbc.DataSourceRegistry;
import com.mm.chartdata.model.ChartDataSource;
import com.mm.chartdata.model.ChartResult;
import com.mm.chartdata.query.ChartValidationException;
import com.mm.chartdata.query.CompiledQuery;
import com.mm.chartdata.query.SqlServerDialect;
import com.mm.chartdata.schema.ColumnSet;
import com.mm.chartdata.schema.SchemaValidator;
import com.mm.chartdata.schema.TableNotFoundException;
import com.mm.chartdata.schema.TableRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import javax.sql.DataSource;
import java.util.List;
import java.util.Map;

import static com.mm.chartdata.ChartSpecs.row;
import static com.mm.chartdata.ChartSpecs.spec;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

final class SqlChartQueryEngineTest {
  private final DataSource ds = mock(DataSource.class);
  private final DataSourceRegistry registry = mock(DataSourceRegistry.class);
  private final SchemaValidator schema = mock(SchemaValidator.class);
  private final ChartQueryExecutor executor = mock(ChartQueryExecutor.class);
  private final TableRef sales = new TableRef("dbo", "Sales");

  private SqlChartQueryEngine engine;

  @BeforeEach
  void setUp() {
    engine = new SqlChartQueryEngine(registry, schema, executor, new SqlServerDialect());
    when(registry.resolve(any())).thenReturn(ds);
    when(schema.resolveTable(ds, "Sales")).thenReturn(sales);
    when(schema.fetchColumns(ds, sales)).thenReturn(ColumnSet.of(List.of("Region", "Channel", "Amount")));
  }

  @Test
  void missingTableStopsBeforeColumnsAndExecution() {
    when(schema.resolveTable(ds, "Ghost")).thenThrow(new TableNotFoundException("Ghost"));

    TableNotFoundException e = assertThrows(TableNotFoundException.class,
        () -> engine.run(spec("Ghost", "Region", "sum", "Amount")));
    assertEquals("Table 'Ghost' not found", e.getReason());
    verify(schema, never()).fetchColumns(any(), any());
    verifyNoInteractions(executor);
  }

  @Test
  void blankTableIsRejected() {
    ChartValidationException e = assertThrows(ChartValidationException.class,
        () -> engine.run(spec("--;", "Region", "sum", "Amount")));
    assertEquals("Table name is required", e.getReason());
    verifyNoInteractions(registry, executor);
  }

  @Test
  void noValidMeasureNeverReachesTheDatabase() {
    ChartValidationException e = assertThrows(ChartValidationException.class,
        () -> engine.run(spec("Sales", "Region", "sum", "Revenue")));
    assertEquals("No valid Y-axis columns found (rejected: Revenue)", e.getReason());
    verifyNoInteractions(executor);
  }

  @Test
  void unknownConnectionPropagates() {
    when(registry.resolve("warehouse")).thenThrow(new ConnectionNotFoundException("warehouse"));
    ChartDataSource s = spec("Sales", "Region", "sum", "Amount");
    s.setConnectionId("warehouse");

    assertThrows(ConnectionNotFoundException.class, () -> engine.run(s));
    verifyNoInteractions(schema, executor);
  }

  @Test
  void compilesExecutesAndLabels() {
    when(executor.execute(eq(ds), any(CompiledQuery.class), anyInt())).thenReturn(List.of(
        row("Region", "North", "Channel", "Online", "Amount", 100),
        row("Region", "South", "Channel", "Online", "Amount", 70)));
    ChartDataSource s = spec("Sales", "Region", "sum", "Amount");
    s.setGroupBy(List.of("Channel", "Ghost"));
    s.setLimit(10);

    ChartResult result = engine.run(s);

    ArgumentCaptor<CompiledQuery> query = ArgumentCaptor.forClass(CompiledQuery.class);
    verify(executor).execute(eq(ds), query.capture(), eq(10));
    assertTrue(query.getValue().sql().startsWith("SELECT TOP 10"), query.getValue().sql());
    assertTrue(query.getValue().sql().contains("FROM [dbo].[Sales]"), query.getValue().sql());
    assertFalse(query.getValue().sql().contains("Ghost"));

    List<Map<String, Object>> rows = result.getRows();
    assertEquals("North - Online", rows.get(0).get("Region"));
    assertEquals("South - Online", rows.get(1).get("Region"));
    assertEquals(List.of("groupBy column 'Ghost' ignored: not found"), result.getWarnings());
  }
}
