package com.mm.chartdata.schema;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

final class SchemaValidatorTest {
  private static DataSource ds;
  private final SchemaValidator validator = new SchemaValidator();

  @BeforeAll
  static void setUp() {
    ds = new DriverManagerDataSource("jdbc:h2:mem:schema_validator;MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
    JdbcTemplate jdbc = new JdbcTemplate(ds);
    jdbc.execute("DROP TABLE IF EXISTS \"Orders\"");
    jdbc.execute("CREATE TABLE \"Orders\" (\"Id\" INTEGER NOT NULL, \"Customer\" VARCHAR(40), \"Unit Price\" DECIMAL(10,2))");
  }

  @Test
  void resolvesExactTableName() {
    TableRef ref = validator.resolveTable(ds, "Orders");
    assertEquals("PUBLIC", ref.schema());
    assertEquals("Orders", ref.name());
  }

  @Test
  void unknownTableIsNotFound() {
    TableNotFoundException e = assertThrows(TableNotFoundException.class, () -> validator.resolveTable(ds, "Nope"));
    assertEquals("Table 'Nope' not found", e.getReason());
    assertEquals(404, e.getStatus().value());
    assertThrows(TableNotFoundException.class, () -> validator.resolveTable(ds, " "));
  }

  @Test
  void columnsComeBackSanitizedInOrdinalOrder() {
    ColumnSet columns = validator.fetchColumns(ds, new TableRef("PUBLIC", "Orders"));
    assertEquals(List.of("Id", "Customer", "UnitPrice"), List.copyOf(columns.names()));
    assertTrue(columns.isValidField("Unit Price"));
    assertTrue(columns.isValidField("UnitPrice"));
    assertFalse(columns.isValidField("Discount"));
    assertEquals("Unit Price", columns.sourceName("UnitPrice"));
  }

  @Test
  void describeReportsNullability() {
    List<ColumnInfo> info = validator.describeColumns(ds, new TableRef("PUBLIC", "Orders"));
    assertEquals(3, info.size());
    assertEquals("Id", info.get(0).name());
    assertFalse(info.get(0).nullable());
    assertTrue(info.get(1).nullable());
  }

  @Test
  void listTablesIncludesUserTables() {
    assertTrue(validator.listTables(ds).contains(new TableRef("PUBLIC", "Orders")));
  }

  @Test
  void unreachableDatabaseIsLookupFailure() throws SQLException {
    DataSource broken = mock(DataSource.class);
    when(broken.getConnection()).thenThrow(new SQLException("connection refused"));
    assertThrows(SchemaLookupException.class, () -> validator.resolveTable(broken, "Orders"));
  }
}
