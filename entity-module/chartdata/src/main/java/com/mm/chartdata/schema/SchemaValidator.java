package com.mm.chartdata.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.List;

/**
 * Resolves tables and their columns from {@code INFORMATION_SCHEMA}. Nothing is cached:
 * every chart request sees the live schema.
 */
@Component
public class SchemaValidator {
  private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

  private static final String FIND_TABLE =
      "SELECT TABLE_SCHEMA, TABLE_NAME FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_NAME = :tableName ORDER BY TABLE_SCHEMA";
  private static final String LIST_TABLES =
      "SELECT TABLE_SCHEMA, TABLE_NAME FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_TYPE = 'BASE TABLE' ORDER BY TABLE_SCHEMA, TABLE_NAME";
  private static final String COLUMNS =
      "SELECT COLUMN_NAME, DATA_TYPE, IS_NULLABLE FROM INFORMATION_SCHEMA.COLUMNS"
          + " WHERE TABLE_SCHEMA = :schema AND TABLE_NAME = :tableName ORDER BY ORDINAL_POSITION";

  /**
   * Exact-name lookup. When the name exists in several schemas the first schema in
   * alphabetical order wins.
   *
   * @throws TableNotFoundException when no table has that name
   */
  public TableRef resolveTable(DataSource dataSource, String tableName) {
    if (tableName == null || tableName.isBlank()) throw new TableNotFoundException(String.valueOf(tableName));
    List<TableRef> found;
    try {
      found = new NamedParameterJdbcTemplate(dataSource).query(FIND_TABLE,
          new MapSqlParameterSource("tableName", tableName),
          (rs, i) -> new TableRef(rs.getString("TABLE_SCHEMA"), rs.getString("TABLE_NAME")));
    } catch (DataAccessException e) {
      log.error("Table lookup failed for table={}", tableName, e);
      throw new SchemaLookupException("Schema lookup failed for table '" + tableName + "'", e);
    }
    if (found.isEmpty()) throw new TableNotFoundException(tableName);
    return found.get(0);
  }

  public ColumnSet fetchColumns(DataSource dataSource, TableRef table) {
    return ColumnSet.of(describeColumns(dataSource, table).stream().map(ColumnInfo::name).toList());
  }

  public List<ColumnInfo> describeColumns(DataSource dataSource, TableRef table) {
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("schema", table.schema())
        .addValue("tableName", table.name());
    try {
      return new NamedParameterJdbcTemplate(dataSource).query(COLUMNS, params,
          (rs, i) -> new ColumnInfo(
              rs.getString("COLUMN_NAME"),
              rs.getString("DATA_TYPE"),
              "YES".equalsIgnoreCase(rs.getString("IS_NULLABLE"))));
    } catch (DataAccessException e) {
      log.error("Column lookup failed for table={}.{}", table.schema(), table.name(), e);
      throw new SchemaLookupException("Column lookup failed for table '" + table.name() + "'", e);
    }
  }

  public List<TableRef> listTables(DataSource dataSource) {
    try {
      return new NamedParameterJdbcTemplate(dataSource).query(LIST_TABLES, new MapSqlParameterSource(),
          (rs, i) -> new TableRef(rs.getString("TABLE_SCHEMA"), rs.getString("TABLE_NAME")));
    } catch (DataAccessException e) {
      log.error("Table listing failed", e);
      throw new SchemaLookupException("Could not list tables", e);
    }
  }
}
