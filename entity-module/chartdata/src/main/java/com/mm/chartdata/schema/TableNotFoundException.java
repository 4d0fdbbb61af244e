package com.mm.chartdata.schema;

public class TableNotFoundException extends SchemaLookupException {

  public TableNotFoundException(String table) {
    super("Table '" + table + "' not found");
  }
}
