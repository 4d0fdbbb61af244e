package com.mm.chartdata.query;

import com.mm.chartdata.model.Resolution;
import com.mm.chartdata.security.SqlIdentifier;

public class SqlServerDialect implements SqlDialect {

  @Override
  public String name() {
    return "sqlserver";
  }

  @Override
  public String quote(SqlIdentifier identifier) {
    return "[" + identifier.name() + "]";
  }

  @Override
  public String dateBucket(String expression, Resolution resolution) {
    return switch (resolution) {
      case YEAR -> "FORMAT(TRY_CAST(" + expression + " AS DATE), 'yyyy')";
      case MONTH -> "FORMAT(TRY_CAST(" + expression + " AS DATE), 'yyyy-MM')";
      case DAY -> "TRY_CAST(" + expression + " AS DATE)";
    };
  }

  @Override
  public String selectPrefix(int limit) {
    return "TOP " + limit + " ";
  }

  @Override
  public String limitClause(int limit) {
    return "";
  }

  @Override
  public boolean allowsCteInSubquery() {
    return false;
  }
}
