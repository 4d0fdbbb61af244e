package com.mm.chartdata.query;

import com.mm.chartdata.model.Resolution;
import com.mm.chartdata.security.SqlIdentifier;

/** PostgreSQL, and H2 running in PostgreSQL mode. */
public class PostgresDialect implements SqlDialect {

  @Override
  public String name() {
    return "postgres";
  }

  @Override
  public String quote(SqlIdentifier identifier) {
    return "\"" + identifier.name() + "\"";
  }

  @Override
  public String dateBucket(String expression, Resolution resolution) {
    return switch (resolution) {
      case YEAR -> "TO_CHAR(CAST(" + expression + " AS DATE), 'YYYY')";
      case MONTH -> "TO_CHAR(CAST(" + expression + " AS DATE), 'YYYY-MM')";
      case DAY -> "CAST(" + expression + " AS DATE)";
    };
  }

  @Override
  public String selectPrefix(int limit) {
    return "";
  }

  @Override
  public String limitClause(int limit) {
    return "LIMIT " + limit;
  }

  @Override
  public boolean allowsCteInSubquery() {
    return true;
  }
}
