package com.mm.chartdata.query;

import com.mm.chartdata.model.Resolution;
import com.mm.chartdata.schema.TableRef;
import com.mm.chartdata.security.SqlIdentifier;

/**
 * Engine specific SQL fragments. Everything that reaches SQL text as an identifier goes
 * through {@link #quote(SqlIdentifier)}.
 */
public interface SqlDialect {

  String name();

  String quote(SqlIdentifier identifier);

  /** Truncates a date-valued expression to the bucket of {@code resolution}. */
  String dateBucket(String expression, Resolution resolution);

  /** Text placed right after {@code SELECT}, e.g. {@code TOP 50 }; empty when unused. */
  String selectPrefix(int limit);

  /** Clause appended after ORDER BY, e.g. {@code LIMIT 50}; empty when unused. */
  String limitClause(int limit);

  /** Whether {@code SELECT * FROM (WITH ... SELECT ...) AS t} is valid. */
  boolean allowsCteInSubquery();

  default String qualify(TableRef table) {
    String name = quote(SqlIdentifier.of(table.name()));
    if (table.schema() == null || table.schema().isBlank()) return name;
    return quote(SqlIdentifier.of(table.schema())) + "." + name;
  }
}
