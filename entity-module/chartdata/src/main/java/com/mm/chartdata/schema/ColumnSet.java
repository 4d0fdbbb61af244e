package com.mm.chartdata.schema;

import com.mm.chartdata.security.IdentifierSanitizer;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Real column names of a resolved table (or of an imported dataset), held in sanitized form
 * so that membership checks compare sanitized names with sanitized names.
 */
public final class ColumnSet {
  // sanitized name -> name as the source spells it
  private final Map<String, String> columns;

  private ColumnSet(Map<String, String> columns) {
    this.columns = Collections.unmodifiableMap(columns);
  }

  public static ColumnSet of(Collection<String> rawNames) {
    Map<String, String> m = new LinkedHashMap<>();
    if (rawNames != null) {
      for (String raw : rawNames) {
        String clean = IdentifierSanitizer.sanitize(raw);
        if (!clean.isEmpty()) m.putIfAbsent(clean, raw);
      }
    }
    return new ColumnSet(m);
  }

  /** Union of the keys of every row, in first-seen order. */
  public static ColumnSet fromRows(List<Map<String, Object>> rows) {
    Map<String, String> m = new LinkedHashMap<>();
    if (rows != null) {
      for (Map<String, Object> row : rows) {
        if (row == null) continue;
        for (String raw : row.keySet()) {
          String clean = IdentifierSanitizer.sanitize(raw);
          if (!clean.isEmpty()) m.putIfAbsent(clean, raw);
        }
      }
    }
    return new ColumnSet(m);
  }

  public boolean isValidField(String field) {
    String clean = IdentifierSanitizer.sanitize(field);
    return !clean.isEmpty() && columns.containsKey(clean);
  }

  /** The source spelling of a sanitized column name, or the name itself when unknown. */
  public String sourceName(String sanitized) {
    return columns.getOrDefault(sanitized, sanitized);
  }

  public Set<String> names() {
    return columns.keySet();
  }

  public boolean isEmpty() {
    return columns.isEmpty();
  }

  public int size() {
    return columns.size();
  }
}
