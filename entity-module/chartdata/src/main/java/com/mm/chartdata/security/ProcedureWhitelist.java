package com.mm.chartdata.security;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Stored procedure names permitted in {@code EXEC} statements of custom queries.
 * Names are compared after {@link #normalize(String)}, so {@code [dbo].[usp_Sales]} and
 * {@code USP_SALES} are the same entry.
 */
public final class ProcedureWhitelist {
  private static final ProcedureWhitelist EMPTY = new ProcedureWhitelist(Set.of());

  private final Set<String> names;

  private ProcedureWhitelist(Set<String> names) {
    this.names = names;
  }

  public static ProcedureWhitelist empty() {
    return EMPTY;
  }

  public static ProcedureWhitelist of(Collection<String> rawNames) {
    if (rawNames == null || rawNames.isEmpty()) return EMPTY;
    Set<String> normalized = new TreeSet<>();
    for (String raw : rawNames) {
      String n = normalize(raw);
      if (!n.isEmpty()) normalized.add(n);
    }
    return new ProcedureWhitelist(Collections.unmodifiableSet(normalized));
  }

  public boolean contains(String procedureName) {
    String n = normalize(procedureName);
    return !n.isEmpty() && names.contains(n);
  }

  public Set<String> names() {
    return names;
  }

  public boolean isEmpty() {
    return names.isEmpty();
  }

  /** Strips brackets and quotes, keeps the last dotted part, upper-cases. */
  public static String normalize(String raw) {
    if (raw == null) return "";
    String s = raw.replace("[", "").replace("]", "").replace("\"", "").trim();
    int dot = s.lastIndexOf('.');
    if (dot >= 0) s = s.substring(dot + 1);
    return IdentifierSanitizer.sanitize(s).toUpperCase(Locale.ROOT);
  }
}
