package com.mm.chartdata.security;

import java.util.regex.Pattern;

/**
 * Reduces user supplied table, column and field names to {@code [A-Za-z0-9_]}.
 * Literal values never go through here; they are bound as parameters.
 */
public final class IdentifierSanitizer {
  private static final Pattern NON_WORD = Pattern.compile("[^A-Za-z0-9_]");

  private IdentifierSanitizer() {}

  public static String sanitize(String raw) {
    if (raw == null) return "";
    return NON_WORD.matcher(raw).replaceAll("");
  }
}
