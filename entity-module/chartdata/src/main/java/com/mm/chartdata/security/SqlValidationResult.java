package com.mm.chartdata.security;

/**
 * Outcome of custom SQL validation. On success {@code sanitizedQuery} is the caller's
 * query, untouched.
 */
public record SqlValidationResult(boolean valid, String sanitizedQuery, String error, boolean storedProcedure) {

  public static SqlValidationResult ok(String query, boolean storedProcedure) {
    return new SqlValidationResult(true, query, null, storedProcedure);
  }

  public static SqlValidationResult rejected(String error) {
    return new SqlValidationResult(false, null, error, false);
  }
}
