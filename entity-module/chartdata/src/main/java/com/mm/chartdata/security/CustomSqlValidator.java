package com.mm.chartdata.security;

import com.mm.chartdata.query.ChartValidationException;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pass/fail gate for caller supplied SQL in custom mode. Queries are never rewritten:
 * a passing query comes back exactly as the caller wrote it.
 */
@Component
public class CustomSqlValidator {
  private static final Pattern FORBIDDEN = Pattern.compile(
      "(?i)\\b(INSERT|UPDATE|DELETE|MERGE|CREATE|ALTER|DROP|TRUNCATE|INTO|EXEC|EXECUTE|GRANT|REVOKE|DENY|BULK|BACKUP|RESTORE|SHUTDOWN|KILL|DBCC|CHECKPOINT|OPENROWSET|OPENDATASOURCE|OPENQUERY|WAITFOR)\\b"
  );
  private static final Pattern SYSTEM_PROCEDURE = Pattern.compile("(?i)\\b(SP|XP)_\\w*");
  private static final Pattern SELECT_OR_WITH_START = Pattern.compile("^(?s)\\s*(SELECT|WITH)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern WITH_START = Pattern.compile("^(?s)\\s*WITH\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern EXEC_START = Pattern.compile("^(?s)\\s*(EXEC|EXECUTE)\\s+([\\[\\]\\w.]+)(.*)$", Pattern.CASE_INSENSITIVE);
  private static final Pattern EXEC_WORD = Pattern.compile("(?i)\\b(EXEC|EXECUTE)\\b");
  private static final Pattern UNION_SELECT = Pattern.compile("(?is)\\bUNION\\b.*\\bSELECT\\b");
  private static final Pattern SELECT_WORD = Pattern.compile("(?i)\\bSELECT\\b");
  private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\r\\n]*");
  private static final Pattern BLOCK_COMMENT = Pattern.compile("(?s)/\\*.*?\\*/");

  private static final int MAX_SQL_LENGTH = 20000;
  private static final int MAX_SELECTS = 10;

  /**
   * Validates {@code sql} against the read-only rules. {@code EXEC} is accepted only for
   * procedures in {@code whitelist}.
   */
  public SqlValidationResult validate(String sql, ProcedureWhitelist whitelist) {
    if (sql == null || sql.isBlank()) return SqlValidationResult.rejected("Empty SQL");
    String query = sql.trim();
    if (query.length() > MAX_SQL_LENGTH) return SqlValidationResult.rejected("SQL too long");

    String code = stripComments(query).trim();
    if (code.isEmpty()) return SqlValidationResult.rejected("Empty SQL");

    Matcher exec = EXEC_START.matcher(code);
    if (exec.find()) {
      return validateProcedureCall(sql, query, exec.group(2), exec.group(3), whitelist);
    }

    if (!SELECT_OR_WITH_START.matcher(code).find()) {
      return SqlValidationResult.rejected("Only SELECT/CTE statements are allowed");
    }
    if (hasSecondStatement(code)) {
      return SqlValidationResult.rejected("Multiple statements are not allowed");
    }
    if (FORBIDDEN.matcher(code).find() || SYSTEM_PROCEDURE.matcher(code).find()) {
      return SqlValidationResult.rejected("Statement contains forbidden keywords");
    }
    if (UNION_SELECT.matcher(code).find()) {
      return SqlValidationResult.rejected("UNION queries are not allowed");
    }
    if (count(SELECT_WORD, code) > MAX_SELECTS) {
      return SqlValidationResult.rejected("Too many SELECT clauses (max " + MAX_SELECTS + ")");
    }
    return SqlValidationResult.ok(sql, false);
  }

  /** Same as {@link #validate} but throws a 400 for rejected queries. */
  public SqlValidationResult requireValid(String sql, ProcedureWhitelist whitelist) {
    SqlValidationResult result = validate(sql, whitelist);
    if (!result.valid()) {
      throw new ChartValidationException("Unsafe SQL: " + result.error());
    }
    return result;
  }

  private SqlValidationResult validateProcedureCall(String sql, String query, String procedure, String args, ProcedureWhitelist whitelist) {
    if (query.indexOf(';') >= 0 || query.contains("--") || query.contains("/*")) {
      return SqlValidationResult.rejected("Stored procedure calls may not contain ';' or comments");
    }
    if (count(EXEC_WORD, query) > 1) {
      return SqlValidationResult.rejected("Nested EXEC is not allowed");
    }
    if (whitelist == null || !whitelist.contains(procedure)) {
      return SqlValidationResult.rejected("Stored procedure '" + procedure + "' is not in the allowed list");
    }
    if (FORBIDDEN.matcher(args).find()) {
      return SqlValidationResult.rejected("Statement contains forbidden keywords");
    }
    return SqlValidationResult.ok(sql, true);
  }

  // a single trailing ';' is tolerated
  private static boolean hasSecondStatement(String code) {
    String s = code.endsWith(";") ? code.substring(0, code.length() - 1) : code;
    return s.indexOf(';') >= 0;
  }

  static String stripComments(String sql) {
    String noBlock = BLOCK_COMMENT.matcher(sql).replaceAll(" ");
    return LINE_COMMENT.matcher(noBlock).replaceAll(" ");
  }

  /** True when the query, comments aside, opens with a {@code WITH} clause. */
  public static boolean isCommonTableExpression(String sql) {
    return sql != null && WITH_START.matcher(stripComments(sql)).find();
  }

  private static int count(Pattern p, String s) {
    Matcher m = p.matcher(s);
    int n = 0;
    while (m.find()) n++;
    return n;
  }
}
