package com.mm.chartdata.engine;

import com.mm.chartdata.model.Aggregation;
import com.mm.chartdata.model.Resolution;
import com.mm.chartdata.model.SortDirection;
import com.mm.chartdata.query.ChartPlan;
import com.mm.chartdata.query.PlannedFilter;
import com.mm.chartdata.security.SqlIdentifier;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Value semantics shared by the SQL and in-memory paths: composite labels, aggregation,
 * filter matching, comparison and date bucketing. Both paths call into here so they cannot
 * drift apart.
 */
public final class ChartSemantics {
  public static final String LABEL_SEPARATOR = " - ";

  private static final DateTimeFormatter DATE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
  private static final DateTimeFormatter MONTH_FMT = DateTimeFormatter.ofPattern("yyyy-MM");
  private static final DateTimeFormatter YEAR_FMT = DateTimeFormatter.ofPattern("yyyy");

  private ChartSemantics() {}

  // ---------------- Composite labels ----------------

  /**
   * When the chart groups by extra columns on top of the x axis, the x value of each row
   * becomes {@code x - g1 - g2 ...}. Rows are modified in place.
   */
  public static void applyCompositeLabels(List<Map<String, Object>> rows, ChartPlan plan) {
    if (!plan.hasXAxis() || plan.groupBy().isEmpty()) return;
    String x = plan.xAxis().name();
    for (Map<String, Object> row : rows) {
      List<String> parts = new ArrayList<>();
      parts.add(displayText(row.get(x)));
      for (SqlIdentifier g : plan.groupBy()) parts.add(displayText(row.get(g.name())));
      row.put(x, String.join(LABEL_SEPARATOR, parts));
    }
  }

  static String displayText(Object v) {
    if (v == null) return "";
    if (v instanceof BigDecimal bd) return bd.stripTrailingZeros().toPlainString();
    if (v instanceof Double || v instanceof Float) {
      return BigDecimal.valueOf(((Number) v).doubleValue()).stripTrailingZeros().toPlainString();
    }
    return String.valueOf(v);
  }

  // ---------------- Aggregation ----------------

  /**
   * SQL aggregate semantics over one group's values: nulls are ignored, SUM/AVG/MIN/MAX of
   * nothing is null, COUNT of nothing is 0. SUM and AVG skip values that are not numeric.
   */
  public static Object aggregate(Aggregation aggregation, List<Object> values) {
    return switch (aggregation) {
      case COUNT -> values.stream().filter(v -> v != null).count();
      case SUM -> {
        BigDecimal sum = null;
        for (Object v : values) {
          BigDecimal n = toNumber(v);
          if (n != null) sum = sum == null ? n : sum.add(n);
        }
        yield sum == null ? null : toPlainNumber(sum);
      }
      case AVG -> {
        BigDecimal sum = BigDecimal.ZERO;
        int count = 0;
        for (Object v : values) {
          BigDecimal n = toNumber(v);
          if (n != null) { sum = sum.add(n); count++; }
        }
        yield count == 0 ? null : toPlainNumber(sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64));
      }
      case MIN, MAX -> {
        Object best = null;
        for (Object v : values) {
          if (v == null) continue;
          if (best == null) { best = v; continue; }
          int c = compareCells(v, best);
          if (aggregation == Aggregation.MIN ? c < 0 : c > 0) best = v;
        }
        yield best;
      }
    };
  }

  /** Integral results as Long, everything else as Double. */
  static Number toPlainNumber(BigDecimal n) {
    BigDecimal s = n.stripTrailingZeros();
    if (s.scale() <= 0 && s.abs().compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) <= 0) return s.longValue();
    return s.doubleValue();
  }

  // ---------------- Filtering ----------------

  /** A null cell never matches, mirroring SQL three-valued logic. */
  public static boolean matches(Object cell, PlannedFilter filter) {
    if (cell == null) return false;
    Object value = filter.value();
    return switch (filter.operator()) {
      case EQ -> value != null && compareCells(cell, value) == 0;
      case NE -> value != null && compareCells(cell, value) != 0;
      case GT -> value != null && compareCells(cell, value) > 0;
      case LT -> value != null && compareCells(cell, value) < 0;
      case GE -> value != null && compareCells(cell, value) >= 0;
      case LE -> value != null && compareCells(cell, value) <= 0;
      case LIKE -> value != null && like(String.valueOf(cell), String.valueOf(value));
      case IN -> filter.values().stream().anyMatch(v -> v != null && compareCells(cell, v) == 0);
    };
  }

  /** SQL LIKE with {@code %} and {@code _}, case-insensitive. */
  static boolean like(String text, String pattern) {
    StringBuilder re = new StringBuilder();
    for (char c : pattern.toCharArray()) {
      if (c == '%') re.append(".*");
      else if (c == '_') re.append('.');
      else re.append(Pattern.quote(String.valueOf(c)));
    }
    return Pattern.compile(re.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL).matcher(text).matches();
  }

  // ---------------- Comparison ----------------

  /**
   * Total order over cell values. Each value has one kind (number, date, text, in that order);
   * values of different kinds compare by kind, values of the same kind by value, text
   * case-insensitively. Non-null arguments.
   */
  public static int compareCells(Object a, Object b) {
    if (a == b) return 0;

    BigDecimal na = toNumber(a);
    BigDecimal nb = toNumber(b);
    if (na != null || nb != null) {
      if (na == null) return 1;
      if (nb == null) return -1;
      return na.compareTo(nb);
    }

    LocalDate da = toDate(a);
    LocalDate db = toDate(b);
    if (da != null || db != null) {
      if (da == null) return 1;
      if (db == null) return -1;
      return da.compareTo(db);
    }

    return String.valueOf(a).compareToIgnoreCase(String.valueOf(b));
  }

  /** Sort order of one column: nulls first ascending, last descending. */
  public static int compareForSort(Object a, Object b, SortDirection direction) {
    int c;
    if (a == null && b == null) c = 0;
    else if (a == null) c = -1;
    else if (b == null) c = 1;
    else c = compareCells(a, b);
    return direction == SortDirection.DESC ? -c : c;
  }

  // ---------------- Grouping ----------------

  /** Group key form of a value: numbers compare by value, so 1 and 1.0 share a group. */
  public static Object groupKey(Object v) {
    if (v instanceof Number) {
      BigDecimal bd = toNumber(v);
      return bd == null ? v : bd.stripTrailingZeros();
    }
    return v;
  }

  /** Date bucket of a value, or null when it isn't a date. */
  public static Object bucket(Object value, Resolution resolution) {
    LocalDate d = toDate(value);
    if (d == null) return null;
    return switch (resolution) {
      case YEAR -> d.format(YEAR_FMT);
      case MONTH -> d.format(MONTH_FMT);
      case DAY -> d.format(DATE_FMT);
    };
  }

  // ---------------- Conversions ----------------

  static BigDecimal toNumber(Object o) {
    if (o == null || o instanceof Boolean) return null;
    try {
      if (o instanceof BigDecimal bd) return bd;
      if (o instanceof Integer i) return new BigDecimal(i);
      if (o instanceof Long l) return new BigDecimal(l);
      if (o instanceof Short s) return new BigDecimal(s);
      if (o instanceof BigInteger bi) return new BigDecimal(bi);
      if (o instanceof Double d) return BigDecimal.valueOf(d);
      if (o instanceof Float f) return BigDecimal.valueOf(f.doubleValue());
      if (o instanceof Number n) return new BigDecimal(n.toString());
      if (!(o instanceof String)) return null;
      String s = ((String) o).trim();
      if (s.isEmpty()) return null;
      return new BigDecimal(s);
    } catch (NumberFormatException e) {
      return null; // NaN, infinity or non-numeric text
    }
  }

  static LocalDate toDate(Object o) {
    if (o == null) return null;
    if (o instanceof LocalDate d) return d;
    if (o instanceof LocalDateTime dt) return dt.toLocalDate();
    if (o instanceof java.sql.Date d) return d.toLocalDate();
    if (o instanceof Date d) return d.toInstant().atZone(ZoneId.systemDefault()).toLocalDate();
    if (!(o instanceof String)) return null;
    String s = ((String) o).trim();
    if (s.length() < 10) return null;
    try {
      return LocalDate.parse(s.substring(0, 10), DATE_FMT);
    } catch (java.time.format.DateTimeParseException e) {
      return null;
    }
  }
}
