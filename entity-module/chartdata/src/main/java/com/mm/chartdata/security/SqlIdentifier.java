package com.mm.chartdata.security;

import java.util.Objects;

/**
 * An identifier that is safe to embed in SQL text. The only way to obtain one is
 * {@link #of(String)}, which runs the raw name through {@link IdentifierSanitizer}.
 */
public final class SqlIdentifier {
  private final String name;

  private SqlIdentifier(String name) {
    this.name = name;
  }

  /**
   * @throws IllegalArgumentException when nothing is left after sanitizing
   */
  public static SqlIdentifier of(String raw) {
    String clean = IdentifierSanitizer.sanitize(raw);
    if (clean.isEmpty()) {
      throw new IllegalArgumentException("Identifier is empty after sanitizing: " + raw);
    }
    return new SqlIdentifier(clean);
  }

  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SqlIdentifier other)) return false;
    return name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
