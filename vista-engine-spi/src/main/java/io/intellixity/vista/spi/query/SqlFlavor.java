package io.intellixity.vista.spi.query;

/**
 * The parts of a compiled semantic query that differ between SQL engines.\n
 *
 * The defaults render standard SQL as PostgreSQL and H2 accept it.
 */
public interface SqlFlavor {
  SqlFlavor ANSI = new SqlFlavor() {};

  /** One ORDER BY item; nulls sort last in either direction. */
  default String orderItem(String expr, boolean ascending) {
    return expr + (ascending ? " ASC" : " DESC") + " NULLS LAST";
  }

  /** Escape character of LIKE patterns, rendered as {@code ESCAPE '<c>'}. */
  default char likeEscape() {
    return '\\';
  }

  default boolean supportsMedian() {
    return true;
  }
}
