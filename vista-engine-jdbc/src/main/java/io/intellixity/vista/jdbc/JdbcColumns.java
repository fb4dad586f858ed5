package io.intellixity.vista.jdbc;

import io.intellixity.vista.data.Column;
import io.intellixity.vista.data.ColumnType;
import io.intellixity.vista.data.Values;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.*;

/** Result-set to dataset conversion. */
final class JdbcColumns {
  private JdbcColumns() {}

  static ColumnType typeOf(int sqlType, int scale) {
    return switch (sqlType) {
      case Types.CHAR, Types.VARCHAR, Types.LONGVARCHAR, Types.NCHAR, Types.NVARCHAR, Types.LONGNVARCHAR,
          Types.CLOB, Types.NCLOB -> ColumnType.STRING;
      case Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT -> ColumnType.INTEGER;
      case Types.DECIMAL, Types.NUMERIC -> scale == 0 ? ColumnType.INTEGER : ColumnType.FLOAT;
      case Types.REAL, Types.FLOAT, Types.DOUBLE -> ColumnType.FLOAT;
      case Types.BOOLEAN, Types.BIT -> ColumnType.BOOLEAN;
      case Types.DATE -> ColumnType.DATE;
      case Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> ColumnType.TIMESTAMP;
      default -> ColumnType.UNKNOWN;
    };
  }

  /**
   * Reads all rows. Result labels are renamed to {@code names} by position when given (labels
   * may come back in a different case than requested); otherwise labels are used as-is.
   * {@code declared} types win over driver metadata unless they are UNKNOWN.
   */
  static ReadResult read(ResultSet rs, List<String> names, List<ColumnType> declared) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    if (names != null && names.size() != n) {
      throw new SQLException("Expected " + names.size() + " result columns but got " + n, "42000");
    }

    List<Column> columns = new ArrayList<>(n);
    for (int i = 1; i <= n; i++) {
      String name = (names != null) ? names.get(i - 1) : md.getColumnLabel(i);
      ColumnType t = (declared != null && declared.get(i - 1) != ColumnType.UNKNOWN)
          ? declared.get(i - 1)
          : typeOf(md.getColumnType(i), md.getScale(i));
      columns.add(new Column(name, t));
    }

    List<Map<String, Object>> rows = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(n * 2);
      for (int i = 1; i <= n; i++) {
        row.put(columns.get(i - 1).name(), Values.normalize(rs.getObject(i)));
      }
      rows.add(row);
    }
    return new ReadResult(columns, rows);
  }

  /** Maps requested names onto labels case-insensitively, keeping the requested spelling. */
  static List<String> matchRequested(List<String> requested, ResultSetMetaData md) throws SQLException {
    if (requested.isEmpty()) return null;
    List<String> out = new ArrayList<>(md.getColumnCount());
    for (int i = 1; i <= md.getColumnCount(); i++) {
      String label = md.getColumnLabel(i);
      String match = label;
      for (String r : requested) {
        if (r.equalsIgnoreCase(label)) { match = r; break; }
      }
      out.add(match);
    }
    return out;
  }

  record ReadResult(List<Column> columns, List<Map<String, Object>> rows) {}
}
