package io.intellixity.vista.data;

import io.intellixity.vista.error.SchemaException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

final class ValuesTest {

  @Test
  void normalizesJdbcAndJsonNumbers() {
    assertEquals(5L, Values.normalize(5));
    assertEquals(7L, Values.normalize(new BigDecimal("7")));
    assertEquals(7.25, Values.normalize(new BigDecimal("7.25")));
    assertEquals(1.5, Values.normalize(1.5f));
    assertEquals(LocalDate.of(2024, 1, 2), Values.normalize(java.sql.Date.valueOf("2024-01-02")));
  }

  @Test
  void comparesAcrossIntegerAndFloat() {
    assertEquals(0, Values.compareNonNull(1000L, 1000.0));
    assertTrue(Values.compareNonNull(1500L, 1000.0) > 0);
    assertTrue(Values.sameValue(3L, 3.0));
    assertFalse(Values.sameValue(null, null));
  }

  @Test
  void comparesDateWithTimestamp() {
    assertTrue(Values.compareNonNull(LocalDate.of(2024, 1, 2), LocalDateTime.of(2024, 1, 1, 23, 0)) > 0);
  }

  @Test
  void incompatibleTypesFailForFiltersButNotForSort() {
    assertThrows(SchemaException.class, () -> Values.compareNonNull("a", 1L));
    assertTrue(Values.compareForSort(1L, "a") < 0);
  }

  @Test
  void coercesLiteralsToColumnType() {
    assertEquals(10L, Values.coerce("10", ColumnType.INTEGER));
    assertEquals(2.5, Values.coerce("2.5", ColumnType.FLOAT));
    assertEquals(LocalDate.of(2024, 3, 1), Values.coerce("2024-03-01", ColumnType.DATE));
    assertEquals(LocalDateTime.of(2024, 3, 1, 0, 0), Values.coerce("2024-03-01", ColumnType.TIMESTAMP));
    assertEquals(Boolean.TRUE, Values.coerce("TRUE", ColumnType.BOOLEAN));
    SchemaException ex = assertThrows(SchemaException.class, () -> Values.coerce("abc", ColumnType.INTEGER));
    assertTrue(ex.getMessage().contains("not a valid integer"));
  }

  @Test
  void groupKeyFoldsWholeDoubles() {
    assertEquals(Values.groupKey(2L), Values.groupKey(2.0));
    assertNotEquals(Values.groupKey(2L), Values.groupKey(2.5));
  }

  @Test
  void parsesDeclaredTypeNames() {
    assertEquals(ColumnType.STRING, ColumnType.parse("VARCHAR(255)"));
    assertEquals(ColumnType.FLOAT, ColumnType.parse("double precision"));
    assertEquals(ColumnType.INTEGER, ColumnType.parse("int64"));
    assertEquals(ColumnType.UNKNOWN, ColumnType.parse("geometry"));
    assertEquals(ColumnType.FLOAT, ColumnType.widen(ColumnType.INTEGER, ColumnType.FLOAT));
    assertEquals(ColumnType.STRING, ColumnType.widen(ColumnType.BOOLEAN, ColumnType.DATE));
  }
}
