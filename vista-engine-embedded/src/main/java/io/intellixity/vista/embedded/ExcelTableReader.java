package io.intellixity.vista.embedded;

import io.intellixity.vista.error.DataSourceException;
import org.apache.poi.ss.usermodel.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one sheet of a workbook into a {@link RawTable}. The first row is the header. Numeric
 * cells formatted as dates become {@link LocalDateTime}; formula cells use their cached result.
 */
final class ExcelTableReader {
  private ExcelTableReader() {}

  /**
   * {@code sheetName == null} reads the first sheet; so does a sheet name the workbook lacks when
   * {@code firstIfMissing} is set.
   */
  static RawTable read(Path file, String sheetName, boolean firstIfMissing, int rowCap) throws IOException {
    try (InputStream in = Files.newInputStream(file);
         Workbook wb = WorkbookFactory.create(in)) {
      if (wb.getNumberOfSheets() == 0) throw new DataSourceException("Workbook " + file.getFileName() + " has no sheets");
      Sheet sheet = (sheetName == null) ? wb.getSheetAt(0) : wb.getSheet(sheetName);
      if (sheet == null && firstIfMissing) sheet = wb.getSheetAt(0);
      if (sheet == null) {
        throw new DataSourceException("Sheet '" + sheetName + "' not found in " + file.getFileName()
            + "; available: " + sheetNames(wb));
      }

      List<String> header = new ArrayList<>();
      List<List<Object>> cells = new ArrayList<>();
      boolean first = true;
      TypeInference.Tracker types = new TypeInference.Tracker();
      for (Row row : sheet) {
        if (first) {
          for (int c = 0; c < row.getLastCellNum(); c++) {
            Object v = value(row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
            header.add(v == null ? null : String.valueOf(v));
          }
          first = false;
          continue;
        }
        List<Object> values = new ArrayList<>(header.size());
        boolean any = false;
        for (int c = 0; c < header.size(); c++) {
          Object v = value(row.getCell(c, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL));
          any |= v != null;
          values.add(v);
        }
        if (!any) continue;
        types.accept(values);
        if (rowCap <= 0 || cells.size() < rowCap) cells.add(values);
      }
      return new RawTable(header, cells, types.types(header.size()));
    }
  }

  static List<String> sheetNames(Workbook wb) {
    List<String> out = new ArrayList<>(wb.getNumberOfSheets());
    for (int i = 0; i < wb.getNumberOfSheets(); i++) out.add(wb.getSheetName(i));
    return out;
  }

  private static Object value(Cell cell) {
    if (cell == null) return null;
    CellType t = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
    return switch (t) {
      case NUMERIC -> DateUtil.isCellDateFormatted(cell) ? cell.getLocalDateTimeCellValue() : (Object) cell.getNumericCellValue();
      case STRING -> cell.getStringCellValue();
      case BOOLEAN -> cell.getBooleanCellValue();
      default -> null;
    };
  }
}
