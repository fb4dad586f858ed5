package io.intellixity.vista.embedded;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Streams a CSV file into a {@link RawTable}. With a positive {@code rowCap} only that many data
 * rows are kept; the rest are still scanned for column types.
 */
final class CsvTableReader {
  private CsvTableReader() {}

  static RawTable read(Path file, CsvOptions options, int rowCap) throws IOException {
    CSVFormat format = CSVFormat.DEFAULT.builder()
        .setDelimiter(options.delimiter())
        .setIgnoreSurroundingSpaces(true)
        .setIgnoreEmptyLines(true)
        .build();

    try (Reader in = Files.newBufferedReader(file, options.charset());
         CSVParser parser = format.parse(in)) {
      List<String> header = null;
      List<List<Object>> cells = new ArrayList<>();
      int width = 0;
      TypeInference.Tracker types = new TypeInference.Tracker();
      for (CSVRecord rec : parser) {
        List<Object> values = new ArrayList<>(rec.size());
        for (String v : rec) values.add(v);
        if (header == null && options.hasHeader()) {
          header = new ArrayList<>();
          for (Object v : values) header.add(stripBom((String) v));
          continue;
        }
        width = Math.max(width, values.size());
        types.accept(values);
        if (rowCap <= 0 || cells.size() < rowCap) cells.add(values);
      }
      if (header == null) header = RawTable.generatedHeader(width);
      return new RawTable(header, cells, types.types(header.size()));
    }
  }

  private static String stripBom(String s) {
    return (s != null && !s.isEmpty() && s.charAt(0) == '\uFEFF') ? s.substring(1) : s;
  }
}
