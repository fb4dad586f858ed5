package io.intellixity.vista.embedded;

import io.intellixity.vista.catalog.DataSourceDefinition;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** {@code delimiter}, {@code has_header} and {@code encoding} from a CSV source's connection config. */
public record CsvOptions(char delimiter, boolean hasHeader, Charset charset) {
  public CsvOptions {
    Objects.requireNonNull(charset, "charset");
  }

  public static CsvOptions defaults() {
    return new CsvOptions(',', true, StandardCharsets.UTF_8);
  }

  public static CsvOptions from(DataSourceDefinition ds) {
    String delim = ds.configString("delimiter");
    if (delim != null && delim.length() != 1 && !delim.equals("\\t")) {
      throw new IllegalArgumentException("delimiter must be a single character for data source '" + ds.id() + "'");
    }
    char d = (delim == null) ? ',' : (delim.equals("\\t") ? '\t' : delim.charAt(0));
    String header = ds.configString("has_header");
    String enc = ds.configString("encoding");
    return new CsvOptions(d, header == null || Boolean.parseBoolean(header),
        enc == null ? StandardCharsets.UTF_8 : Charset.forName(enc));
  }
}
