package io.intellixity.vista.embedded;

import java.util.List;

/** File formats the embedded backend reads, with the extensions tried in directory mode. */
public enum FileFormat {
  CSV(List.of(".csv")),
  EXCEL(List.of(".xlsx", ".xls"));

  private final List<String> extensions;

  FileFormat(List<String> extensions) {
    this.extensions = extensions;
  }

  public List<String> extensions() { return extensions; }
}
