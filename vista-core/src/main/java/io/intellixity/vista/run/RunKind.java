package io.intellixity.vista.run;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunKind {
  PIPELINE,
  QUERY;

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
