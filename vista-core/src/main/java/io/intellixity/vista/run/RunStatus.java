package io.intellixity.vista.run;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Run lifecycle: {@code queued -> running -> success | failed | partial}. {@code partial} is only
 * reachable from {@code success}, when delivery of an otherwise successful result fails.
 */
public enum RunStatus {
  QUEUED,
  RUNNING,
  SUCCESS,
  FAILED,
  PARTIAL;

  public boolean terminal() {
    return this == SUCCESS || this == FAILED || this == PARTIAL;
  }

  @JsonValue
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
