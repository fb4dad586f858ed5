package io.intellixity.vista.error;

public final class ExecutionTimeoutException extends VistaException {
  public static final String MARKER = "[timeout]";

  public ExecutionTimeoutException(String message) {
    super(message.startsWith(MARKER) ? message : MARKER + " " + message);
  }
}
