package io.intellixity.vista.error;

/** Base type for all engine errors. Everything the engine raises is unchecked. */
public class VistaException extends RuntimeException {
  public VistaException(String message) {
    super(message);
  }

  public VistaException(String message, Throwable cause) {
    super(message, cause);
  }
}
