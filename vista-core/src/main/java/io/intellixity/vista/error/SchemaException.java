package io.intellixity.vista.error;

/** A referenced column is missing or has a type the operation cannot handle. */
public final class SchemaException extends VistaException {
  public SchemaException(String message) {
    super(message);
  }

  public SchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
