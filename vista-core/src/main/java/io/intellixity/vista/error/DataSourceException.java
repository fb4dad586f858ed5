package io.intellixity.vista.error;

/**
 * Raised when a data source cannot be reached or read: connection failures, authentication
 * problems, missing files, or an unsupported data source type.
 */
public final class DataSourceException extends VistaException {
  public DataSourceException(String message) {
    super(message);
  }

  public DataSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
