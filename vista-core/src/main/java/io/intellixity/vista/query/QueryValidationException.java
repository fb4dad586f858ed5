package io.intellixity.vista.query;

import io.intellixity.vista.error.VistaException;

/**
 * Raised when a semantic query references unknown entity fields or otherwise fails validation.
 * <p>
 * Thrown before any run record exists.
 */
public final class QueryValidationException extends VistaException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
