package io.intellixity.vista.server.web;

import io.intellixity.vista.engine.validate.PipelineValidationException;
import io.intellixity.vista.error.NotFoundException;
import io.intellixity.vista.query.QueryValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps engine exceptions to HTTP. Execution failures never reach here: they are reported in the
 * run payload with {@code status=failed}.
 */
@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  public record ErrorResponse(String error, List<String> errors, List<String> warnings) {
    static ErrorResponse of(String error) {
      return new ErrorResponse(error, List.of(error), List.of());
    }
  }

  @ExceptionHandler(PipelineValidationException.class)
  public ResponseEntity<ErrorResponse> invalidPipeline(PipelineValidationException e) {
    log.debug("vista.api invalid_pipeline pipelineId={} errors={}", e.pipelineId(), e.result().errors().size());
    return ResponseEntity.badRequest()
        .body(new ErrorResponse(e.getMessage(), e.result().errors(), e.result().warnings()));
  }

  @ExceptionHandler(QueryValidationException.class)
  public ResponseEntity<ErrorResponse> invalidQuery(QueryValidationException e) {
    return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ErrorResponse> conflict(IllegalStateException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of(e.getMessage()));
  }
}
