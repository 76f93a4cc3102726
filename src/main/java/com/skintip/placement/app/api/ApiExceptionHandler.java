package com.skintip.placement.app.api;

import com.skintip.placement.app.exception.ExperimentValidationException;
import com.skintip.placement.app.exception.ExternalServiceException;
import com.skintip.placement.app.exception.GenerationExhaustedException;
import com.skintip.placement.app.exception.PlacementValidationException;
import jakarta.validation.ConstraintViolationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps the placement exception taxonomy onto HTTP statuses and a uniform error body. */
@Log4j2
@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(ExperimentValidationException.class)
  public ResponseEntity<Map<String, Object>> handleExperiment(ExperimentValidationException ex) {
    log.warn("api.error.table msg={}", ex.getMessage());
    Map<String, Object> body = body("Hill-climb table rejected.", ex.getMessage());
    if (!ex.getColumns().isEmpty()) body.put("columns", ex.getColumns());
    if (ex.getImageId() != null) body.put("imageId", ex.getImageId());
    return ResponseEntity.badRequest().body(body);
  }

  @ExceptionHandler(PlacementValidationException.class)
  public ResponseEntity<Map<String, Object>> handleValidation(PlacementValidationException ex) {
    log.warn("api.error.validation msg={}", ex.getMessage());
    return ResponseEntity.badRequest().body(body("Invalid request.", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
    String fields =
        ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("api.error.validation fields={}", fields);
    return ResponseEntity.badRequest().body(body("Missing or invalid request fields.", fields));
  }

  @ExceptionHandler({ConstraintViolationException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
    log.warn("api.error.validation msg={}", ex.getMessage());
    return ResponseEntity.badRequest().body(body("Invalid request.", ex.getMessage()));
  }

  @ExceptionHandler(ExternalServiceException.class)
  public ResponseEntity<Map<String, Object>> handleExternal(ExternalServiceException ex) {
    log.error(
        "api.error.external service={} status={} msg={}",
        ex.getService(),
        ex.getStatusCode(),
        ex.getMessage());
    Map<String, Object> body = body("Failed to generate final tattoo.", ex.getMessage());
    body.put("service", ex.getService());
    if (ex.getDiagnostic() != null) body.put("diagnostic", ex.getDiagnostic());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
  }

  @ExceptionHandler(GenerationExhaustedException.class)
  public ResponseEntity<Map<String, Object>> handleExhausted(GenerationExhaustedException ex) {
    log.error("api.error.exhausted jobId={} attempts={}", ex.getJobId(), ex.getAttempts());
    Map<String, Object> body = body("Failed to generate final tattoo.", ex.getMessage());
    body.put("jobId", ex.getJobId());
    return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(body);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
    log.error("api.error.unexpected msg={}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(body("Unexpected server error.", ex.getMessage()));
  }

  private static Map<String, Object> body(String message, String error) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", false);
    body.put("message", message);
    body.put("error", error);
    return body;
  }
}
