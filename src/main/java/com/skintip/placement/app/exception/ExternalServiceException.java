package com.skintip.placement.app.exception;

/**
 * A dependency (generation API, background removal, storage, output download) rejected a call or
 * reported a failed job. Carries the dependency's diagnostic payload as received.
 */
public class ExternalServiceException extends PlacementException {

  private final String service;
  private final Integer statusCode;
  private final String diagnostic;

  public ExternalServiceException(
      String service, String message, Integer statusCode, String diagnostic) {
    super(service + ": " + message);
    this.service = service;
    this.statusCode = statusCode;
    this.diagnostic = diagnostic;
  }

  public ExternalServiceException(String service, String message, Throwable cause) {
    super(service + ": " + message, cause);
    this.service = service;
    this.statusCode = null;
    this.diagnostic = cause == null ? null : cause.getMessage();
  }

  public String getService() {
    return service;
  }

  /** HTTP status of the failing response, {@code null} for transport errors and job failures. */
  public Integer getStatusCode() {
    return statusCode;
  }

  public String getDiagnostic() {
    return diagnostic;
  }
}
