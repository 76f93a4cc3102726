package com.skintip.placement.app.exception;

/**
 * Raised when caller-supplied input cannot be used (undecodable image, empty mask, unknown
 * parameter group). Always raised before any external call is made.
 */
public class PlacementValidationException extends PlacementException {

  public PlacementValidationException(String message) {
    super(message);
  }

  public PlacementValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
