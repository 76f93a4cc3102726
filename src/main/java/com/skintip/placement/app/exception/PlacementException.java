package com.skintip.placement.app.exception;

/** Root of the unchecked exceptions raised by the placement engine. */
public class PlacementException extends RuntimeException {

  public PlacementException(String message) {
    super(message);
  }

  public PlacementException(String message, Throwable cause) {
    super(message, cause);
  }
}
