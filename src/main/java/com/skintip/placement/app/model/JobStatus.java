package com.skintip.placement.app.model;

import java.util.Locale;

/** Lifecycle states reported by the generation API for a submitted job. */
public enum JobStatus {
  STARTING,
  PROCESSING,
  SUCCEEDED,
  FAILED,
  CANCELED,
  /** Any status string the API sends that is not listed above. Treated as still running. */
  UNKNOWN;

  public static JobStatus fromWire(String status) {
    if (status == null || status.isBlank()) return UNKNOWN;
    switch (status.trim().toLowerCase(Locale.ROOT)) {
      case "starting":
        return STARTING;
      case "processing":
        return PROCESSING;
      case "succeeded":
        return SUCCEEDED;
      case "failed":
        return FAILED;
      case "canceled":
      case "cancelled":
        return CANCELED;
      default:
        return UNKNOWN;
    }
  }

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == CANCELED;
  }
}
