package com.skintip.placement.app.exception;

import java.util.List;

/** A hill-climb table failed validation: missing columns, wrong row count or a bad cell. */
public class ExperimentValidationException extends PlacementValidationException {

  private final List<String> columns;
  private final String imageId;

  public ExperimentValidationException(String message) {
    this(message, List.of(), null);
  }

  public ExperimentValidationException(String message, List<String> columns, String imageId) {
    super(message);
    this.columns = columns == null ? List.of() : List.copyOf(columns);
    this.imageId = imageId;
  }

  /** Columns the failure refers to (missing or non-numeric), empty when not column-specific. */
  public List<String> getColumns() {
    return columns;
  }

  /** {@code image_id} of the offending row, or {@code null} for table-level failures. */
  public String getImageId() {
    return imageId;
  }
}
