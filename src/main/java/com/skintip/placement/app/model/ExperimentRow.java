package com.skintip.placement.app.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One data row of a hill-climb table, keyed by header name in header order. Cells are kept as
 * raw text so the row can be re-serialized unchanged apart from the feedback columns.
 */
public final class ExperimentRow {

  public static final String IMAGE_ID = "image_id";
  public static final String ENGINE = "engine";
  public static final String PICK_OF_THE_LITTER = "pick_of_the_litter";
  public static final String ITERATION_FEEDBACK = "iteration_feedback";
  public static final String ENGINE_CALL_MODE = "engine_call_mode";
  public static final String ENGINE_ENDPOINT_URL = "engine_endpoint_url";
  public static final String ENGINE_SWITCH_REASON = "engine_switch_reason";

  private final int index;
  private final Map<String, String> cells;

  public ExperimentRow(int index, Map<String, String> cells) {
    this.index = index;
    this.cells = new LinkedHashMap<>(cells);
  }

  /** Zero-based position among the table's data rows. */
  public int getIndex() {
    return index;
  }

  public String get(String column) {
    String v = cells.get(column);
    return v == null ? "" : v;
  }

  public String getImageId() {
    return get(IMAGE_ID).trim();
  }

  public String getEngine() {
    return get(ENGINE).trim();
  }

  public String getEngineCallMode() {
    return get(ENGINE_CALL_MODE).trim();
  }

  public String getEngineEndpointUrl() {
    return get(ENGINE_ENDPOINT_URL).trim();
  }

  public ExperimentRow with(String column, String value) {
    Map<String, String> copy = new LinkedHashMap<>(cells);
    copy.put(column, value);
    return new ExperimentRow(index, copy);
  }

  public Map<String, String> getCells() {
    return Collections.unmodifiableMap(cells);
  }

  @Override
  public String toString() {
    return "ExperimentRow{index=" + index + ", image_id=" + getImageId() + "}";
  }
}
