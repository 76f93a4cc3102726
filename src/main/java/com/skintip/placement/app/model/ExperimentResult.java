package com.skintip.placement.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Output of one processed hill-climb row. */
@Value
@Builder
public class ExperimentResult {
  @JsonIgnore ExperimentRow row;
  String imageId;
  String outputUrl;
  EngineId engine;

  /** Coerced row parameters, keyed by column name. */
  Map<String, Object> params;
}
