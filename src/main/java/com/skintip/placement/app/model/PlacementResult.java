package com.skintip.placement.app.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Finished placement: public URLs of the watermarked images plus the decisions taken. */
@Value
@Builder
public class PlacementResult {
  String jobId;
  EngineId requestedEngine;
  EngineId engine;
  ScaleDecision scaleDecision;
  double effectiveScale;
  List<String> imageUrls;

  public boolean engineSwitched() {
    return requestedEngine != engine;
  }
}
