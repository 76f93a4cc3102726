package com.skintip.placement.app.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/** Outcome of the adaptive scale rule table for one design. */
@Value
@AllArgsConstructor(staticName = "of")
public class ScaleDecision {
  boolean thinLine;
  boolean haloSplash;
  double scale;

  public static ScaleDecision neutral() {
    return of(false, false, 1.0);
  }
}
