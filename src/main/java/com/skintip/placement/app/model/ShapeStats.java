package com.skintip.placement.app.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Shape descriptors of a mask's foreground, each in {@code [0,1]}.
 *
 * <ul>
 *   <li>{@code coverage} - foreground area relative to the image area.
 *   <li>{@code thinness} - share of foreground pixels on a stroke edge; higher means thinner
 *       strokes.
 *   <li>{@code solidity} - foreground area relative to its bounding box; higher means blockier.
 * </ul>
 */
@Value
@AllArgsConstructor(staticName = "of")
public class ShapeStats {
  double coverage;
  double thinness;
  double solidity;

  public static ShapeStats empty() {
    return of(0.0, 0.0, 0.0);
  }
}
