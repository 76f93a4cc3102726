package com.skintip.placement.app.model;

import lombok.Builder;
import lombok.Value;

/**
 * Tight axis-aligned rectangle around the foreground pixels of a mask. Bounds are inclusive pixel
 * coordinates. An empty box (no foreground) has every bound collapsed to the image origin.
 */
@Value
@Builder
public class BoundingBox {
  int minX;
  int minY;
  int maxX;
  int maxY;
  int width;
  int height;
  boolean empty;

  /** Sentinel returned for masks without a single foreground pixel. */
  public static BoundingBox empty() {
    return BoundingBox.builder().empty(true).build();
  }

  public static BoundingBox of(int minX, int minY, int maxX, int maxY) {
    return BoundingBox.builder()
        .minX(minX)
        .minY(minY)
        .maxX(maxX)
        .maxY(maxY)
        .width(maxX - minX + 1)
        .height(maxY - minY + 1)
        .empty(false)
        .build();
  }
}
