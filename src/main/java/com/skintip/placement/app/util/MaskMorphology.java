package com.skintip.placement.app.util;

import com.skintip.placement.app.analysis.ScalePolicy;

/** Binary morphology on row-major gray mask buffers. */
public final class MaskMorphology {

  public static final int MIN_RADIUS = 1;
  public static final int MAX_RADIUS = 64;

  private MaskMorphology() {}

  /**
   * Grows the foreground ({@code > 0}) by a square kernel of side {@code 2r+1}; the radius is
   * clamped to {@code [1, 64]}. Output pixels are 0 or 255.
   */
  public static byte[] dilate(byte[] gray, int width, int height, int radius) {
    int r = ScalePolicy.clamp(radius, MIN_RADIUS, MAX_RADIUS);

    // separable: horizontal max, then vertical max
    byte[] horizontal = new byte[width * height];
    for (int y = 0; y < height; y++) {
      int row = y * width;
      int lastInk = Integer.MIN_VALUE / 2;
      for (int x = 0; x < width + r; x++) {
        if (x < width && (gray[row + x] & 0xFF) > 0) lastInk = x;
        int target = x - r;
        if (target >= 0 && target < width && x - lastInk <= 2 * r) {
          horizontal[row + target] = (byte) 0xFF;
        }
      }
    }

    byte[] out = new byte[width * height];
    for (int x = 0; x < width; x++) {
      int lastInk = Integer.MIN_VALUE / 2;
      for (int y = 0; y < height + r; y++) {
        if (y < height && horizontal[y * width + x] != 0) lastInk = y;
        int target = y - r;
        if (target >= 0 && target < height && y - lastInk <= 2 * r) {
          out[target * width + x] = (byte) 0xFF;
        }
      }
    }
    return out;
  }
}
