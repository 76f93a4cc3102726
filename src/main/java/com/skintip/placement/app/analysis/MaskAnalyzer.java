package com.skintip.placement.app.analysis;

import com.skintip.placement.app.model.BoundingBox;
import com.skintip.placement.app.model.ShapeStats;
import java.awt.image.BufferedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounding-box and shape statistics over single-channel mask buffers.
 *
 * <p>Buffers are row-major, one unsigned byte per pixel ({@code pixels[y * width + x]}). Every
 * method is a pure function of its arguments.
 */
public final class MaskAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(MaskAnalyzer.class);

  /** Alpha level above which a design pixel counts as ink when computing shape statistics. */
  public static final int DEFAULT_ALPHA_THRESHOLD = 128;

  private MaskAnalyzer() {}

  /* =========================
   * Bounding box
   * ========================= */

  public static BoundingBox boundingBox(byte[] pixels, int width, int height) {
    return boundingBox(pixels, width, height, 0);
  }

  /**
   * Minimal rectangle covering every pixel with a value {@code > 0}, grown by {@code padding} on
   * each side and clamped to the image.
   *
   * @return {@link BoundingBox#empty()} when the mask has no foreground; never throws for that
   */
  public static BoundingBox boundingBox(byte[] pixels, int width, int height, int padding) {
    checkBuffer(pixels, width, height);

    int minX = width, minY = height, maxX = -1, maxY = -1;
    for (int y = 0; y < height; y++) {
      int row = y * width;
      for (int x = 0; x < width; x++) {
        if ((pixels[row + x] & 0xFF) > 0) {
          if (x < minX) minX = x;
          if (x > maxX) maxX = x;
          if (y < minY) minY = y;
          if (y > maxY) maxY = y;
        }
      }
    }

    if (maxX < 0) {
      log.warn("mask.bbox empty width={} height={}", width, height);
      return BoundingBox.empty();
    }

    int pad = Math.max(0, padding);
    return BoundingBox.of(
        ScalePolicy.clamp(minX - pad, 0, width - 1),
        ScalePolicy.clamp(minY - pad, 0, height - 1),
        ScalePolicy.clamp(maxX + pad, 0, width - 1),
        ScalePolicy.clamp(maxY + pad, 0, height - 1));
  }

  /* =========================
   * Shape statistics
   * ========================= */

  /**
   * Coverage, thinness and solidity of the pixels whose value exceeds {@code threshold}.
   *
   * <p>An all-background mask yields {@link ShapeStats#empty()}.
   */
  public static ShapeStats shapeStats(byte[] pixels, int width, int height, int threshold) {
    checkBuffer(pixels, width, height);

    long area = 0;
    long edge = 0;
    int minX = width, minY = height, maxX = -1, maxY = -1;

    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        if (!isInk(pixels, width, height, x, y, threshold)) continue;
        area++;
        if (x < minX) minX = x;
        if (x > maxX) maxX = x;
        if (y < minY) minY = y;
        if (y > maxY) maxY = y;
        // the image border counts as background
        if (!isInk(pixels, width, height, x - 1, y, threshold)
            || !isInk(pixels, width, height, x + 1, y, threshold)
            || !isInk(pixels, width, height, x, y - 1, threshold)
            || !isInk(pixels, width, height, x, y + 1, threshold)) {
          edge++;
        }
      }
    }

    if (area == 0) {
      log.debug("mask.stats empty width={} height={} threshold={}", width, height, threshold);
      return ShapeStats.empty();
    }

    long boxArea = (long) (maxX - minX + 1) * (maxY - minY + 1);
    double coverage = (double) area / ((long) width * height);
    double thinness = (double) edge / area;
    double solidity = (double) area / boxArea;

    return ShapeStats.of(
        ScalePolicy.clamp(coverage, 0.0, 1.0),
        ScalePolicy.clamp(thinness, 0.0, 1.0),
        ScalePolicy.clamp(solidity, 0.0, 1.0));
  }

  /* =========================
   * Channel extraction
   * ========================= */

  /** Alpha channel of {@code image}; fully opaque images yield an all-255 buffer. */
  public static byte[] alphaChannel(BufferedImage image) {
    int w = image.getWidth();
    int h = image.getHeight();
    byte[] out = new byte[w * h];
    boolean hasAlpha = image.getColorModel().hasAlpha();
    for (int y = 0; y < h; y++) {
      for (int x = 0; x < w; x++) {
        int a = hasAlpha ? (image.getRGB(x, y) >>> 24) : 0xFF;
        out[y * w + x] = (byte) a;
      }
    }
    return out;
  }

  /** Luma (Rec. 601) of {@code image}, with transparent pixels counted as black. */
  public static byte[] grayChannel(BufferedImage image) {
    int w = image.getWidth();
    int h = image.getHeight();
    byte[] out = new byte[w * h];
    boolean hasAlpha = image.getColorModel().hasAlpha();
    for (int y = 0; y < h; y++) {
      for (int x = 0; x < w; x++) {
        int argb = image.getRGB(x, y);
        int a = hasAlpha ? (argb >>> 24) : 0xFF;
        int r = (argb >> 16) & 0xFF;
        int g = (argb >> 8) & 0xFF;
        int b = argb & 0xFF;
        int luma = (int) Math.round((0.299 * r + 0.587 * g + 0.114 * b) * a / 255.0);
        out[y * w + x] = (byte) ScalePolicy.clamp(luma, 0, 255);
      }
    }
    return out;
  }

  /* =========================
   * Helpers
   * ========================= */

  private static boolean isInk(byte[] px, int w, int h, int x, int y, int threshold) {
    if (x < 0 || y < 0 || x >= w || y >= h) return false;
    return (px[y * w + x] & 0xFF) > threshold;
  }

  private static void checkBuffer(byte[] pixels, int width, int height) {
    if (pixels == null) throw new IllegalArgumentException("pixels must not be null");
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("width and height must be positive");
    }
    if (pixels.length < (long) width * height) {
      throw new IllegalArgumentException(
          "buffer too small: " + pixels.length + " < " + width + "x" + height);
    }
  }
}
