package com.skintip.placement.app.util;

import com.skintip.placement.app.analysis.ScalePolicy;
import com.skintip.placement.app.model.RenderSettings;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Bakes a positioned tattoo layer into a skin photo so the generation model gets a guide image
 * that already looks inked rather than pasted.
 *
 * <p>The tattoo layer is desaturated, brightness- and gamma-adjusted, then blended three times
 * onto the skin: overlay, soft-light and multiply, each at its own opacity and weighted by the
 * layer's alpha.
 */
public final class GuideCompositor {

  /** Saturation kept from the design's colours. */
  static final double TATTOO_SATURATION = 0.15;

  private GuideCompositor() {}

  /** Transparent canvas of the skin's size with {@code tattoo} drawn at {@code (left, top)}. */
  public static BufferedImage positionOnCanvas(
      BufferedImage tattoo, int canvasWidth, int canvasHeight, int left, int top) {
    BufferedImage canvas =
        new BufferedImage(canvasWidth, canvasHeight, BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = canvas.createGraphics();
    try {
      g.drawImage(tattoo, left, top, null);
    } finally {
      g.dispose();
    }
    return canvas;
  }

  public static BufferedImage bake(
      BufferedImage skin, BufferedImage positionedTattoo, RenderSettings settings) {
    int w = skin.getWidth();
    int h = skin.getHeight();
    double brightness = Math.max(0.0, settings.getBakeBrightness());
    double invGamma = 1.0 / ScalePolicy.clamp(settings.getBakeGamma(), 0.1, 10.0);
    double overlay = ScalePolicy.clamp(settings.getOverlayOpacity(), 0.0, 1.0);
    double softlight = ScalePolicy.clamp(settings.getSoftlightOpacity(), 0.0, 1.0);
    double multiply = ScalePolicy.clamp(settings.getMultiplyOpacity(), 0.0, 1.0);

    BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
    double[] base = new double[3];
    double[] top = new double[3];

    for (int y = 0; y < h; y++) {
      for (int x = 0; x < w; x++) {
        int skinPx = skin.getRGB(x, y);
        unpack(skinPx, base);

        int tattooPx =
            x < positionedTattoo.getWidth() && y < positionedTattoo.getHeight()
                ? positionedTattoo.getRGB(x, y)
                : 0;
        double alpha = (tattooPx >>> 24) / 255.0;

        if (alpha > 0.0) {
          unpack(tattooPx, top);
          prepareLayer(top, brightness, invGamma);
          for (int c = 0; c < 3; c++) {
            double b = base[c];
            double t = top[c];
            b = mix(b, overlay(b, t), alpha * overlay);
            b = mix(b, softLight(b, t), alpha * softlight);
            b = mix(b, b * t, alpha * multiply);
            base[c] = b;
          }
        }
        out.setRGB(x, y, pack(0xFF, base));
      }
    }
    return out;
  }

  /* ---------------------- blend maths, channels in [0,1] ---------------------- */

  private static void prepareLayer(double[] rgb, double brightness, double invGamma) {
    double luma = 0.299 * rgb[0] + 0.587 * rgb[1] + 0.114 * rgb[2];
    for (int c = 0; c < 3; c++) {
      double v = luma + (rgb[c] - luma) * TATTOO_SATURATION;
      v = ScalePolicy.clamp(v * brightness, 0.0, 1.0);
      rgb[c] = Math.pow(v, invGamma);
    }
  }

  static double overlay(double b, double t) {
    return b < 0.5 ? 2.0 * b * t : 1.0 - 2.0 * (1.0 - b) * (1.0 - t);
  }

  static double softLight(double b, double t) {
    if (t <= 0.5) {
      return b - (1.0 - 2.0 * t) * b * (1.0 - b);
    }
    double d = b <= 0.25 ? ((16.0 * b - 12.0) * b + 4.0) * b : Math.sqrt(b);
    return b + (2.0 * t - 1.0) * (d - b);
  }

  private static double mix(double from, double to, double amount) {
    return from + (to - from) * amount;
  }

  private static void unpack(int argb, double[] rgb) {
    rgb[0] = ((argb >> 16) & 0xFF) / 255.0;
    rgb[1] = ((argb >> 8) & 0xFF) / 255.0;
    rgb[2] = (argb & 0xFF) / 255.0;
  }

  private static int pack(int alpha, double[] rgb) {
    int r = (int) Math.round(ScalePolicy.clamp(rgb[0], 0.0, 1.0) * 255.0);
    int g = (int) Math.round(ScalePolicy.clamp(rgb[1], 0.0, 1.0) * 255.0);
    int b = (int) Math.round(ScalePolicy.clamp(rgb[2], 0.0, 1.0) * 255.0);
    return (alpha << 24) | (r << 16) | (g << 8) | b;
  }
}
