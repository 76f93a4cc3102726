package com.skintip.placement.app.util;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stamps the brand watermark into the bottom-right corner of finished images. */
public final class WatermarkUtils {
  private static final Logger log = LoggerFactory.getLogger(WatermarkUtils.class);

  public static final String WATERMARK_TEXT = "SkinTip.AI";

  // watermark box and its distance from the bottom-right corner
  private static final int BOX_WIDTH = 200;
  private static final int BOX_HEIGHT = 30;
  private static final int MARGIN = 15;

  private WatermarkUtils() {}

  /**
   * Returns a PNG with the watermark applied. If the bytes cannot be decoded the input is
   * returned unchanged; an unmarked image is preferable to losing a finished render.
   */
  public static byte[] apply(byte[] imageBytes) {
    try {
      BufferedImage img = ImageCodec.decode(imageBytes, "generated");
      return ImageCodec.toPng(stamp(img));
    } catch (RuntimeException e) {
      log.error(
          "watermark.error bytes={} msg={}",
          imageBytes == null ? 0 : imageBytes.length,
          e.getMessage(),
          e);
      return imageBytes;
    }
  }

  public static BufferedImage stamp(BufferedImage src) {
    BufferedImage out =
        new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_ARGB);
    int left = Math.max(0, out.getWidth() - BOX_WIDTH - MARGIN);
    int top = Math.max(0, out.getHeight() - BOX_HEIGHT - MARGIN);

    Graphics2D g = out.createGraphics();
    try {
      g.drawImage(src, 0, 0, null);
      g.setRenderingHint(
          RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
      g.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER, 0.5f));
      g.setColor(Color.WHITE);
      g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 16));
      g.drawString(WATERMARK_TEXT, left + 10, top + 25);
    } finally {
      g.dispose();
    }
    return out;
  }
}
