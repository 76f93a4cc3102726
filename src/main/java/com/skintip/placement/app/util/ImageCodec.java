package com.skintip.placement.app.util;

import com.skintip.placement.app.exception.PlacementValidationException;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Base64;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decoding, PNG normalization and geometric helpers over {@link BufferedImage}. Every image that
 * leaves this class is {@code TYPE_INT_ARGB} or {@code TYPE_BYTE_GRAY}.
 */
public final class ImageCodec {
  private static final Logger log = LoggerFactory.getLogger(ImageCodec.class);

  public static final String PNG_CONTENT_TYPE = "image/png";
  private static final String DATA_URI_PNG = "data:image/png;base64,";

  private ImageCodec() {}

  /* =========================
   * Codec
   * ========================= */

  /** Decodes any ImageIO-readable format into ARGB. */
  public static BufferedImage decode(byte[] bytes, String what) {
    if (bytes == null || bytes.length == 0) {
      throw new PlacementValidationException(what + " image is missing");
    }
    BufferedImage img;
    try {
      img = ImageIO.read(new ByteArrayInputStream(bytes));
    } catch (IOException e) {
      throw new PlacementValidationException(what + " image could not be decoded", e);
    }
    if (img == null) {
      throw new PlacementValidationException(what + " image is not in a supported format");
    }
    return toArgb(img);
  }

  public static byte[] toPng(BufferedImage image) {
    try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
      if (!ImageIO.write(image, "png", baos)) {
        throw new IllegalStateException("No PNG writer available");
      }
      return baos.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException("PNG encoding failed", e);
    }
  }

  /** Re-encodes arbitrary image bytes as an ARGB PNG. */
  public static byte[] normalizeToPng(byte[] bytes, String what) {
    BufferedImage img = decode(bytes, what);
    byte[] png = toPng(img);
    log.debug(
        "image.normalize what={} size={}x{} inBytes={} outBytes={}",
        what,
        img.getWidth(),
        img.getHeight(),
        bytes.length,
        png.length);
    return png;
  }

  public static BufferedImage toArgb(BufferedImage src) {
    if (src.getType() == BufferedImage.TYPE_INT_ARGB) return src;
    BufferedImage out =
        new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = out.createGraphics();
    try {
      g.drawImage(src, 0, 0, null);
    } finally {
      g.dispose();
    }
    return out;
  }

  /** Wraps a row-major gray buffer as a {@code TYPE_BYTE_GRAY} image (copying the buffer). */
  public static BufferedImage fromGray(byte[] gray, int width, int height) {
    BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
    byte[] target = ((DataBufferByte) img.getRaster().getDataBuffer()).getData();
    System.arraycopy(gray, 0, target, 0, width * height);
    return img;
  }

  /* =========================
   * Geometry
   * ========================= */

  /** Largest size with the source aspect ratio that fits inside {@code maxW x maxH}. */
  public static BufferedImage resizeInside(BufferedImage src, int maxW, int maxH) {
    int boxW = Math.max(1, maxW);
    int boxH = Math.max(1, maxH);
    double ratio = Math.min((double) boxW / src.getWidth(), (double) boxH / src.getHeight());
    int w = Math.max(1, (int) Math.round(src.getWidth() * ratio));
    int h = Math.max(1, (int) Math.round(src.getHeight() * ratio));

    BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = out.createGraphics();
    try {
      g.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
      g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      g.drawImage(src, 0, 0, w, h, null);
    } finally {
      g.dispose();
    }
    return out;
  }

  /**
   * Rotates clockwise by {@code degrees} onto a transparent canvas large enough to hold the whole
   * rotated image.
   */
  public static BufferedImage rotate(BufferedImage src, double degrees) {
    if (degrees % 360.0 == 0.0) return src;
    double rad = Math.toRadians(degrees);
    double sin = Math.abs(Math.sin(rad));
    double cos = Math.abs(Math.cos(rad));
    int w = src.getWidth();
    int h = src.getHeight();
    // trig noise at right angles must not add a pixel
    int nw = (int) Math.ceil(w * cos + h * sin - 1e-9);
    int nh = (int) Math.ceil(h * cos + w * sin - 1e-9);

    BufferedImage out = new BufferedImage(nw, nh, BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = out.createGraphics();
    try {
      g.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
      AffineTransform at = new AffineTransform();
      at.translate(nw / 2.0, nh / 2.0);
      at.rotate(rad);
      at.translate(-w / 2.0, -h / 2.0);
      g.drawImage(src, at, null);
    } finally {
      g.dispose();
    }
    return out;
  }

  /* =========================
   * Base64
   * ========================= */

  public static String toPngDataUri(byte[] png) {
    return DATA_URI_PNG + Base64.getEncoder().encodeToString(png);
  }

  /** Decodes plain base64 or a {@code data:*;base64,} URI. */
  public static byte[] decodeBase64(String value, String what) {
    if (value == null || value.isBlank()) {
      throw new PlacementValidationException(what + " is missing");
    }
    String s = value.trim();
    int comma = s.indexOf(',');
    if (s.startsWith("data:") && comma > 0) {
      s = s.substring(comma + 1);
    }
    try {
      return Base64.getMimeDecoder().decode(s);
    } catch (IllegalArgumentException e) {
      throw new PlacementValidationException(what + " is not valid base64", e);
    }
  }
}
