package com.skintip.placement.app.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.skintip.placement.app.TestImages;
import com.skintip.placement.app.model.BoundingBox;
import com.skintip.placement.app.model.ScaleDecision;
import com.skintip.placement.app.model.ShapeStats;
import java.awt.image.BufferedImage;
import org.junit.jupiter.api.Test;

class MaskAnalyzerTest {

  private static final double EPS = 1e-9;

  @Test
  void boundingBox_coversForegroundExactly() {
    byte[] px = TestImages.grayRect(10, 10, 2, 3, 4, 5, 255);

    BoundingBox box = MaskAnalyzer.boundingBox(px, 10, 10);

    assertFalse(box.isEmpty());
    assertEquals(2, box.getMinX());
    assertEquals(3, box.getMinY());
    assertEquals(5, box.getMaxX());
    assertEquals(7, box.getMaxY());
    assertEquals(4, box.getWidth());
    assertEquals(5, box.getHeight());
  }

  @Test
  void boundingBox_anyPositiveValueIsForeground() {
    byte[] px = new byte[25];
    px[2 * 5 + 3] = 1;

    BoundingBox box = MaskAnalyzer.boundingBox(px, 5, 5);

    assertEquals(3, box.getMinX());
    assertEquals(2, box.getMinY());
    assertEquals(1, box.getWidth());
    assertEquals(1, box.getHeight());
  }

  @Test
  void boundingBox_paddingIsClampedToImage() {
    byte[] px = TestImages.grayRect(10, 10, 1, 6, 3, 3, 200);

    BoundingBox box = MaskAnalyzer.boundingBox(px, 10, 10, 2);

    assertEquals(0, box.getMinX());
    assertEquals(4, box.getMinY());
    assertEquals(5, box.getMaxX());
    assertEquals(9, box.getMaxY());
    assertEquals(6, box.getWidth());
    assertEquals(6, box.getHeight());
  }

  @Test
  void boundingBox_emptyMaskReturnsSentinelWithoutThrowing() {
    BoundingBox box = MaskAnalyzer.boundingBox(new byte[64], 8, 8);

    assertTrue(box.isEmpty());
    assertEquals(0, box.getMinX());
    assertEquals(0, box.getMinY());
    assertEquals(0, box.getMaxX());
    assertEquals(0, box.getMaxY());
    assertEquals(0, box.getWidth());
  }

  @Test
  void boundingBox_rejectsShortBuffer() {
    assertThrows(
        IllegalArgumentException.class, () -> MaskAnalyzer.boundingBox(new byte[10], 4, 4));
  }

  @Test
  void shapeStats_solidBlock() {
    byte[] px = TestImages.grayRect(10, 10, 3, 3, 4, 4, 255);

    ShapeStats stats = MaskAnalyzer.shapeStats(px, 10, 10, 128);

    assertEquals(0.16, stats.getCoverage(), EPS);
    // 12 of the 16 pixels sit on the block's outline
    assertEquals(0.75, stats.getThinness(), EPS);
    assertEquals(1.0, stats.getSolidity(), EPS);
  }

  @Test
  void shapeStats_singlePixelLineIsAllEdge() {
    byte[] px = TestImages.grayRect(10, 10, 1, 5, 8, 1, 255);

    ShapeStats stats = MaskAnalyzer.shapeStats(px, 10, 10, 128);

    assertEquals(0.08, stats.getCoverage(), EPS);
    assertEquals(1.0, stats.getThinness(), EPS);
    assertEquals(1.0, stats.getSolidity(), EPS);
    assertTrue(ScalePolicy.chooseAdaptiveScale(stats).isThinLine());
  }

  @Test
  void shapeStats_diagonalHasLowSolidity() {
    byte[] px = new byte[100];
    for (int i = 0; i < 10; i++) px[i * 10 + i] = (byte) 255;

    ShapeStats stats = MaskAnalyzer.shapeStats(px, 10, 10, 128);

    assertEquals(0.1, stats.getSolidity(), EPS);
  }

  @Test
  void shapeStats_outlineArtworkStaysNeutral() {
    // 2px square outline: all but the four inner corners are edge, the box is mostly empty
    byte[] px = new byte[200 * 200];
    for (int y = 40; y < 160; y++) {
      for (int x = 40; x < 160; x++) {
        boolean stroke = x < 42 || x >= 158 || y < 42 || y >= 158;
        if (stroke) px[y * 200 + x] = (byte) 255;
      }
    }

    ShapeStats stats = MaskAnalyzer.shapeStats(px, 200, 200, 128);

    assertTrue(stats.getCoverage() < 0.12, "coverage " + stats.getCoverage());
    assertEquals(940.0 / 944.0, stats.getThinness(), EPS);
    assertTrue(stats.getSolidity() < 0.1, "solidity " + stats.getSolidity());
    ScaleDecision decision = ScalePolicy.chooseAdaptiveScale(stats);
    assertFalse(decision.isThinLine());
    assertEquals(1.0, decision.getScale(), EPS);
  }

  @Test
  void shapeStats_ignoresPixelsAtOrBelowThreshold() {
    byte[] px = TestImages.grayRect(10, 10, 0, 0, 10, 10, 128);

    ShapeStats stats = MaskAnalyzer.shapeStats(px, 10, 10, 128);

    assertEquals(ShapeStats.empty(), stats);
  }

  @Test
  void shapeStats_emptyMaskIsNeutralForPolicy() {
    ShapeStats stats = MaskAnalyzer.shapeStats(new byte[100], 10, 10, 128);

    assertEquals(0.0, stats.getCoverage(), EPS);
    assertEquals(0.0, stats.getThinness(), EPS);
    assertEquals(0.0, stats.getSolidity(), EPS);

    ScaleDecision decision = ScalePolicy.chooseAdaptiveScale(stats);
    assertFalse(decision.isThinLine());
    assertFalse(decision.isHaloSplash());
    assertEquals(1.0, decision.getScale(), EPS);
  }

  @Test
  void alphaChannel_opaqueImageIsFullyInked() {
    BufferedImage rgb = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);

    byte[] alpha = MaskAnalyzer.alphaChannel(rgb);

    assertEquals(6, alpha.length);
    for (byte a : alpha) assertEquals(255, a & 0xFF);
  }

  @Test
  void alphaChannel_readsTransparency() {
    BufferedImage img = TestImages.rect(4, 4, 1, 1, 2, 2, 0xFF112233);

    byte[] alpha = MaskAnalyzer.alphaChannel(img);

    assertEquals(0, alpha[0] & 0xFF);
    assertEquals(255, alpha[5] & 0xFF);
  }

  @Test
  void grayChannel_whiteOnBlack() {
    BufferedImage mask = TestImages.mask(4, 4, 2, 0, 2, 4);

    byte[] gray = MaskAnalyzer.grayChannel(mask);

    assertEquals(0, gray[0] & 0xFF);
    assertEquals(255, gray[2] & 0xFF);
    BoundingBox box = MaskAnalyzer.boundingBox(gray, 4, 4);
    assertEquals(2, box.getMinX());
    assertEquals(2, box.getWidth());
    assertEquals(4, box.getHeight());
  }
}
