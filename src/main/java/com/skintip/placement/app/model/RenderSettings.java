package com.skintip.placement.app.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tunable rendering parameters for one placement. Mirrors the numeric columns of a hill-climb
 * table plus the per-request slider values (scale, angle) and prompt texts.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RenderSettings {

  @Builder.Default private EngineId engine = EngineId.KONTEXT;

  @Builder.Default private boolean adaptiveScaleEnabled = true;
  @Builder.Default private boolean adaptiveEngineEnabled = true;

  @Builder.Default private double globalScaleUp = 1.0;
  @Builder.Default private double kontextSizeBias = 1.0;
  @Builder.Default private double fillSizeBias = 1.0;

  // Mask growth, as a fraction of the larger mask side, bounded in pixels.
  @Builder.Default private double maskGrowPct = 0.04;
  @Builder.Default private int maskGrowMin = 4;
  @Builder.Default private int maskGrowMax = 32;

  @Builder.Default private double bakeBrightness = 1.0;
  @Builder.Default private double bakeGamma = 1.0;
  @Builder.Default private double overlayOpacity = 0.35;
  @Builder.Default private double softlightOpacity = 0.25;
  @Builder.Default private double multiplyOpacity = 0.10;

  @Builder.Default private double promptWeight = 1.0;
  @Builder.Default private double negativePromptWeight = 1.0;

  /** User scale slider; clamped before use. */
  @Builder.Default private double tattooScale = 1.0;

  /** Rotation in degrees, clockwise. */
  @Builder.Default private double tattooAngle = 0.0;

  private String prompt;
  private String negativePrompt;

  public double sizeBiasFor(EngineId id) {
    return id == EngineId.FILL ? fillSizeBias : kontextSizeBias;
  }
}
