package com.skintip.placement.app.analysis;

import com.skintip.placement.app.model.EngineId;
import com.skintip.placement.app.model.ScaleDecision;
import com.skintip.placement.app.model.ShapeStats;

/**
 * Deterministic rule table that turns a design's {@link ShapeStats} into a render-scale boost and
 * decides whether the fill engine should take over.
 *
 * <p>Rules are evaluated in order, first match wins:
 *
 * <ol>
 *   <li>thin-line: high thinness, high solidity, low coverage. Scale is boosted into {@code [1.2,
 *       1.5]}, more for sparser designs.
 *   <li>halo/splash: high coverage, low thinness, low solidity. No boost.
 *   <li>anything else is neutral.
 * </ol>
 */
public final class ScalePolicy {

  public static final double THIN_MIN_THINNESS = 0.15;
  public static final double THIN_MIN_SOLIDITY = 0.80;
  public static final double THIN_MAX_COVERAGE = 0.12;

  public static final double HALO_MIN_COVERAGE = 0.20;
  public static final double HALO_MAX_THINNESS = 0.10;
  public static final double HALO_MAX_SOLIDITY = 0.60;

  public static final double MIN_THIN_SCALE = 1.20;
  public static final double MAX_THIN_SCALE = 1.50;

  /** Scale gained per unit of coverage below {@link #THIN_MAX_COVERAGE}. */
  private static final double THIN_SCALE_SLOPE = 2.5;

  private ScalePolicy() {}

  public static double clamp(double value, double min, double max) {
    if (min > max) throw new IllegalArgumentException("min > max: " + min + " > " + max);
    return Math.max(min, Math.min(max, value));
  }

  public static int clamp(int value, int min, int max) {
    if (min > max) throw new IllegalArgumentException("min > max: " + min + " > " + max);
    return Math.max(min, Math.min(max, value));
  }

  public static ScaleDecision chooseAdaptiveScale(ShapeStats stats) {
    if (stats == null) return ScaleDecision.neutral();

    double coverage = stats.getCoverage();
    double thinness = stats.getThinness();
    double solidity = stats.getSolidity();

    if (thinness >= THIN_MIN_THINNESS
        && solidity >= THIN_MIN_SOLIDITY
        && coverage <= THIN_MAX_COVERAGE) {
      double scale =
          clamp(
              MIN_THIN_SCALE + (THIN_MAX_COVERAGE - coverage) * THIN_SCALE_SLOPE,
              MIN_THIN_SCALE,
              MAX_THIN_SCALE);
      return ScaleDecision.of(true, false, scale);
    }

    if (coverage >= HALO_MIN_COVERAGE
        && thinness <= HALO_MAX_THINNESS
        && solidity <= HALO_MAX_SOLIDITY) {
      return ScaleDecision.of(false, true, 1.0);
    }

    return ScaleDecision.neutral();
  }

  /**
   * Engine to call for a design. Only a thin-line design with adaptive switching enabled changes
   * the request, and only towards {@link EngineId#FILL}.
   */
  public static EngineId pickEngine(
      EngineId requested, boolean adaptiveEngineEnabled, boolean isThinLine) {
    if (adaptiveEngineEnabled && isThinLine) return EngineId.FILL;
    return requested;
  }
}
