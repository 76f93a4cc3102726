package com.skintip.placement.app.experiment;

import com.skintip.placement.app.exception.ExperimentValidationException;
import com.skintip.placement.app.model.EngineId;
import com.skintip.placement.app.model.ExperimentRow;
import com.skintip.placement.app.model.RenderSettings;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Column layout of a hill-climb table and the mapping between its cells and render settings. */
public final class ExperimentColumns {

  public static final String ADAPTIVE_SCALE_ENABLED = "adaptive_scale_enabled";
  public static final String ADAPTIVE_ENGINE_ENABLED = "adaptive_engine_enabled";
  public static final String GLOBAL_SCALE_UP = "global_scale_up";
  public static final String KONTEXT_SIZE_BIAS = "kontext_size_bias";
  public static final String FILL_SIZE_BIAS = "fill_size_bias";
  public static final String MASK_GROW_PCT = "model_mask_grow_pct";
  public static final String MASK_GROW_MIN = "model_mask_grow_min";
  public static final String MASK_GROW_MAX = "model_mask_grow_max";
  public static final String BAKE_BRIGHTNESS = "bake_tattoo_brightness";
  public static final String BAKE_GAMMA = "bake_tattoo_gamma";
  public static final String OVERLAY_OPACITY = "bake_overlay_opacity";
  public static final String SOFTLIGHT_OPACITY = "bake_softlight_opacity";
  public static final String MULTIPLY_OPACITY = "bake_multiply_opacity";
  public static final String PROMPT_WEIGHT = "prompt_weight";
  public static final String NEGATIVE_PROMPT_WEIGHT = "negative_prompt_weight";

  public static final String CALL_MODE_DIRECT = "direct";
  public static final String DEFAULT_CALL_MODE = "default";
  public static final String DEFAULT_SWITCH_REASON = "N/A";

  /** Every column a table must carry, in canonical order. */
  public static final List<String> REQUIRED =
      List.of(
          ExperimentRow.IMAGE_ID,
          ExperimentRow.ENGINE,
          ADAPTIVE_SCALE_ENABLED,
          ADAPTIVE_ENGINE_ENABLED,
          GLOBAL_SCALE_UP,
          KONTEXT_SIZE_BIAS,
          FILL_SIZE_BIAS,
          MASK_GROW_PCT,
          MASK_GROW_MIN,
          MASK_GROW_MAX,
          BAKE_BRIGHTNESS,
          BAKE_GAMMA,
          OVERLAY_OPACITY,
          SOFTLIGHT_OPACITY,
          MULTIPLY_OPACITY,
          PROMPT_WEIGHT,
          NEGATIVE_PROMPT_WEIGHT,
          ExperimentRow.PICK_OF_THE_LITTER,
          ExperimentRow.ITERATION_FEEDBACK,
          ExperimentRow.ENGINE_CALL_MODE,
          ExperimentRow.ENGINE_ENDPOINT_URL,
          ExperimentRow.ENGINE_SWITCH_REASON);

  /** Numeric columns in table order; the two adaptive toggles are 0/1. */
  public static final List<String> NUMERIC =
      List.of(
          ADAPTIVE_SCALE_ENABLED,
          ADAPTIVE_ENGINE_ENABLED,
          GLOBAL_SCALE_UP,
          KONTEXT_SIZE_BIAS,
          FILL_SIZE_BIAS,
          MASK_GROW_PCT,
          MASK_GROW_MIN,
          MASK_GROW_MAX,
          BAKE_BRIGHTNESS,
          BAKE_GAMMA,
          OVERLAY_OPACITY,
          SOFTLIGHT_OPACITY,
          MULTIPLY_OPACITY,
          PROMPT_WEIGHT,
          NEGATIVE_PROMPT_WEIGHT);

  private static final Set<String> BOOLEAN =
      Set.of(ADAPTIVE_SCALE_ENABLED, ADAPTIVE_ENGINE_ENABLED);
  private static final Set<String> INTEGER = Set.of(MASK_GROW_MIN, MASK_GROW_MAX);

  private ExperimentColumns() {}

  /** Required columns absent from {@code headers}, in canonical order. */
  public static List<String> missing(List<String> headers) {
    List<String> missing = new ArrayList<>();
    for (String c : REQUIRED) {
      if (!headers.contains(c)) missing.add(c);
    }
    return missing;
  }

  /**
   * Coerces every numeric column of {@code row}. Toggles become {@link Boolean} (non-zero is
   * true), grow bounds become {@link Integer} (truncated), everything else {@link Double}.
   *
   * @throws ExperimentValidationException naming the column and the row's {@code image_id}
   */
  public static Map<String, Object> coerce(ExperimentRow row) {
    Map<String, Object> params = new LinkedHashMap<>();
    for (String column : NUMERIC) {
      double value = parse(row, column);
      if (BOOLEAN.contains(column)) {
        params.put(column, value != 0.0);
      } else if (INTEGER.contains(column)) {
        params.put(column, (int) value);
      } else {
        params.put(column, value);
      }
    }
    return params;
  }

  private static double parse(ExperimentRow row, String column) {
    String raw = row.get(column).trim();
    double v;
    try {
      v = Double.parseDouble(raw);
    } catch (NumberFormatException e) {
      throw notANumber(row, column, raw);
    }
    if (Double.isNaN(v) || Double.isInfinite(v)) {
      throw notANumber(row, column, raw);
    }
    return v;
  }

  private static ExperimentValidationException notANumber(
      ExperimentRow row, String column, String raw) {
    return new ExperimentValidationException(
        "Column "
            + column
            + " is not a number in row image_id="
            + row.getImageId()
            + ": '"
            + raw
            + "'",
        List.of(column),
        row.getImageId());
  }

  public static EngineId engine(ExperimentRow row) {
    try {
      return EngineId.fromId(row.getEngine());
    } catch (IllegalArgumentException e) {
      throw new ExperimentValidationException(
          "Unknown engine '" + row.getEngine() + "' in row image_id=" + row.getImageId(),
          List.of(ExperimentRow.ENGINE),
          row.getImageId());
    }
  }

  /** Builds render settings from already coerced params. */
  public static RenderSettings toSettings(EngineId engine, Map<String, Object> params) {
    return RenderSettings.builder()
        .engine(engine)
        .adaptiveScaleEnabled((Boolean) params.get(ADAPTIVE_SCALE_ENABLED))
        .adaptiveEngineEnabled((Boolean) params.get(ADAPTIVE_ENGINE_ENABLED))
        .globalScaleUp((Double) params.get(GLOBAL_SCALE_UP))
        .kontextSizeBias((Double) params.get(KONTEXT_SIZE_BIAS))
        .fillSizeBias((Double) params.get(FILL_SIZE_BIAS))
        .maskGrowPct((Double) params.get(MASK_GROW_PCT))
        .maskGrowMin((Integer) params.get(MASK_GROW_MIN))
        .maskGrowMax((Integer) params.get(MASK_GROW_MAX))
        .bakeBrightness((Double) params.get(BAKE_BRIGHTNESS))
        .bakeGamma((Double) params.get(BAKE_GAMMA))
        .overlayOpacity((Double) params.get(OVERLAY_OPACITY))
        .softlightOpacity((Double) params.get(SOFTLIGHT_OPACITY))
        .multiplyOpacity((Double) params.get(MULTIPLY_OPACITY))
        .promptWeight((Double) params.get(PROMPT_WEIGHT))
        .negativePromptWeight((Double) params.get(NEGATIVE_PROMPT_WEIGHT))
        .build();
  }

  /** Engine plus numeric cells of {@code settings}, keyed by column name. */
  public static Map<String, String> toCells(RenderSettings settings) {
    Map<String, String> cells = new LinkedHashMap<>();
    cells.put(ExperimentRow.ENGINE, settings.getEngine().id());
    cells.put(ADAPTIVE_SCALE_ENABLED, settings.isAdaptiveScaleEnabled() ? "1" : "0");
    cells.put(ADAPTIVE_ENGINE_ENABLED, settings.isAdaptiveEngineEnabled() ? "1" : "0");
    cells.put(GLOBAL_SCALE_UP, num(settings.getGlobalScaleUp()));
    cells.put(KONTEXT_SIZE_BIAS, num(settings.getKontextSizeBias()));
    cells.put(FILL_SIZE_BIAS, num(settings.getFillSizeBias()));
    cells.put(MASK_GROW_PCT, num(settings.getMaskGrowPct()));
    cells.put(MASK_GROW_MIN, Integer.toString(settings.getMaskGrowMin()));
    cells.put(MASK_GROW_MAX, Integer.toString(settings.getMaskGrowMax()));
    cells.put(BAKE_BRIGHTNESS, num(settings.getBakeBrightness()));
    cells.put(BAKE_GAMMA, num(settings.getBakeGamma()));
    cells.put(OVERLAY_OPACITY, num(settings.getOverlayOpacity()));
    cells.put(SOFTLIGHT_OPACITY, num(settings.getSoftlightOpacity()));
    cells.put(MULTIPLY_OPACITY, num(settings.getMultiplyOpacity()));
    cells.put(PROMPT_WEIGHT, num(settings.getPromptWeight()));
    cells.put(NEGATIVE_PROMPT_WEIGHT, num(settings.getNegativePromptWeight()));
    return cells;
  }

  // steps of 0.05/0.02 accumulate float error; four decimals is plenty for a table cell
  static String num(double v) {
    return BigDecimal.valueOf(Math.round(v * 10000.0) / 10000.0)
        .stripTrailingZeros()
        .toPlainString();
  }
}
