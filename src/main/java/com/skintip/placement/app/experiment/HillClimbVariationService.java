package com.skintip.placement.app.experiment;

import com.skintip.placement.app.config.HillClimbProperties;
import com.skintip.placement.app.exception.PlacementException;
import com.skintip.placement.app.exception.PlacementValidationException;
import com.skintip.placement.app.model.ExperimentRow;
import com.skintip.placement.app.model.PlacementInputs;
import com.skintip.placement.app.model.PlacementRequest;
import com.skintip.placement.app.model.PlacementResult;
import com.skintip.placement.app.model.RenderSettings;
import com.skintip.placement.app.service.GenerationOrchestrator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.ToDoubleFunction;
import lombok.Value;
import lombok.extern.log4j.Log4j2;

/**
 * Plans one hill-climb iteration: the base settings plus one parameter nudged up and down.
 * Parameters are visited group by group; a "no change" pick moves on to the next parameter.
 */
@Log4j2
public class HillClimbVariationService {

  public static final String GROUP_BLEND = "Core Blend & Appearance";
  public static final String GROUP_SIZING = "Sizing & Scaling";

  public static final String NO_CHANGE = "no change";
  public static final String LABEL_COLUMN = "variation_label";

  /** A tunable render parameter with its step size. */
  enum Parameter {
    BAKE_BRIGHTNESS(
        ExperimentColumns.BAKE_BRIGHTNESS, 0.05,
        RenderSettings::getBakeBrightness, RenderSettings::setBakeBrightness),
    BAKE_GAMMA(
        ExperimentColumns.BAKE_GAMMA, 0.05,
        RenderSettings::getBakeGamma, RenderSettings::setBakeGamma),
    OVERLAY_OPACITY(
        ExperimentColumns.OVERLAY_OPACITY, 0.05,
        RenderSettings::getOverlayOpacity, RenderSettings::setOverlayOpacity),
    SOFTLIGHT_OPACITY(
        ExperimentColumns.SOFTLIGHT_OPACITY, 0.05,
        RenderSettings::getSoftlightOpacity, RenderSettings::setSoftlightOpacity),
    MULTIPLY_OPACITY(
        ExperimentColumns.MULTIPLY_OPACITY, 0.02,
        RenderSettings::getMultiplyOpacity, RenderSettings::setMultiplyOpacity),
    GLOBAL_SCALE_UP(
        ExperimentColumns.GLOBAL_SCALE_UP, 0.05,
        RenderSettings::getGlobalScaleUp, RenderSettings::setGlobalScaleUp),
    KONTEXT_SIZE_BIAS(
        ExperimentColumns.KONTEXT_SIZE_BIAS, 0.02,
        RenderSettings::getKontextSizeBias, RenderSettings::setKontextSizeBias),
    FILL_SIZE_BIAS(
        ExperimentColumns.FILL_SIZE_BIAS, 0.02,
        RenderSettings::getFillSizeBias, RenderSettings::setFillSizeBias);

    final String column;
    final double step;
    final ToDoubleFunction<RenderSettings> getter;
    final BiConsumer<RenderSettings, Double> setter;

    Parameter(
        String column,
        double step,
        ToDoubleFunction<RenderSettings> getter,
        BiConsumer<RenderSettings, Double> setter) {
      this.column = column;
      this.step = step;
      this.getter = getter;
      this.setter = setter;
    }

    RenderSettings nudge(RenderSettings base, double delta) {
      RenderSettings copy = base.toBuilder().build();
      setter.accept(copy, round(getter.applyAsDouble(base) + delta));
      return copy;
    }

    private static double round(double v) {
      return Math.round(v * 10000.0) / 10000.0;
    }
  }

  static final Map<String, List<Parameter>> GROUPS = new LinkedHashMap<>();

  static {
    GROUPS.put(
        GROUP_BLEND,
        List.of(
            Parameter.BAKE_BRIGHTNESS,
            Parameter.BAKE_GAMMA,
            Parameter.OVERLAY_OPACITY,
            Parameter.SOFTLIGHT_OPACITY,
            Parameter.MULTIPLY_OPACITY));
    GROUPS.put(
        GROUP_SIZING,
        List.of(Parameter.GLOBAL_SCALE_UP, Parameter.KONTEXT_SIZE_BIAS, Parameter.FILL_SIZE_BIAS));
  }

  /** One planned candidate. */
  @Value
  public static class Variation {
    String label;
    String parameter;
    RenderSettings settings;
  }

  /** Where the search goes after a pick. */
  @Value
  public static class Step {
    RenderSettings base;
    String group;
    int index;
    String parameter;
  }

  /** A generated candidate; {@code imageUrl} is null and {@code error} set when it failed. */
  @Value
  public static class VariationResult {
    String label;
    String imageUrl;
    String error;
    RenderSettings settings;
  }

  private final ExperimentTableCodec codec;
  private final GenerationOrchestrator orchestrator;
  private final HillClimbProperties props;

  public HillClimbVariationService(
      ExperimentTableCodec codec, GenerationOrchestrator orchestrator, HillClimbProperties props) {
    this.codec = Objects.requireNonNull(codec);
    this.orchestrator = Objects.requireNonNull(orchestrator);
    this.props = Objects.requireNonNull(props);
  }

  static List<String> groupNames() {
    return List.copyOf(GROUPS.keySet());
  }

  /** Column names of the parameters in {@code group}, in visiting order. */
  static List<String> parametersOf(String group) {
    List<String> names = new ArrayList<>();
    for (Parameter p : parameters(group)) names.add(p.column);
    return names;
  }

  /** "no change", "{@code <param>} +" and "{@code <param>} -" for parameter {@code index}. */
  public List<Variation> plan(RenderSettings base, String group, int index) {
    Parameter p = parameter(group, index);
    List<Variation> variations =
        List.of(
            new Variation(NO_CHANGE, p.column, base.toBuilder().build()),
            new Variation(p.column + " +", p.column, p.nudge(base, p.step)),
            new Variation(p.column + " -", p.column, p.nudge(base, -p.step)));
    log.info("hillclimb.plan group={} param={} step={}", group, p.column, p.step);
    return variations;
  }

  /**
   * Renders {@code variations} as a strict-triplet table, rows named {@code <prefix>-1..n}. The
   * label goes into an extra {@code variation_label} column.
   */
  public String toTable(String imageIdPrefix, List<Variation> variations) {
    List<String> headers = new ArrayList<>(ExperimentColumns.REQUIRED);
    headers.add(LABEL_COLUMN);

    List<ExperimentRow> rows = new ArrayList<>();
    for (int i = 0; i < variations.size(); i++) {
      Variation v = variations.get(i);
      Map<String, String> cells = new LinkedHashMap<>();
      cells.put(ExperimentRow.IMAGE_ID, imageIdPrefix + "-" + (i + 1));
      cells.putAll(ExperimentColumns.toCells(v.getSettings()));
      cells.put(ExperimentRow.PICK_OF_THE_LITTER, "");
      cells.put(ExperimentRow.ITERATION_FEEDBACK, "");
      cells.put(ExperimentRow.ENGINE_CALL_MODE, ExperimentColumns.DEFAULT_CALL_MODE);
      cells.put(ExperimentRow.ENGINE_ENDPOINT_URL, "");
      cells.put(ExperimentRow.ENGINE_SWITCH_REASON, ExperimentColumns.DEFAULT_SWITCH_REASON);
      cells.put(LABEL_COLUMN, v.getLabel());
      rows.add(new ExperimentRow(i, cells));
    }
    return codec.write(headers, rows);
  }

  /**
   * Picking the unchanged base moves on to the next parameter of the group (wrapping around);
   * any other pick becomes the new base and the same parameter is tried again.
   */
  public Step advance(RenderSettings base, RenderSettings picked, String group, int index) {
    List<Parameter> params = parameters(group);
    parameter(group, index);
    if (picked == null || picked.equals(base)) {
      int next = (index + 1) % params.size();
      return new Step(base, group, next, params.get(next).column);
    }
    return new Step(picked, group, index, params.get(index).column);
  }

  /**
   * Plans and generates the three candidates one after another. A failing candidate is reported in
   * its result and does not stop the others.
   */
  public List<VariationResult> generate(
      RenderSettings base, String group, int index, PlacementInputs inputs) {
    String userId =
        inputs.getUserId() == null || inputs.getUserId().isBlank()
            ? props.getUserId()
            : inputs.getUserId();
    List<VariationResult> results = new ArrayList<>();
    for (Variation v : plan(base, group, index)) {
      PlacementRequest request =
          PlacementRequest.builder()
              .skinImage(inputs.getSkinImage())
              .tattooDesign(inputs.getTattooDesign())
              .mask(inputs.getMask())
              .userId(userId)
              .variationCount(1)
              .settings(v.getSettings())
              .outputFolder(props.getResultsFolder())
              .build();
      try {
        PlacementResult placed = orchestrator.generate(request);
        results.add(
            new VariationResult(
                v.getLabel(), placed.getImageUrls().get(0), null, v.getSettings()));
      } catch (PlacementException e) {
        log.warn("hillclimb.variation.error label={} msg={}", v.getLabel(), e.getMessage());
        results.add(new VariationResult(v.getLabel(), null, e.getMessage(), v.getSettings()));
      }
    }
    return results;
  }

  // ------------------ Helpers ------------------

  private static List<Parameter> parameters(String group) {
    List<Parameter> params = group == null ? null : GROUPS.get(group);
    if (params == null) {
      throw new PlacementValidationException("Invalid parameter group: " + group);
    }
    return params;
  }

  private static Parameter parameter(String group, int index) {
    List<Parameter> params = parameters(group);
    if (index < 0 || index >= params.size()) {
      throw new PlacementValidationException(
          "Invalid parameter index "
              + index
              + " for group "
              + group
              + " (0.."
              + (params.size() - 1)
              + ")");
    }
    return params.get(index);
  }
}
