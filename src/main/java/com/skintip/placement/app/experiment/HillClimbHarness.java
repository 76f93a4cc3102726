package com.skintip.placement.app.experiment;

import com.skintip.placement.app.config.GenerationProperties;
import com.skintip.placement.app.config.HillClimbProperties;
import com.skintip.placement.app.exception.ExperimentValidationException;
import com.skintip.placement.app.exception.PlacementException;
import com.skintip.placement.app.exception.PlacementValidationException;
import com.skintip.placement.app.model.EngineId;
import com.skintip.placement.app.model.ExperimentResult;
import com.skintip.placement.app.model.ExperimentRow;
import com.skintip.placement.app.model.ExperimentRun;
import com.skintip.placement.app.model.PlacementInputs;
import com.skintip.placement.app.model.PlacementRequest;
import com.skintip.placement.app.model.PlacementResult;
import com.skintip.placement.app.model.RenderSettings;
import com.skintip.placement.app.service.GenerationOrchestrator;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.IOUtils;
import org.springframework.core.io.Resource;

/**
 * Drives a batch of candidate renders from a hill-climb table and writes the reviewer's verdict
 * back into it.
 *
 * <p>The whole table is validated before the first external call. Rows are then generated one
 * after another in file order; the first failing row aborts the batch.
 */
@Log4j2
public class HillClimbHarness {

  public static final int TRIPLET_SIZE = 3;
  static final String STUB_URL_PREFIX = "mock://hill-climb/";

  private static final List<String> FEEDBACK_COLUMNS =
      List.of(ExperimentRow.PICK_OF_THE_LITTER, ExperimentRow.ITERATION_FEEDBACK);

  private final ExperimentTableCodec codec;
  private final GenerationOrchestrator orchestrator;
  private final GenerationProperties generationProps;
  private final HillClimbProperties props;

  public HillClimbHarness(
      ExperimentTableCodec codec,
      GenerationOrchestrator orchestrator,
      GenerationProperties generationProps,
      HillClimbProperties props) {
    this.codec = Objects.requireNonNull(codec);
    this.orchestrator = Objects.requireNonNull(orchestrator);
    this.generationProps = Objects.requireNonNull(generationProps);
    this.props = Objects.requireNonNull(props);
  }

  /* =========================
   * Batch generation
   * ========================= */

  /** Runs {@code tableText} against the configured reference skin, design and mask. */
  public ExperimentRun run(String tableText) {
    return execute(tableText, this::referenceInputs);
  }

  public ExperimentRun run(String tableText, PlacementInputs inputs) {
    return execute(tableText, () -> inputs);
  }

  private ExperimentRun execute(String tableText, Supplier<PlacementInputs> inputs) {
    ExperimentTableCodec.ParsedTable table = codec.parse(tableText);

    List<String> missing = ExperimentColumns.missing(table.getHeaders());
    if (!missing.isEmpty()) {
      throw new ExperimentValidationException(
          "Table is missing required columns: " + String.join(", ", missing), missing, null);
    }

    List<ExperimentRow> candidates = new ArrayList<>();
    for (ExperimentRow row : table.getRows()) {
      if (row.getImageId().isEmpty()) {
        log.debug("hillclimb.row.skip index={} reason=blank-image-id", row.getIndex());
        continue;
      }
      candidates.add(row);
    }
    if (props.isStrictTriplet() && candidates.size() != TRIPLET_SIZE) {
      throw new ExperimentValidationException(
          "Expected exactly " + TRIPLET_SIZE + " candidate rows but found " + candidates.size());
    }

    List<Candidate> prepared = new ArrayList<>();
    for (ExperimentRow row : candidates) {
      prepared.add(prepare(row));
    }

    String callMode =
        firstOr(table, ExperimentRow.ENGINE_CALL_MODE, ExperimentColumns.DEFAULT_CALL_MODE);
    String switchReason =
        firstOr(table, ExperimentRow.ENGINE_SWITCH_REASON, ExperimentColumns.DEFAULT_SWITCH_REASON);

    ExperimentRun.ExperimentRunBuilder run =
        ExperimentRun.builder().engineCallMode(callMode).engineSwitchReason(switchReason);

    if (!generationProps.hasCredentials()) {
      log.warn("hillclimb.stub rows={} reason=no-generation-credentials", prepared.size());
      for (Candidate c : prepared) {
        run.result(result(c, STUB_URL_PREFIX + c.row.getImageId(), c.engine));
      }
      return run.build();
    }

    PlacementInputs shared = inputs.get();
    String userId =
        shared.getUserId() == null || shared.getUserId().isBlank()
            ? props.getUserId()
            : shared.getUserId();
    log.info("hillclimb.run rows={} userId={} callMode={}", prepared.size(), userId, callMode);

    for (Candidate c : prepared) {
      PlacementRequest request =
          PlacementRequest.builder()
              .skinImage(shared.getSkinImage())
              .tattooDesign(shared.getTattooDesign())
              .mask(shared.getMask())
              .userId(userId)
              .variationCount(1)
              .settings(c.settings)
              .outputFolder(props.getResultsFolder())
              .endpointOverride(c.endpointOverride)
              .build();
      PlacementResult placed;
      try {
        placed = orchestrator.generate(request);
      } catch (PlacementException e) {
        log.error("hillclimb.row.error imageId={} msg={}", c.row.getImageId(), e.getMessage());
        throw e;
      }
      log.info(
          "hillclimb.row.done imageId={} engine={} url={}",
          c.row.getImageId(),
          placed.getEngine(),
          placed.getImageUrls().get(0));
      run.result(result(c, placed.getImageUrls().get(0), placed.getEngine()));
    }
    return run.build();
  }

  /* =========================
   * Feedback round trip
   * ========================= */

  /**
   * Sets {@code pick_of_the_litter} and {@code iteration_feedback} on every row. Header order and
   * all other cells are kept; the two columns are appended if the table lacks them.
   */
  public String applyFeedback(String tableText, String pickId, String feedback) {
    ExperimentTableCodec.ParsedTable table = codec.parse(tableText);
    List<String> headers = new ArrayList<>(table.getHeaders());
    for (String column : FEEDBACK_COLUMNS) {
      if (!headers.contains(column)) headers.add(column);
    }

    String pick = pickId == null ? "" : pickId;
    String notes = feedback == null ? "" : feedback;
    List<ExperimentRow> updated = new ArrayList<>();
    for (ExperimentRow row : table.getRows()) {
      updated.add(
          row.with(ExperimentRow.PICK_OF_THE_LITTER, pick)
              .with(ExperimentRow.ITERATION_FEEDBACK, notes));
    }
    log.info("hillclimb.feedback rows={} pick={}", updated.size(), pick);
    return codec.write(headers, updated);
  }

  /* =========================
   * Reference inputs
   * ========================= */

  /** Skin, design and mask configured under {@code hill-climb.*}. */
  public PlacementInputs referenceInputs() {
    return PlacementInputs.builder()
        .skinImage(read(props.getSkinImage(), "hill-climb.skin-image"))
        .tattooDesign(read(props.getTattooDesign(), "hill-climb.tattoo-design"))
        .mask(read(props.getMask(), "hill-climb.mask"))
        .userId(props.getUserId())
        .build();
  }

  // ------------------ Helpers ------------------

  private static final class Candidate {
    final ExperimentRow row;
    final EngineId engine;
    final Map<String, Object> params;
    final RenderSettings settings;
    final String endpointOverride;

    Candidate(
        ExperimentRow row, EngineId engine, Map<String, Object> params, String endpointOverride) {
      this.row = row;
      this.engine = engine;
      this.params = params;
      this.settings = ExperimentColumns.toSettings(engine, params);
      this.endpointOverride = endpointOverride;
    }
  }

  private static Candidate prepare(ExperimentRow row) {
    Map<String, Object> params = ExperimentColumns.coerce(row);
    EngineId engine = ExperimentColumns.engine(row);

    String endpoint = null;
    if (ExperimentColumns.CALL_MODE_DIRECT.equalsIgnoreCase(row.getEngineCallMode())) {
      endpoint = row.getEngineEndpointUrl();
      if (!endpoint.toLowerCase(Locale.ROOT).startsWith("https://")) {
        throw new ExperimentValidationException(
            "Invalid or missing engine_endpoint_url for direct call mode in row image_id="
                + row.getImageId()
                + ": '"
                + endpoint
                + "'",
            List.of(ExperimentRow.ENGINE_ENDPOINT_URL),
            row.getImageId());
      }
    }
    return new Candidate(row, engine, params, endpoint);
  }

  private static ExperimentResult result(Candidate c, String url, EngineId engine) {
    return ExperimentResult.builder()
        .row(c.row)
        .imageId(c.row.getImageId())
        .outputUrl(url)
        .engine(engine)
        .params(c.params)
        .build();
  }

  private static String firstOr(
      ExperimentTableCodec.ParsedTable table, String column, String fallback) {
    if (table.getRows().isEmpty()) return fallback;
    String v = table.getRows().get(0).get(column).trim();
    return v.isEmpty() ? fallback : v;
  }

  private static byte[] read(Resource resource, String property) {
    if (resource == null || !resource.exists()) {
      throw new PlacementValidationException("Reference image " + property + " is not configured");
    }
    try (InputStream in = resource.getInputStream()) {
      return IOUtils.toByteArray(in);
    } catch (IOException e) {
      throw new PlacementValidationException(
          "Reference image " + property + " could not be read", e);
    }
  }
}
