package com.skintip.placement.app.api;

import com.skintip.placement.app.analysis.ScalePolicy;
import com.skintip.placement.app.config.GenerationProperties;
import com.skintip.placement.app.config.PlacementDefaults;
import com.skintip.placement.app.experiment.HillClimbHarness;
import com.skintip.placement.app.experiment.HillClimbVariationService;
import com.skintip.placement.app.model.EngineId;
import com.skintip.placement.app.model.ExperimentResult;
import com.skintip.placement.app.model.ExperimentRun;
import com.skintip.placement.app.model.PlacementInputs;
import com.skintip.placement.app.model.PlacementRequest;
import com.skintip.placement.app.model.PlacementResult;
import com.skintip.placement.app.model.RenderSettings;
import com.skintip.placement.app.service.GenerationOrchestrator;
import com.skintip.placement.app.util.ImageCodec;
import com.skintip.placement.app.util.KeyCaseCodec;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Log4j2
@Validated
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PlacementController {

  static final String CSV_MEDIA_TYPE = "text/csv";

  private final GenerationOrchestrator orchestrator;
  private final HillClimbHarness harness;
  private final HillClimbVariationService variations;
  private final GenerationProperties generationProps;
  private final PlacementDefaults defaults;

  // ------------------------------------------------------------
  // /api/health
  // ------------------------------------------------------------
  @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "ok");
    body.put("message", "Backend is healthy");
    body.put("engines", Arrays.stream(EngineId.values()).map(EngineId::id).toList());
    body.put("generationConfigured", generationProps.hasCredentials());
    return ResponseEntity.ok(body);
  }

  // ------------------------------------------------------------
  // /api/generate-final-tattoo
  // ------------------------------------------------------------
  @PostMapping(
      path = "/generate-final-tattoo",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> generateFinalTattoo(
      @RequestBody @Validated GenerateRequest req) {

    int requested = req.getVariationCount() == null ? 1 : req.getVariationCount();
    int count = ScalePolicy.clamp(requested, 1, Math.max(1, defaults.getMaxVariations()));
    RenderSettings settings =
        req.getSettings() == null ? defaults.getDefaults() : req.getSettings();
    log.info(
        "api.generate userId={} variations={} engine={}",
        req.getUserId(),
        count,
        settings.getEngine());

    PlacementResult result =
        orchestrator.generate(
            PlacementRequest.builder()
                .skinImage(ImageCodec.decodeBase64(req.getSkinImageBase64(), "skinImageBase64"))
                .tattooDesign(
                    ImageCodec.decodeBase64(req.getTattooDesignBase64(), "tattooDesignBase64"))
                .mask(ImageCodec.decodeBase64(req.getMaskBase64(), "maskBase64"))
                .userId(req.getUserId())
                .variationCount(count)
                .settings(settings)
                .build());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put("message", "Tattoo placement successful!");
    body.put("result", result);
    return ResponseEntity.ok(body);
  }

  // ------------------------------------------------------------
  // /api/admin/hillflux-test
  // ------------------------------------------------------------
  @PostMapping(
      path = "/admin/hillflux-test",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> hillFluxTest(
      @RequestBody @Validated HillFluxTestRequest req) {
    log.info("api.hillflux.test fileName={}", req.getFileName());
    ExperimentRun run = harness.run(req.getCsvData());

    List<Map<String, Object>> results = new ArrayList<>();
    for (ExperimentResult r : run.getResults()) {
      Map<String, Object> item = new LinkedHashMap<>();
      item.put("imageId", r.getImageId());
      item.put("outputUrl", r.getOutputUrl());
      item.put("engine", r.getEngine());
      item.put("params", KeyCaseCodec.toCamelKeys(r.getParams()));
      results.add(item);
    }

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put("fileName", req.getFileName());
    body.put("results", results);
    body.put("engineCallMode", run.getEngineCallMode());
    body.put("engineSwitchReason", run.getEngineSwitchReason());
    return ResponseEntity.ok(body);
  }

  // ------------------------------------------------------------
  // /api/admin/update-hillflux-csv
  // ------------------------------------------------------------
  @PostMapping(
      path = "/admin/update-hillflux-csv",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = CSV_MEDIA_TYPE)
  public ResponseEntity<String> updateHillFluxCsv(@RequestBody @Validated FeedbackRequest req) {
    String csv =
        harness.applyFeedback(
            req.getCsvData(), req.getPickOfTheLitter(), req.getIterationFeedback());
    return ResponseEntity.ok()
        .header("Content-Disposition", "attachment; filename=\"updated_hillflux.csv\"")
        .body(csv);
  }

  // ------------------------------------------------------------
  // /api/admin/hill-climb
  // ------------------------------------------------------------
  @PostMapping(
      path = "/admin/hill-climb",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> hillClimb(
      @RequestBody @Validated HillClimbRequest req) {
    PlacementInputs inputs = inputsOf(req);
    log.info(
        "api.hillclimb group={} index={} userId={}",
        req.getActiveGroup(),
        req.getParamIndex(),
        inputs.getUserId());

    List<HillClimbVariationService.VariationResult> generated =
        variations.generate(req.getBaseParams(), req.getActiveGroup(), req.getParamIndex(), inputs);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put("activeGroup", req.getActiveGroup());
    body.put("paramIndex", req.getParamIndex());
    body.put("variations", generated);
    return ResponseEntity.ok(body);
  }

  @PostMapping(
      path = "/admin/hill-climb/table",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = CSV_MEDIA_TYPE)
  public ResponseEntity<String> hillClimbTable(@RequestBody @Validated PlanRequest req) {
    String prefix =
        req.getImageIdPrefix() == null || req.getImageIdPrefix().isBlank()
            ? "candidate"
            : req.getImageIdPrefix();
    List<HillClimbVariationService.Variation> plan =
        variations.plan(req.getBaseParams(), req.getActiveGroup(), req.getParamIndex());
    String csv = variations.toTable(prefix, plan);
    return ResponseEntity.ok(csv);
  }

  @PostMapping(
      path = "/admin/hill-climb/advance",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<HillClimbVariationService.Step> hillClimbAdvance(
      @RequestBody @Validated AdvanceRequest req) {
    return ResponseEntity.ok(
        variations.advance(
            req.getBaseParams(), req.getPickedParams(), req.getActiveGroup(), req.getParamIndex()));
  }

  // ============================================================
  // DTOs
  // ============================================================
  @Data
  public static class GenerateRequest {
    @NotBlank private String skinImageBase64;
    @NotBlank private String tattooDesignBase64;
    @NotBlank private String maskBase64;
    @NotBlank private String userId;

    @Min(1)
    private Integer variationCount;

    private RenderSettings settings;
  }

  @Data
  public static class HillFluxTestRequest {
    @NotBlank private String csvData;
    private String fileName;
  }

  @Data
  public static class FeedbackRequest {
    @NotBlank private String csvData;
    private String pickOfTheLitter;
    private String iterationFeedback;
  }

  @Data
  public static class PlanRequest {
    @NotNull private RenderSettings baseParams;
    @NotBlank private String activeGroup;

    @Min(0)
    private int paramIndex;

    private String imageIdPrefix;
  }

  @Data
  public static class AdvanceRequest {
    @NotNull private RenderSettings baseParams;
    private RenderSettings pickedParams;
    @NotBlank private String activeGroup;

    @Min(0)
    private int paramIndex;
  }

  @Data
  public static class HillClimbRequest {
    @NotNull private RenderSettings baseParams;
    @NotBlank private String activeGroup;

    @Min(0)
    private int paramIndex;

    private String userId;

    /** Optional; the configured reference images are used when any of the three is absent. */
    private String skinImageBase64;

    private String tattooDesignBase64;
    private String maskBase64;
  }

  // ============================================================
  // Helpers
  // ============================================================
  private PlacementInputs inputsOf(HillClimbRequest req) {
    if (isBlank(req.getSkinImageBase64())
        || isBlank(req.getTattooDesignBase64())
        || isBlank(req.getMaskBase64())) {
      PlacementInputs ref = harness.referenceInputs();
      return isBlank(req.getUserId()) ? ref : ref.toBuilder().userId(req.getUserId()).build();
    }
    return PlacementInputs.builder()
        .skinImage(ImageCodec.decodeBase64(req.getSkinImageBase64(), "skinImageBase64"))
        .tattooDesign(ImageCodec.decodeBase64(req.getTattooDesignBase64(), "tattooDesignBase64"))
        .mask(ImageCodec.decodeBase64(req.getMaskBase64(), "maskBase64"))
        .userId(req.getUserId())
        .build();
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
