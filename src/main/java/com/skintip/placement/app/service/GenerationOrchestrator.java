package com.skintip.placement.app.service;

import com.skintip.placement.app.analysis.MaskAnalyzer;
import com.skintip.placement.app.analysis.ScalePolicy;
import com.skintip.placement.app.config.GenerationProperties;
import com.skintip.placement.app.exception.ExternalServiceException;
import com.skintip.placement.app.exception.GenerationExhaustedException;
import com.skintip.placement.app.exception.PlacementValidationException;
import com.skintip.placement.app.model.BoundingBox;
import com.skintip.placement.app.model.EngineId;
import com.skintip.placement.app.model.GenerationJob;
import com.skintip.placement.app.model.JobStatus;
import com.skintip.placement.app.model.PlacementRequest;
import com.skintip.placement.app.model.PlacementResult;
import com.skintip.placement.app.model.RenderSettings;
import com.skintip.placement.app.model.ScaleDecision;
import com.skintip.placement.app.model.ShapeStats;
import com.skintip.placement.app.util.GuideCompositor;
import com.skintip.placement.app.util.ImageCodec;
import com.skintip.placement.app.util.MaskMorphology;
import com.skintip.placement.app.util.WatermarkUtils;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import lombok.extern.log4j.Log4j2;

/**
 * Runs one placement end to end: prepare the inputs, decide scale and engine, bake the guide
 * image, submit a single generation job, wait for it, then watermark and store every output.
 *
 * <p>All state lives on the stack of {@link #generate(PlacementRequest)}; the orchestrator can be
 * shared between concurrent callers.
 */
@Log4j2
public class GenerationOrchestrator {

  public static final String DEBUG_FOLDER = "debug_inputs";

  static final double MIN_USER_SCALE = 0.1;
  static final double MAX_USER_SCALE = 3.0;

  private final BackgroundRemovalService backgroundRemoval;
  private final ImageGenerationClient generationClient;
  private final JobPoller jobPoller;
  private final ImageDownloadService downloads;
  private final ImageStorageService storage;
  private final GenerationProperties props;

  public GenerationOrchestrator(
      BackgroundRemovalService backgroundRemoval,
      ImageGenerationClient generationClient,
      JobPoller jobPoller,
      ImageDownloadService downloads,
      ImageStorageService storage,
      GenerationProperties props) {
    this.backgroundRemoval = Objects.requireNonNull(backgroundRemoval);
    this.generationClient = Objects.requireNonNull(generationClient);
    this.jobPoller = Objects.requireNonNull(jobPoller);
    this.downloads = Objects.requireNonNull(downloads);
    this.storage = Objects.requireNonNull(storage);
    this.props = Objects.requireNonNull(props);
  }

  /**
   * @return public URLs of the stored images (at least one) and the decisions taken
   * @throws PlacementValidationException undecodable input or empty mask, before any external call
   * @throws ExternalServiceException submission rejected, job ended failed/canceled, or an output
   *     could not be downloaded
   * @throws GenerationExhaustedException polling ended without any usable output
   */
  public PlacementResult generate(PlacementRequest request) {
    RenderSettings settings =
        request.getSettings() == null ? RenderSettings.builder().build() : request.getSettings();
    String userId = request.getUserId();

    // 1. normalize
    byte[] skinPng = ImageCodec.normalizeToPng(request.getSkinImage(), "skin");
    byte[] maskPng = ImageCodec.normalizeToPng(request.getMask(), "mask");
    if (request.getTattooDesign() == null || request.getTattooDesign().length == 0) {
      throw new PlacementValidationException("tattoo design is missing");
    }

    // 2. background removal, soft
    byte[] designPng = backgroundRemoval.removeBackground(request.getTattooDesign());

    // 3. mask bounds
    BufferedImage skin = ImageCodec.decode(skinPng, "skin");
    BufferedImage maskImg = ImageCodec.decode(maskPng, "mask");
    int mw = maskImg.getWidth();
    int mh = maskImg.getHeight();
    byte[] maskGray = MaskAnalyzer.grayChannel(maskImg);
    BoundingBox box = MaskAnalyzer.boundingBox(maskGray, mw, mh);
    if (box.isEmpty()) {
      throw new PlacementValidationException("Mask area is empty.");
    }

    // 4. shape analysis and engine
    BufferedImage design = ImageCodec.decode(designPng, "tattoo design");
    ShapeStats stats =
        MaskAnalyzer.shapeStats(
            MaskAnalyzer.alphaChannel(design),
            design.getWidth(),
            design.getHeight(),
            MaskAnalyzer.DEFAULT_ALPHA_THRESHOLD);
    ScaleDecision decision = ScalePolicy.chooseAdaptiveScale(stats);
    EngineId requested = settings.getEngine() == null ? EngineId.KONTEXT : settings.getEngine();
    EngineId engine =
        ScalePolicy.pickEngine(
            requested, settings.isAdaptiveEngineEnabled(), decision.isThinLine());

    // 5. effective scale
    double effectiveScale = effectiveScale(settings, decision, engine);

    log.info(
        "placement.analyze userId={} coverage={} thinness={} solidity={} thinLine={}"
            + " haloSplash={} engine={}->{} scale={}",
        userId,
        fmt(stats.getCoverage()),
        fmt(stats.getThinness()),
        fmt(stats.getSolidity()),
        decision.isThinLine(),
        decision.isHaloSplash(),
        requested,
        engine,
        fmt(effectiveScale));

    // 6. grow the mask
    int growPx = maskGrowRadius(settings, box);
    byte[] grown = MaskMorphology.dilate(maskGray, mw, mh, growPx);
    byte[] grownPng = ImageCodec.toPng(ImageCodec.fromGray(grown, mw, mh));

    // 7. place and bake
    int targetW = Math.max(1, (int) Math.round(box.getWidth() * effectiveScale));
    int targetH = Math.max(1, (int) Math.round(box.getHeight() * effectiveScale));
    BufferedImage resized = ImageCodec.resizeInside(design, targetW, targetH);
    BufferedImage rotated = ImageCodec.rotate(resized, settings.getTattooAngle());
    double centeredLeft = box.getMinX() + (box.getWidth() - targetW) / 2.0;
    double centeredTop = box.getMinY() + (box.getHeight() - targetH) / 2.0;
    int left = (int) Math.round(centeredLeft - (rotated.getWidth() - targetW) / 2.0);
    int top = (int) Math.round(centeredTop - (rotated.getHeight() - targetH) / 2.0);

    BufferedImage positioned =
        GuideCompositor.positionOnCanvas(rotated, skin.getWidth(), skin.getHeight(), left, top);
    byte[] guidePng = ImageCodec.toPng(GuideCompositor.bake(skin, positioned, settings));

    // 8. debug
    if (props.isDebugUploads()) {
      uploadDebug(userId, "skin.png", skinPng);
      uploadDebug(userId, "design.png", designPng);
      uploadDebug(userId, "mask.png", maskPng);
      uploadDebug(userId, "mask_grown.png", grownPng);
      uploadDebug(userId, "guide.png", guidePng);
    }

    // 9. submit
    int outputs = Math.max(1, request.getVariationCount());
    Map<String, Object> input = buildInput(settings, guidePng, grownPng, designPng, outputs);
    GenerationJob submitted =
        generationClient.submit(props.versionFor(engine), input, request.getEndpointOverride());

    // 10. poll
    GenerationJob job = jobPoller.awaitCompletion(submitted);
    if (job.getStatus() == JobStatus.FAILED || job.getStatus() == JobStatus.CANCELED) {
      log.error(
          "placement.job.failed jobId={} status={} error={}",
          job.getId(),
          job.getStatus(),
          job.getError());
      throw new ExternalServiceException(
          ImageGenerationClient.SERVICE,
          "job " + job.getId() + " " + job.getRawStatus() + ": " + job.getError(),
          null,
          job.getLogs());
    }
    if (job.getStatus() != JobStatus.SUCCEEDED) {
      throw new GenerationExhaustedException(job.getId(), job.getAttempts(), job.getStopReason());
    }

    // 11. collect
    String folder =
        request.getOutputFolder() == null || request.getOutputFolder().isBlank()
            ? props.getOutputFolder()
            : request.getOutputFolder();
    List<String> urls = new ArrayList<>();
    for (String outputUrl : job.getOutputs()) {
      byte[] image = downloads.download(outputUrl);
      byte[] finished = props.isWatermarkEnabled() ? WatermarkUtils.apply(image) : image;
      urls.add(storage.uploadPng(finished, userId, folder));
    }

    // 12. nothing usable
    if (urls.isEmpty()) {
      throw new GenerationExhaustedException(
          job.getId(), job.getAttempts(), "job succeeded without outputs");
    }

    log.info(
        "placement.done userId={} jobId={} engine={} images={}",
        userId,
        job.getId(),
        engine,
        urls.size());
    return PlacementResult.builder()
        .jobId(job.getId())
        .requestedEngine(requested)
        .engine(engine)
        .scaleDecision(decision)
        .effectiveScale(effectiveScale)
        .imageUrls(List.copyOf(urls))
        .build();
  }

  // ------------------ Helpers ------------------

  static double effectiveScale(RenderSettings settings, ScaleDecision decision, EngineId engine) {
    double adaptive = settings.isAdaptiveScaleEnabled() ? decision.getScale() : 1.0;
    return ScalePolicy.clamp(settings.getTattooScale(), MIN_USER_SCALE, MAX_USER_SCALE)
        * settings.getGlobalScaleUp()
        * adaptive
        * settings.sizeBiasFor(engine);
  }

  static int maskGrowRadius(RenderSettings settings, BoundingBox box) {
    int min = settings.getMaskGrowMin();
    int max = Math.max(min, settings.getMaskGrowMax());
    int side = Math.max(box.getWidth(), box.getHeight());
    int raw = (int) Math.round(settings.getMaskGrowPct() * side);
    return ScalePolicy.clamp(raw, min, max);
  }

  private Map<String, Object> buildInput(
      RenderSettings settings, byte[] guidePng, byte[] grownPng, byte[] designPng, int outputs) {
    Map<String, Object> input = new LinkedHashMap<>();
    input.put("prompt", firstNonBlank(settings.getPrompt(), props.getPrompt()));
    input.put(
        "negative_prompt", firstNonBlank(settings.getNegativePrompt(), props.getNegativePrompt()));
    input.put("image", ImageCodec.toPngDataUri(guidePng));
    input.put("mask", ImageCodec.toPngDataUri(grownPng));
    input.put("reference_image", ImageCodec.toPngDataUri(designPng));
    input.put("num_outputs", outputs);
    input.put("guidance", props.getGuidanceScale());
    input.put("prompt_strength", settings.getPromptWeight());
    input.put("negative_prompt_strength", settings.getNegativePromptWeight());
    input.put("safety_tolerance", props.getSafetyTolerance());
    input.put("seed", ThreadLocalRandom.current().nextInt(0, Integer.MAX_VALUE));
    input.put("output_format", "png");
    return input;
  }

  private void uploadDebug(String userId, String name, byte[] png) {
    try {
      storage.upload(png, name, userId, DEBUG_FOLDER, ImageCodec.PNG_CONTENT_TYPE);
    } catch (ExternalServiceException e) {
      log.warn("placement.debug.skip userId={} file={} msg={}", userId, name, e.getMessage());
    }
  }

  private static String firstNonBlank(String a, String b) {
    return a != null && !a.isBlank() ? a : b;
  }

  private static String fmt(double v) {
    return String.format("%.3f", v);
  }
}
