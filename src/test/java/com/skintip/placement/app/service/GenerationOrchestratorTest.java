package com.skintip.placement.app.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.skintip.placement.app.TestImages;
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
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GenerationOrchestratorTest {

  private static final String USER = "user-1";

  @Mock private BackgroundRemovalService backgroundRemoval;
  @Mock private ImageGenerationClient client;
  @Mock private JobPoller poller;
  @Mock private ImageDownloadService downloads;
  @Mock private ImageStorageService storage;

  @Captor private ArgumentCaptor<Map<String, Object>> input;

  private GenerationProperties props;
  private GenerationOrchestrator orchestrator;

  private final byte[] skin = TestImages.png(TestImages.solid(64, 64, 0xFFC8A080));
  private final byte[] mask = TestImages.png(TestImages.mask(64, 64, 16, 16, 32, 32));
  private final byte[] solidDesign = TestImages.png(TestImages.solid(40, 40, 0xFF000000));
  // 1px stroke: sparse, all edge, perfectly solid box.
  private final byte[] lineDesign =
      TestImages.png(TestImages.rect(100, 100, 25, 50, 50, 1, 0xFF000000));
  private final byte[] output = TestImages.png(TestImages.solid(64, 64, 0xFF336699));

  @BeforeEach
  void setUp() {
    props = new GenerationProperties();
    props.getEngineVersions().put(EngineId.KONTEXT, "v-kontext");
    props.getEngineVersions().put(EngineId.FILL, "v-fill");
    // text rendering needs fonts; not something to depend on here
    props.setWatermarkEnabled(false);

    orchestrator =
        new GenerationOrchestrator(backgroundRemoval, client, poller, downloads, storage, props);

    when(backgroundRemoval.removeBackground(any())).thenAnswer(inv -> inv.getArgument(0));
    when(client.submit(anyString(), anyMap(), any())).thenReturn(job(JobStatus.STARTING).build());
    when(downloads.download(anyString())).thenReturn(output);
    when(storage.uploadPng(any(), eq(USER), anyString()))
        .thenReturn("https://cdn.test/a.png", "https://cdn.test/b.png");
  }

  @Test
  void neutralDesign_staysOnRequestedEngineAndStoresEveryOutput() {
    when(poller.awaitCompletion(any()))
        .thenReturn(
            job(JobStatus.SUCCEEDED)
                .output("https://out.test/0.png")
                .output("https://out.test/1.png")
                .build());

    PlacementResult result = orchestrator.generate(request(solidDesign).variationCount(2).build());

    assertEquals(
        List.of("https://cdn.test/a.png", "https://cdn.test/b.png"), result.getImageUrls());
    assertEquals(EngineId.KONTEXT, result.getEngine());
    assertFalse(result.engineSwitched());
    assertEquals("job-1", result.getJobId());
    assertEquals(1.0, result.getEffectiveScale(), 1e-9);

    verify(client).submit(eq("v-kontext"), input.capture(), isNull());
    Map<String, Object> sent = input.getValue();
    assertEquals(2, sent.get("num_outputs"));
    assertEquals("png", sent.get("output_format"));
    assertEquals(props.getPrompt(), sent.get("prompt"));
    assertEquals(props.getGuidanceScale(), sent.get("guidance"));
    assertEquals(1.0, sent.get("prompt_strength"));
    assertTrue(((String) sent.get("image")).startsWith("data:image/png;base64,"));
    assertTrue(((String) sent.get("mask")).startsWith("data:image/png;base64,"));
    assertTrue(((String) sent.get("reference_image")).startsWith("data:image/png;base64,"));
    assertTrue(sent.containsKey("seed"));

    verify(storage, times(2)).uploadPng(any(), eq(USER), eq("generated"));
    verify(storage, never()).upload(any(), anyString(), anyString(), anyString(), anyString());
  }

  @Test
  void thinLineDesign_switchesToFillAndScalesUp() {
    when(poller.awaitCompletion(any()))
        .thenReturn(job(JobStatus.SUCCEEDED).output("https://out.test/0.png").build());

    PlacementResult result = orchestrator.generate(request(lineDesign).build());

    assertEquals(EngineId.KONTEXT, result.getRequestedEngine());
    assertEquals(EngineId.FILL, result.getEngine());
    assertTrue(result.engineSwitched());
    assertTrue(result.getScaleDecision().isThinLine());
    // coverage 0.005 -> 1.2 + 0.115 * 2.5
    assertEquals(1.4875, result.getEffectiveScale(), 1e-9);
    verify(client).submit(eq("v-fill"), anyMap(), isNull());
  }

  @Test
  void thinLineDesign_keepsEngineWhenAdaptiveEngineIsOff() {
    when(poller.awaitCompletion(any()))
        .thenReturn(job(JobStatus.SUCCEEDED).output("https://out.test/0.png").build());
    RenderSettings settings =
        RenderSettings.builder().adaptiveEngineEnabled(false).kontextSizeBias(0.8).build();

    PlacementResult result = orchestrator.generate(request(lineDesign).settings(settings).build());

    assertEquals(EngineId.KONTEXT, result.getEngine());
    assertEquals(1.4875 * 0.8, result.getEffectiveScale(), 1e-9);
  }

  @Test
  void emptyMask_failsBeforeSubmission() {
    byte[] blank = TestImages.png(TestImages.solid(64, 64, 0xFF000000));

    PlacementValidationException ex =
        assertThrows(
            PlacementValidationException.class,
            () -> orchestrator.generate(request(solidDesign).mask(blank).build()));

    assertEquals("Mask area is empty.", ex.getMessage());
    verifyNoInteractions(client, poller, downloads, storage);
  }

  @Test
  void undecodableSkin_failsBeforeAnyExternalCall() {
    byte[] notAnImage = "not an image".getBytes(StandardCharsets.UTF_8);

    assertThrows(
        PlacementValidationException.class,
        () -> orchestrator.generate(request(solidDesign).skinImage(notAnImage).build()));

    verifyNoInteractions(backgroundRemoval, client, poller, downloads, storage);
  }

  @Test
  void failedJob_surfacesApiDiagnostic() {
    when(poller.awaitCompletion(any()))
        .thenReturn(
            job(JobStatus.FAILED)
                .rawStatus("failed")
                .error("NSFW content detected")
                .logs("step 3/28 ...")
                .build());

    ExternalServiceException ex =
        assertThrows(ExternalServiceException.class, this::generateSolid);

    assertEquals(ImageGenerationClient.SERVICE, ex.getService());
    assertEquals("step 3/28 ...", ex.getDiagnostic());
    assertTrue(ex.getMessage().contains("NSFW content detected"));
    verifyNoInteractions(downloads, storage);
  }

  @Test
  void pollingBudgetExhausted_isNotReportedAsFailure() {
    when(poller.awaitCompletion(any()))
        .thenReturn(
            job(JobStatus.PROCESSING)
                .attempts(3)
                .stopReason("attempt budget of 3 exhausted")
                .build());

    GenerationExhaustedException ex =
        assertThrows(GenerationExhaustedException.class, this::generateSolid);

    assertEquals("job-1", ex.getJobId());
    assertEquals(3, ex.getAttempts());
    verifyNoInteractions(downloads, storage);
  }

  @Test
  void succeededWithoutOutputs_isExhaustion() {
    when(poller.awaitCompletion(any())).thenReturn(job(JobStatus.SUCCEEDED).build());

    GenerationExhaustedException ex =
        assertThrows(GenerationExhaustedException.class, this::generateSolid);

    assertTrue(ex.getMessage().contains("without outputs"), ex.getMessage());
  }

  @Test
  void failedDownload_failsTheJobWithDiagnostic() {
    when(poller.awaitCompletion(any()))
        .thenReturn(
            job(JobStatus.SUCCEEDED)
                .output("https://out.test/0.png")
                .output("https://out.test/1.png")
                .build());
    when(downloads.download("https://out.test/0.png"))
        .thenThrow(
            new ExternalServiceException(ImageDownloadService.SERVICE, "denied", 403, "denied"));

    ExternalServiceException ex =
        assertThrows(
            ExternalServiceException.class,
            () -> orchestrator.generate(request(solidDesign).variationCount(2).build()));

    assertEquals(403, ex.getStatusCode());
    assertEquals("denied", ex.getDiagnostic());
    verify(downloads, never()).download("https://out.test/1.png");
    verify(storage, never()).uploadPng(any(), anyString(), anyString());
  }

  @Test
  void debugUploads_areBestEffort() {
    props.setDebugUploads(true);
    when(storage.upload(any(), eq("guide.png"), anyString(), anyString(), anyString()))
        .thenThrow(new ExternalServiceException(ImageStorageService.SERVICE, "denied", null, null));
    when(poller.awaitCompletion(any()))
        .thenReturn(job(JobStatus.SUCCEEDED).output("https://out.test/0.png").build());

    PlacementResult result =
        orchestrator.generate(request(solidDesign).outputFolder("hill_climb_results").build());

    verify(storage, times(5))
        .upload(
            any(), anyString(), eq(USER), eq(GenerationOrchestrator.DEBUG_FOLDER), eq("image/png"));
    verify(storage).uploadPng(any(), eq(USER), eq("hill_climb_results"));
    assertEquals(1, result.getImageUrls().size());
  }

  @Test
  void endpointOverrideIsPassedToSubmission() {
    when(poller.awaitCompletion(any()))
        .thenReturn(job(JobStatus.SUCCEEDED).output("https://out.test/0.png").build());

    orchestrator.generate(
        request(solidDesign).endpointOverride("https://direct.test/predict").build());

    verify(client).submit(eq("v-kontext"), anyMap(), eq("https://direct.test/predict"));
  }

  // ------------------ Pure helpers ------------------

  @Test
  void effectiveScale_clampsUserSliderAndMultipliesFactors() {
    RenderSettings settings =
        RenderSettings.builder()
            .tattooScale(5.0)
            .globalScaleUp(1.1)
            .fillSizeBias(0.9)
            .adaptiveScaleEnabled(false)
            .build();

    double scale =
        GenerationOrchestrator.effectiveScale(
            settings, ScaleDecision.of(true, false, 1.5), EngineId.FILL);

    assertEquals(3.0 * 1.1 * 0.9, scale, 1e-9);
  }

  @Test
  void effectiveScale_appliesAdaptiveScaleWhenEnabled() {
    RenderSettings settings = RenderSettings.builder().tattooScale(0.01).build();

    double scale =
        GenerationOrchestrator.effectiveScale(
            settings, ScaleDecision.of(true, false, 1.5), EngineId.KONTEXT);

    assertEquals(0.1 * 1.5, scale, 1e-9);
  }

  @Test
  void maskGrowRadius_boundsByMinAndMax() {
    BoundingBox box = BoundingBox.of(0, 0, 99, 49);

    assertEquals(4, GenerationOrchestrator.maskGrowRadius(RenderSettings.builder().build(), box));
    RenderSettings wide = RenderSettings.builder().maskGrowPct(0.5).build();
    assertEquals(32, GenerationOrchestrator.maskGrowRadius(wide, box));
    assertEquals(
        10,
        GenerationOrchestrator.maskGrowRadius(
            RenderSettings.builder().maskGrowPct(0.0).maskGrowMin(10).maskGrowMax(2).build(), box));
  }

  private PlacementResult generateSolid() {
    return orchestrator.generate(request(solidDesign).build());
  }

  private PlacementRequest.PlacementRequestBuilder request(byte[] design) {
    return PlacementRequest.builder().skinImage(skin).tattooDesign(design).mask(mask).userId(USER);
  }

  private static GenerationJob.GenerationJobBuilder job(JobStatus status) {
    return GenerationJob.builder()
        .id("job-1")
        .status(status)
        .rawStatus(status.name().toLowerCase(Locale.ROOT));
  }
}
