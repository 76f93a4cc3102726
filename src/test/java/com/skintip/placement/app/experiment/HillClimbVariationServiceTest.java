package com.skintip.placement.app.experiment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.skintip.placement.app.config.GenerationProperties;
import com.skintip.placement.app.config.HillClimbProperties;
import com.skintip.placement.app.exception.GenerationExhaustedException;
import com.skintip.placement.app.exception.PlacementValidationException;
import com.skintip.placement.app.model.EngineId;
import com.skintip.placement.app.model.ExperimentRow;
import com.skintip.placement.app.model.ExperimentRun;
import com.skintip.placement.app.model.PlacementInputs;
import com.skintip.placement.app.model.PlacementResult;
import com.skintip.placement.app.model.RenderSettings;
import com.skintip.placement.app.service.GenerationOrchestrator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HillClimbVariationServiceTest {

  @Mock private GenerationOrchestrator orchestrator;

  private final ExperimentTableCodec codec = new ExperimentTableCodec();
  private final RenderSettings base = RenderSettings.builder().build();
  private HillClimbProperties props;
  private HillClimbVariationService service;

  @BeforeEach
  void setUp() {
    props = new HillClimbProperties();
    service = new HillClimbVariationService(codec, orchestrator, props);
  }

  @Test
  void groupsListTheirParametersInVisitingOrder() {
    assertEquals(
        List.of(HillClimbVariationService.GROUP_BLEND, HillClimbVariationService.GROUP_SIZING),
        HillClimbVariationService.groupNames());
    assertEquals(
        List.of(
            ExperimentColumns.GLOBAL_SCALE_UP,
            ExperimentColumns.KONTEXT_SIZE_BIAS,
            ExperimentColumns.FILL_SIZE_BIAS),
        HillClimbVariationService.parametersOf(HillClimbVariationService.GROUP_SIZING));
  }

  @Test
  void plan_nudgesOneParameterUpAndDown() {
    List<HillClimbVariationService.Variation> plan =
        service.plan(base, HillClimbVariationService.GROUP_BLEND, 0);

    assertEquals(3, plan.size());
    assertEquals("no change", plan.get(0).getLabel());
    assertEquals("bake_tattoo_brightness +", plan.get(1).getLabel());
    assertEquals("bake_tattoo_brightness -", plan.get(2).getLabel());
    assertEquals(base, plan.get(0).getSettings());
    assertEquals(1.05, plan.get(1).getSettings().getBakeBrightness(), 1e-12);
    assertEquals(0.95, plan.get(2).getSettings().getBakeBrightness(), 1e-12);
    assertEquals(base.getBakeGamma(), plan.get(1).getSettings().getBakeGamma(), 1e-12);
    assertEquals(1.0, base.getBakeBrightness(), 1e-12);
  }

  @Test
  void plan_usesSmallerStepForMultiplyAndEngineBiases() {
    List<HillClimbVariationService.Variation> blend =
        service.plan(base, HillClimbVariationService.GROUP_BLEND, 4);
    List<HillClimbVariationService.Variation> sizing =
        service.plan(base, HillClimbVariationService.GROUP_SIZING, 2);

    assertEquals(0.12, blend.get(1).getSettings().getMultiplyOpacity(), 1e-12);
    assertEquals(0.08, blend.get(2).getSettings().getMultiplyOpacity(), 1e-12);
    assertEquals(1.02, sizing.get(1).getSettings().getFillSizeBias(), 1e-12);
    assertEquals(0.98, sizing.get(2).getSettings().getFillSizeBias(), 1e-12);
  }

  @Test
  void plan_rejectsUnknownGroupOrIndex() {
    assertThrows(PlacementValidationException.class, () -> service.plan(base, "Colour", 0));
    assertThrows(PlacementValidationException.class, () -> service.plan(base, null, 0));
    assertThrows(
        PlacementValidationException.class,
        () -> service.plan(base, HillClimbVariationService.GROUP_SIZING, 3));
    assertThrows(
        PlacementValidationException.class,
        () -> service.plan(base, HillClimbVariationService.GROUP_BLEND, -1));
  }

  @Test
  void toTable_isAValidStrictTriplet() {
    RenderSettings fill = base.toBuilder().engine(EngineId.FILL).build();
    List<HillClimbVariationService.Variation> plan =
        service.plan(fill, HillClimbVariationService.GROUP_SIZING, 0);

    String text = service.toTable("iter-4", plan);

    ExperimentTableCodec.ParsedTable table = codec.parse(text);
    List<String> headers = table.getHeaders();
    assertEquals(HillClimbVariationService.LABEL_COLUMN, headers.get(headers.size() - 1));
    ExperimentRow second = table.getRows().get(1);
    assertEquals("iter-4-2", second.getImageId());
    assertEquals("fill", second.getEngine());
    assertEquals("1.05", second.get(ExperimentColumns.GLOBAL_SCALE_UP));
    assertEquals("global_scale_up +", second.get(HillClimbVariationService.LABEL_COLUMN));

    props.setStrictTriplet(true);
    GenerationProperties noCredentials = new GenerationProperties();
    HillClimbHarness harness = new HillClimbHarness(codec, orchestrator, noCredentials, props);
    ExperimentRun run = harness.run(text, null);
    assertEquals(3, run.getResults().size());
    assertEquals("default", run.getEngineCallMode());
    assertEquals("N/A", run.getEngineSwitchReason());
  }

  @Test
  void advance_noChangeMovesToNextParameterAndWraps() {
    HillClimbVariationService.Step next =
        service.advance(base, base.toBuilder().build(), HillClimbVariationService.GROUP_SIZING, 1);
    HillClimbVariationService.Step wrapped =
        service.advance(base, null, HillClimbVariationService.GROUP_SIZING, 2);

    assertEquals(2, next.getIndex());
    assertEquals(ExperimentColumns.FILL_SIZE_BIAS, next.getParameter());
    assertSame(base, next.getBase());
    assertEquals(0, wrapped.getIndex());
    assertEquals(ExperimentColumns.GLOBAL_SCALE_UP, wrapped.getParameter());
  }

  @Test
  void advance_changedPickBecomesNewBase() {
    RenderSettings picked = base.toBuilder().globalScaleUp(1.05).build();

    HillClimbVariationService.Step step =
        service.advance(base, picked, HillClimbVariationService.GROUP_SIZING, 0);

    assertSame(picked, step.getBase());
    assertEquals(0, step.getIndex());
    assertEquals(HillClimbVariationService.GROUP_SIZING, step.getGroup());
  }

  @Test
  void generate_reportsFailuresPerCandidate() {
    when(orchestrator.generate(any()))
        .thenReturn(result("https://cdn.test/1.png"))
        .thenThrow(new GenerationExhaustedException("job-2", 60, "attempt budget of 60 exhausted"))
        .thenReturn(result("https://cdn.test/3.png"));
    PlacementInputs inputs =
        PlacementInputs.builder()
            .skinImage(new byte[] {1})
            .tattooDesign(new byte[] {2})
            .mask(new byte[] {3})
            .build();

    List<HillClimbVariationService.VariationResult> results =
        service.generate(base, HillClimbVariationService.GROUP_BLEND, 1, inputs);

    verify(orchestrator, times(3)).generate(any());
    assertEquals(3, results.size());
    assertEquals("https://cdn.test/1.png", results.get(0).getImageUrl());
    assertNull(results.get(1).getImageUrl());
    assertEquals("bake_tattoo_gamma +", results.get(1).getLabel());
    assertEquals(
        "No output images collected for job job-2 after 60 polls: attempt budget of 60 exhausted",
        results.get(1).getError());
    assertEquals("https://cdn.test/3.png", results.get(2).getImageUrl());
  }

  private static PlacementResult result(String url) {
    return PlacementResult.builder()
        .jobId("job")
        .engine(EngineId.KONTEXT)
        .requestedEngine(EngineId.KONTEXT)
        .imageUrls(List.of(url))
        .build();
  }
}
