package com.skintip.placement.app.model;

import lombok.Builder;
import lombok.Data;

/** Everything the orchestrator needs for one generation job. */
@Data
@Builder
public class PlacementRequest {
  private byte[] skinImage;
  private byte[] tattooDesign;
  private byte[] mask;

  /** Storage namespace for debug inputs and finished outputs. */
  private String userId;

  @Builder.Default private int variationCount = 1;

  @Builder.Default private RenderSettings settings = RenderSettings.builder().build();

  /** Sub-folder under {@code userId} for finished outputs, e.g. {@code generated}. */
  private String outputFolder;

  /** Absolute submission URL that replaces the configured API endpoint, or {@code null}. */
  private String endpointOverride;
}
