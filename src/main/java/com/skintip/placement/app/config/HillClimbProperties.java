package com.skintip.placement.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;

@Data
@ConfigurationProperties(prefix = "hill-climb")
public class HillClimbProperties {

  /** Require exactly three candidate rows per table (the A/B/C comparison screen). */
  private boolean strictTriplet = false;

  /** Storage namespace results of table-driven batches are written under. */
  private String userId = "hill-climb";

  private String resultsFolder = "hill_climb_results";

  private Resource skinImage;
  private Resource tattooDesign;
  private Resource mask;
}
