package com.skintip.placement.app.config;

import com.skintip.placement.app.model.RenderSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/** Render settings applied when an API caller does not send its own. */
@Data
@ConfigurationProperties(prefix = "placement")
public class PlacementDefaults {

  @NestedConfigurationProperty
  private RenderSettings defaults = RenderSettings.builder().build();

  private int maxVariations = 4;
}
