package com.skintip.placement.app.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "removebg")
public class BackgroundRemovalProperties {
  private String apiUrl = "https://api.remove.bg/v1.0/removebg";

  /** Without a key the design is only normalized, never sent out. */
  private String apiKey;

  private Duration timeout = Duration.ofSeconds(20);
  private String size = "auto";
  private String format = "png";
}
