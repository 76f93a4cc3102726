package com.skintip.placement.app.config;

import com.skintip.placement.app.model.EngineId;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Settings of the external generative-image API and of the polling loop. */
@Data
@ConfigurationProperties(prefix = "generation")
public class GenerationProperties {

  /** Base URL of the prediction API. */
  private String apiBaseUrl = "https://api.replicate.com/v1";

  /** Bearer token; blank means "no credentials" and puts the hill-climb harness in stub mode. */
  private String apiToken;

  /** Model version per engine. */
  private Map<EngineId, String> engineVersions = new EnumMap<>(EngineId.class);

  private Duration pollInterval = Duration.ofSeconds(2);
  private int maxPollAttempts = 60;
  private Duration requestTimeout = Duration.ofSeconds(90);
  private Duration pollTimeout = Duration.ofSeconds(15);

  private double guidanceScale = 8.0;
  private int safetyTolerance = 2;

  private String prompt =
      "Blend the tattoo naturally into the skin, following skin texture, lighting and curvature."
          + " Keep the design's linework intact.";
  private String negativePrompt = "sticker, flat overlay, blurry, distorted linework";

  /** Folder for finished images under the user's namespace. */
  private String outputFolder = "generated";

  /** Upload the normalized inputs under {@code <userId>/debug_inputs} before submitting. */
  private boolean debugUploads = false;

  private boolean watermarkEnabled = true;

  public boolean hasCredentials() {
    return apiToken != null && !apiToken.isBlank();
  }

  public String versionFor(EngineId engine) {
    String v = engineVersions.get(engine);
    return v == null || v.isBlank() ? engine.id() : v;
  }
}
