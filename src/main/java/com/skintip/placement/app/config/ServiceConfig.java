package com.skintip.placement.app.config;

import com.skintip.placement.app.experiment.ExperimentTableCodec;
import com.skintip.placement.app.experiment.HillClimbHarness;
import com.skintip.placement.app.experiment.HillClimbVariationService;
import com.skintip.placement.app.service.BackgroundRemovalService;
import com.skintip.placement.app.service.GenerationOrchestrator;
import com.skintip.placement.app.service.ImageDownloadService;
import com.skintip.placement.app.service.ImageGenerationClient;
import com.skintip.placement.app.service.ImageStorageService;
import com.skintip.placement.app.service.JobPoller;
import com.skintip.placement.app.service.Sleeper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import software.amazon.awssdk.services.s3.S3Client;

@Configuration
@EnableConfigurationProperties({
  GenerationProperties.class,
  BackgroundRemovalProperties.class,
  StorageProperties.class,
  HillClimbProperties.class,
  PlacementDefaults.class
})
public class ServiceConfig {

  // -------------------
  // External collaborators
  // -------------------

  @Bean
  public ImageStorageService imageStorageService(S3Client s3Client, StorageProperties props) {
    return new ImageStorageService(s3Client, props);
  }

  @Bean
  public ImageGenerationClient imageGenerationClient(
      WebClient.Builder builder, GenerationProperties props) {
    return new ImageGenerationClient(builder, props);
  }

  @Bean
  public BackgroundRemovalService backgroundRemovalService(
      WebClient.Builder builder, BackgroundRemovalProperties props) {
    return new BackgroundRemovalService(builder, props);
  }

  @Bean
  public ImageDownloadService imageDownloadService(WebClient.Builder builder) {
    return new ImageDownloadService(builder);
  }

  // -------------------
  // Core Services
  // -------------------

  @Bean
  public JobPoller jobPoller(ImageGenerationClient client, GenerationProperties props) {
    return new JobPoller(
        client, Sleeper.SYSTEM, props.getPollInterval(), props.getMaxPollAttempts());
  }

  @Bean
  public GenerationOrchestrator generationOrchestrator(
      BackgroundRemovalService backgroundRemoval,
      ImageGenerationClient generationClient,
      JobPoller jobPoller,
      ImageDownloadService downloads,
      ImageStorageService storage,
      GenerationProperties props) {
    return new GenerationOrchestrator(
        backgroundRemoval, generationClient, jobPoller, downloads, storage, props);
  }

  @Bean
  public ExperimentTableCodec experimentTableCodec() {
    return new ExperimentTableCodec();
  }

  @Bean
  public HillClimbHarness hillClimbHarness(
      ExperimentTableCodec codec,
      GenerationOrchestrator orchestrator,
      GenerationProperties generationProps,
      HillClimbProperties hillClimbProps) {
    return new HillClimbHarness(codec, orchestrator, generationProps, hillClimbProps);
  }

  @Bean
  public HillClimbVariationService hillClimbVariationService(
      ExperimentTableCodec codec,
      GenerationOrchestrator orchestrator,
      HillClimbProperties hillClimbProps) {
    return new HillClimbVariationService(codec, orchestrator, hillClimbProps);
  }
}
