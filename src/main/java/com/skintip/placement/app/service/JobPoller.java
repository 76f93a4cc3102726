package com.skintip.placement.app.service;

import com.skintip.placement.app.analysis.ScalePolicy;
import com.skintip.placement.app.exception.ExternalServiceException;
import com.skintip.placement.app.model.GenerationJob;
import com.skintip.placement.app.model.JobStatus;
import java.time.Duration;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Drives a submitted job through {@code starting -> processing -> succeeded|failed|canceled}.
 *
 * <p>Each iteration sleeps for the fixed interval and then performs one poll, up to {@code
 * maxAttempts} polls. The loop never throws for an exhausted budget or a failing poll request:
 * it returns the last known job with {@link GenerationJob#getStopReason()} set, and the caller
 * decides whether the outputs it holds are enough.
 */
@Log4j2
public class JobPoller {

  public static final int MAX_ATTEMPTS_CEILING = 1000;

  private final ImageGenerationClient client;
  private final Sleeper sleeper;
  private final Duration interval;
  private final int maxAttempts;

  public JobPoller(
      ImageGenerationClient client, Sleeper sleeper, Duration interval, int maxAttempts) {
    this.client = Objects.requireNonNull(client, "client must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.interval = interval == null ? Duration.ofSeconds(2) : interval;
    this.maxAttempts = ScalePolicy.clamp(maxAttempts, 1, MAX_ATTEMPTS_CEILING);
  }

  public GenerationJob awaitCompletion(GenerationJob submitted) {
    GenerationJob job = submitted;
    if (job.isTerminal()) {
      log.info("generation.poll.skip jobId={} status={}", job.getId(), job.getStatus());
      return job;
    }

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        sleeper.sleep(interval);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("generation.poll.interrupted jobId={} attempt={}", job.getId(), attempt);
        return job.toBuilder().attempts(attempt - 1).stopReason("polling interrupted").build();
      }

      GenerationJob polled;
      try {
        polled = client.fetch(job.getId());
      } catch (ExternalServiceException e) {
        log.warn(
            "generation.poll.error jobId={} attempt={} msg={}",
            job.getId(),
            attempt,
            e.getMessage());
        return job.toBuilder()
            .attempts(attempt)
            .stopReason("poll error: " + e.getMessage())
            .build();
      }

      job = polled.toBuilder().id(job.getId()).attempts(attempt).build();
      log.debug(
          "generation.poll jobId={} attempt={} status={}",
          job.getId(),
          attempt,
          job.getRawStatus());

      if (job.getStatus() == JobStatus.UNKNOWN) {
        log.warn(
            "generation.poll.unknownStatus jobId={} status={} attempt={}",
            job.getId(),
            job.getRawStatus(),
            attempt);
      }
      if (job.isTerminal()) {
        log.info(
            "generation.poll.done jobId={} status={} attempts={} outputs={}",
            job.getId(),
            job.getStatus(),
            attempt,
            job.getOutputs().size());
        return job;
      }
    }

    log.warn("generation.poll.exhausted jobId={} attempts={}", job.getId(), maxAttempts);
    return job.toBuilder().stopReason("attempt budget of " + maxAttempts + " exhausted").build();
  }

  int getMaxAttempts() {
    return maxAttempts;
  }
}
