package com.skintip.placement.app.exception;

/**
 * A generation job produced no usable output: polling ran out of attempts, was cut short by a
 * transport error, or the job succeeded with an empty output list.
 */
public class GenerationExhaustedException extends PlacementException {

  private final String jobId;
  private final int attempts;

  public GenerationExhaustedException(String jobId, int attempts, String reason) {
    super(
        "No output images collected for job "
            + jobId
            + " after "
            + attempts
            + " polls: "
            + reason);
    this.jobId = jobId;
    this.attempts = attempts;
  }

  public String getJobId() {
    return jobId;
  }

  public int getAttempts() {
    return attempts;
  }
}
