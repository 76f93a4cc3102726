package com.skintip.placement.app.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Snapshot of one generation job as seen by the poller. Owned by a single orchestrator call and
 * replaced (never mutated) on every poll.
 */
@Value
@Builder(toBuilder = true)
public class GenerationJob {

  /** Identifier assigned by the generation API on submission. */
  String id;

  JobStatus status;

  /** Status string exactly as received, kept for diagnostics of {@link JobStatus#UNKNOWN}. */
  String rawStatus;

  /** Output image URLs; only populated once {@code status} is {@link JobStatus#SUCCEEDED}. */
  @Singular List<String> outputs;

  /** Number of polls performed so far. */
  int attempts;

  String error;
  String logs;

  /** Why polling stopped before a terminal status (budget exhausted, transport error). */
  String stopReason;

  public boolean isTerminal() {
    return status != null && status.isTerminal();
  }
}
