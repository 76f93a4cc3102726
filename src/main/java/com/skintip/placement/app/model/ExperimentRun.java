package com.skintip.placement.app.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Ordered results of one hill-climb batch, one entry per processed row in file order. */
@Value
@Builder
public class ExperimentRun {
  @Singular List<ExperimentResult> results;
  String engineCallMode;
  String engineSwitchReason;
}
