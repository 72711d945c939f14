package org.ctanalytics.anomaly.engine.datamodel;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** Association measures of one feature pair. Undefined coefficients are reported as 0. */
@SuperBuilder
@Getter
@ToString
public class Correlation {
  private final double pearson;
  private final double spearman;
  private final double mutualInformation;

  /** True when every measure is below the threshold in absolute value. */
  public boolean isNegligible(double threshold) {
    return Math.abs(pearson) < threshold
        && Math.abs(spearman) < threshold
        && Math.abs(mutualInformation) < threshold;
  }
}
