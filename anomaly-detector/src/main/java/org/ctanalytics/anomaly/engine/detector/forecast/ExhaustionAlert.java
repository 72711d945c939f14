package org.ctanalytics.anomaly.engine.detector.forecast;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** A configured resource limit that the projected trend is expected to cross. */
@SuperBuilder
@Getter
@ToString
public class ExhaustionAlert {
  private final String feature;
  private final double predictedPeak;
  private final double limit;
  private final String recommendedAction;
}
