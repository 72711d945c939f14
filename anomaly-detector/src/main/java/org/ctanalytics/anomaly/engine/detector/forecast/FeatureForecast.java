package org.ctanalytics.anomaly.engine.detector.forecast;

import java.util.List;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@Getter
@ToString
public class FeatureForecast {
  private final String feature;
  private final List<Double> trendProjection;
  private final double smoothedLevel;
  private final double predictedPeak;
}
