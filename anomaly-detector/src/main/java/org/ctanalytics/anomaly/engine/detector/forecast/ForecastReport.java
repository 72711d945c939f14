package org.ctanalytics.anomaly.engine.detector.forecast;

import java.util.List;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@Getter
@ToString
public class ForecastReport {
  private final String source;
  private final List<FeatureForecast> forecasts;
  private final List<ExhaustionAlert> alerts;
}
