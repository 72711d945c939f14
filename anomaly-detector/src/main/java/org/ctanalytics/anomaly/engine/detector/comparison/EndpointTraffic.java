package org.ctanalytics.anomaly.engine.detector.comparison;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/** Aggregated traffic of one endpoint over a comparison window. Durations in milliseconds. */
@SuperBuilder
@Getter
@ToString
public class EndpointTraffic {
  private final String endpoint;
  private final long callCount;
  private final double avgDurationMs;
  private final double p90DurationMs;
  private final double p95DurationMs;
}
