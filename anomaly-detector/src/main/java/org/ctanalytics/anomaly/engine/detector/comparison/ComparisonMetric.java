package org.ctanalytics.anomaly.engine.detector.comparison;

import java.util.function.ToDoubleFunction;

public enum ComparisonMetric {
  CALL_COUNT(EndpointTraffic::getCallCount),
  AVG_DURATION(EndpointTraffic::getAvgDurationMs),
  P90_DURATION(EndpointTraffic::getP90DurationMs),
  P95_DURATION(EndpointTraffic::getP95DurationMs);

  private final ToDoubleFunction<EndpointTraffic> extractor;

  ComparisonMetric(ToDoubleFunction<EndpointTraffic> extractor) {
    this.extractor = extractor;
  }

  double valueOf(EndpointTraffic traffic) {
    return extractor.applyAsDouble(traffic);
  }
}
