package org.ctanalytics.anomaly.engine.detector.comparison;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.ctanalytics.anomaly.engine.datamodel.Severity;

@SuperBuilder
@Getter
@ToString
public class ComparisonResult {
  private final String endpoint;
  private final ComparisonMetric metric;
  private final double productionValue;
  private final double testValue;
  // relative to production, signed
  private final double differencePct;
  private final Severity severity;
  private final ComparisonStatus status;
}
