package org.ctanalytics.anomaly.engine.detector.comparison;

public enum ComparisonStatus {
  PASS,
  FAIL
}
