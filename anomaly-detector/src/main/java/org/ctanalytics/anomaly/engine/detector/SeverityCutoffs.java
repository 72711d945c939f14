package org.ctanalytics.anomaly.engine.detector;

import com.typesafe.config.Config;
import org.ctanalytics.anomaly.engine.datamodel.Severity;
import org.ctanalytics.anomaly.engine.datamodel.exception.InvalidWeightConfigException;

/** Confidence lower bounds per severity. Bounds are inclusive and must strictly descend. */
public class SeverityCutoffs {
  private static final String CRITICAL = "critical";
  private static final String HIGH = "high";
  private static final String MEDIUM = "medium";
  private static final String LOW = "low";

  private static final double DEFAULT_CRITICAL = 0.9;
  private static final double DEFAULT_HIGH = 0.8;
  private static final double DEFAULT_MEDIUM = 0.7;
  private static final double DEFAULT_LOW = 0.0;

  private final double critical;
  private final double high;
  private final double medium;
  private final double low;

  public SeverityCutoffs(double critical, double high, double medium, double low) {
    if (!(critical > high && high > medium && medium > low)) {
      throw new InvalidWeightConfigException(
          String.format(
              "Severity cutoffs must be descending, got critical=%s high=%s medium=%s low=%s",
              critical, high, medium, low));
    }
    this.critical = critical;
    this.high = high;
    this.medium = medium;
    this.low = low;
  }

  static SeverityCutoffs from(Config cutoffsConfig) {
    return new SeverityCutoffs(
        cutoffsConfig.hasPath(CRITICAL) ? cutoffsConfig.getDouble(CRITICAL) : DEFAULT_CRITICAL,
        cutoffsConfig.hasPath(HIGH) ? cutoffsConfig.getDouble(HIGH) : DEFAULT_HIGH,
        cutoffsConfig.hasPath(MEDIUM) ? cutoffsConfig.getDouble(MEDIUM) : DEFAULT_MEDIUM,
        cutoffsConfig.hasPath(LOW) ? cutoffsConfig.getDouble(LOW) : DEFAULT_LOW);
  }

  static SeverityCutoffs defaults() {
    return new SeverityCutoffs(DEFAULT_CRITICAL, DEFAULT_HIGH, DEFAULT_MEDIUM, DEFAULT_LOW);
  }

  public Severity classify(double confidence) {
    if (confidence >= critical) {
      return Severity.CRITICAL;
    }
    if (confidence >= high) {
      return Severity.HIGH;
    }
    if (confidence >= medium) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  public double getLow() {
    return low;
  }
}
