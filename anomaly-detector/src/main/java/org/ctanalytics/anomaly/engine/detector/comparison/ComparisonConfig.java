package org.ctanalytics.anomaly.engine.detector.comparison;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.ctanalytics.anomaly.engine.detector.DetectorConfig;

public class ComparisonConfig {
  private static final String COMPARISON_CONFIG = "comparison";
  private static final String CALL_COUNT_VARIANCE_PCT = "call.count.variance.pct";
  private static final String DURATION_VARIANCE_PCT = "duration.variance.pct";
  private static final String P95_VARIANCE_PCT = "p95.variance.pct";
  private static final String MIN_LOAD_RATIO = "min.load.ratio";

  private static final double DEFAULT_CALL_COUNT_VARIANCE_PCT = 30.0;
  private static final double DEFAULT_DURATION_VARIANCE_PCT = 20.0;
  private static final double DEFAULT_P95_VARIANCE_PCT = 25.0;
  private static final double DEFAULT_MIN_LOAD_RATIO = 0.7;

  private final double callCountVariancePct;
  private final double durationVariancePct;
  private final double p95VariancePct;
  private final double minLoadRatio;

  public static ComparisonConfig from(Config appConfig) {
    String path = DetectorConfig.ENGINE_CONFIG + "." + COMPARISON_CONFIG;
    return new ComparisonConfig(
        appConfig.hasPath(path) ? appConfig.getConfig(path) : ConfigFactory.empty());
  }

  private ComparisonConfig(Config comparisonConfig) {
    this.callCountVariancePct =
        comparisonConfig.hasPath(CALL_COUNT_VARIANCE_PCT)
            ? comparisonConfig.getDouble(CALL_COUNT_VARIANCE_PCT)
            : DEFAULT_CALL_COUNT_VARIANCE_PCT;
    this.durationVariancePct =
        comparisonConfig.hasPath(DURATION_VARIANCE_PCT)
            ? comparisonConfig.getDouble(DURATION_VARIANCE_PCT)
            : DEFAULT_DURATION_VARIANCE_PCT;
    this.p95VariancePct =
        comparisonConfig.hasPath(P95_VARIANCE_PCT)
            ? comparisonConfig.getDouble(P95_VARIANCE_PCT)
            : DEFAULT_P95_VARIANCE_PCT;
    this.minLoadRatio =
        comparisonConfig.hasPath(MIN_LOAD_RATIO)
            ? comparisonConfig.getDouble(MIN_LOAD_RATIO)
            : DEFAULT_MIN_LOAD_RATIO;
  }

  public double variancePct(ComparisonMetric metric) {
    switch (metric) {
      case CALL_COUNT:
        return callCountVariancePct;
      case P95_DURATION:
        return p95VariancePct;
      default:
        return durationVariancePct;
    }
  }

  public double getMinLoadRatio() {
    return minLoadRatio;
  }
}
