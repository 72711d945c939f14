package org.ctanalytics.anomaly.engine.rca;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

public class RcaConfig {
  private static final String RCA_CONFIG = "anomaly.engine.rca";
  private static final String PRUNING_THRESHOLD = "correlation.pruning.threshold";
  private static final String MAX_LAG = "causal.max.lag";
  private static final String SIGNIFICANCE = "causal.significance";
  private static final String TOP_K = "attribution.top.k";
  private static final String TIMELINE_FACTORS = "timeline.factors";

  private static final double DEFAULT_PRUNING_THRESHOLD = 0.1;
  private static final int DEFAULT_MAX_LAG = 15;
  private static final double DEFAULT_SIGNIFICANCE = 0.05;
  private static final int DEFAULT_TOP_K = 3;
  private static final int DEFAULT_TIMELINE_FACTORS = 2;

  private final double pruningThreshold;
  private final int maxLag;
  private final double significance;
  private final int topK;
  private final int timelineFactors;

  public static RcaConfig from(Config appConfig) {
    return new RcaConfig(
        appConfig.hasPath(RCA_CONFIG) ? appConfig.getConfig(RCA_CONFIG) : ConfigFactory.empty());
  }

  public static RcaConfig defaults() {
    return new RcaConfig(ConfigFactory.empty());
  }

  private RcaConfig(Config rcaConfig) {
    this.pruningThreshold =
        rcaConfig.hasPath(PRUNING_THRESHOLD)
            ? rcaConfig.getDouble(PRUNING_THRESHOLD)
            : DEFAULT_PRUNING_THRESHOLD;
    this.maxLag = rcaConfig.hasPath(MAX_LAG) ? rcaConfig.getInt(MAX_LAG) : DEFAULT_MAX_LAG;
    this.significance =
        rcaConfig.hasPath(SIGNIFICANCE) ? rcaConfig.getDouble(SIGNIFICANCE) : DEFAULT_SIGNIFICANCE;
    this.topK = rcaConfig.hasPath(TOP_K) ? rcaConfig.getInt(TOP_K) : DEFAULT_TOP_K;
    this.timelineFactors =
        rcaConfig.hasPath(TIMELINE_FACTORS)
            ? rcaConfig.getInt(TIMELINE_FACTORS)
            : DEFAULT_TIMELINE_FACTORS;
  }

  public double getPruningThreshold() {
    return pruningThreshold;
  }

  public int getMaxLag() {
    return maxLag;
  }

  public double getSignificance() {
    return significance;
  }

  public int getTopK() {
    return topK;
  }

  public int getTimelineFactors() {
    return timelineFactors;
  }
}
