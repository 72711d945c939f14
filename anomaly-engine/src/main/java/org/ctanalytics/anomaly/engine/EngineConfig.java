package org.ctanalytics.anomaly.engine;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.List;
import org.ctanalytics.anomaly.engine.datamodel.FeatureSchema;
import org.ctanalytics.anomaly.engine.detector.DetectorConfig;
import org.ctanalytics.anomaly.engine.detector.EnsembleDetector;
import org.ctanalytics.anomaly.engine.detector.comparison.ComparisonConfig;
import org.ctanalytics.anomaly.engine.detector.forecast.ForecastConfig;
import org.ctanalytics.anomaly.engine.narrative.NarrativeConfig;
import org.ctanalytics.anomaly.engine.rca.RcaConfig;

/**
 * Configuration of the whole engine, read once from the {@code anomaly.engine} block. Invalid
 * ensemble weights are rejected here so a misconfigured process never starts.
 */
public class EngineConfig {
  private static final String FEATURE_METRICS = "feature.metrics";
  private static final String RETRAIN_THREADS = "retrain.threads";
  private static final String NARRATIVE_THREADS = "narrative.threads";
  private static final int DEFAULT_RETRAIN_THREADS = 1;
  private static final int DEFAULT_NARRATIVE_THREADS = 2;

  private final FeatureSchema schema;
  private final DetectorConfig detectorConfig;
  private final RcaConfig rcaConfig;
  private final NarrativeConfig narrativeConfig;
  private final ForecastConfig forecastConfig;
  private final ComparisonConfig comparisonConfig;
  private final int trainingHistorySize;
  private final int retrainThreads;
  private final int narrativeThreads;

  public static EngineConfig from(Config appConfig) {
    return new EngineConfig(appConfig);
  }

  private EngineConfig(Config appConfig) {
    Config engineConfig =
        appConfig.hasPath(DetectorConfig.ENGINE_CONFIG)
            ? appConfig.getConfig(DetectorConfig.ENGINE_CONFIG)
            : ConfigFactory.empty();
    Preconditions.checkArgument(
        engineConfig.hasPath(FEATURE_METRICS),
        "%s.%s must list the metric features",
        DetectorConfig.ENGINE_CONFIG,
        FEATURE_METRICS);
    this.detectorConfig = DetectorConfig.from(appConfig);
    EnsembleDetector.checkWeights(detectorConfig);

    List<String> metrics = engineConfig.getStringList(FEATURE_METRICS);
    this.schema =
        detectorConfig.isCyclicalTimeFeatures()
            ? FeatureSchema.withCyclicalTime(metrics)
            : FeatureSchema.of(metrics);
    this.rcaConfig = RcaConfig.from(appConfig);
    this.narrativeConfig = NarrativeConfig.from(appConfig);
    this.forecastConfig = ForecastConfig.from(appConfig);
    this.comparisonConfig = ComparisonConfig.from(appConfig);
    this.trainingHistorySize =
        Math.max(
            detectorConfig.getBaselineWindowSize(),
            Math.max(
                detectorConfig.getMinTrainingHistory(), detectorConfig.getIsolationSampleSize()));
    this.retrainThreads =
        engineConfig.hasPath(RETRAIN_THREADS)
            ? engineConfig.getInt(RETRAIN_THREADS)
            : DEFAULT_RETRAIN_THREADS;
    this.narrativeThreads =
        engineConfig.hasPath(NARRATIVE_THREADS)
            ? engineConfig.getInt(NARRATIVE_THREADS)
            : DEFAULT_NARRATIVE_THREADS;
  }

  public FeatureSchema getSchema() {
    return schema;
  }

  public DetectorConfig getDetectorConfig() {
    return detectorConfig;
  }

  public RcaConfig getRcaConfig() {
    return rcaConfig;
  }

  public NarrativeConfig getNarrativeConfig() {
    return narrativeConfig;
  }

  public ForecastConfig getForecastConfig() {
    return forecastConfig;
  }

  public ComparisonConfig getComparisonConfig() {
    return comparisonConfig;
  }

  /**
   * Vectors kept per source for retraining. Never smaller than the scoring window or the minimum
   * training history, so a retrain on a warmed-up source always has enough data.
   */
  public int getTrainingHistorySize() {
    return trainingHistorySize;
  }

  public int getRetrainThreads() {
    return retrainThreads;
  }

  public int getNarrativeThreads() {
    return narrativeThreads;
  }
}
