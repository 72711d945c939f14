package org.ctanalytics.anomaly.engine.detector;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.EnumMap;
import java.util.Map;
import org.ctanalytics.anomaly.engine.datamodel.ScorerType;

/** Detector settings read from the {@code anomaly.engine} block, with built-in defaults. */
public class DetectorConfig {
  public static final String ENGINE_CONFIG = "anomaly.engine";

  private static final String FEATURE_LENIENT = "feature.lenient";
  private static final String FEATURE_CYCLICAL_TIME = "feature.cyclical.time";
  private static final String BASELINE_WINDOW_SIZE = "baseline.window.size";
  private static final String TRAINING_MIN_HISTORY = "training.min.history";
  private static final String ENSEMBLE_WEIGHTS = "ensemble.weights";
  private static final String ENSEMBLE_VOTE_THRESHOLD = "ensemble.vote.threshold";
  private static final String ENSEMBLE_SEED = "ensemble.seed";
  private static final String SEVERITY_CUTOFFS = "severity.cutoffs";
  private static final String ISOLATION_TREES = "isolation.trees";
  private static final String ISOLATION_SAMPLE_SIZE = "isolation.sample.size";
  private static final String ISOLATION_CONTAMINATION = "isolation.contamination";
  private static final String RECONSTRUCTION_WINDOW_LENGTH = "reconstruction.window.length";
  private static final String RECONSTRUCTION_LATENT_RATIO = "reconstruction.latent.ratio";
  private static final String RECONSTRUCTION_VALIDATION_FRACTION =
      "reconstruction.validation.fraction";
  private static final String RECONSTRUCTION_THRESHOLD = "reconstruction.threshold";
  private static final String STATISTICAL_ZSCORE_THRESHOLD = "statistical.zscore.threshold";

  private static final int DEFAULT_BASELINE_WINDOW_SIZE = 20;
  private static final int DEFAULT_TRAINING_MIN_HISTORY = 20;
  private static final double DEFAULT_VOTE_THRESHOLD = 0.7;
  private static final long DEFAULT_SEED = 42L;
  private static final int DEFAULT_ISOLATION_TREES = 100;
  private static final int DEFAULT_ISOLATION_SAMPLE_SIZE = 256;
  private static final double DEFAULT_ISOLATION_CONTAMINATION = 0.1;
  private static final int DEFAULT_RECONSTRUCTION_WINDOW_LENGTH = 5;
  private static final double DEFAULT_RECONSTRUCTION_LATENT_RATIO = 0.25;
  private static final double DEFAULT_RECONSTRUCTION_VALIDATION_FRACTION = 0.2;
  private static final double DEFAULT_RECONSTRUCTION_THRESHOLD = 1.0;
  private static final double DEFAULT_ZSCORE_THRESHOLD = 3.0;

  private static final Map<ScorerType, Double> DEFAULT_WEIGHTS =
      Map.of(
          ScorerType.ISOLATION, 0.35,
          ScorerType.RECONSTRUCTION, 0.35,
          ScorerType.STATISTICAL, 0.30);

  private final boolean lenientFeatures;
  private final boolean cyclicalTimeFeatures;
  private final int baselineWindowSize;
  private final int minTrainingHistory;
  private final Map<ScorerType, Double> weights;
  private final double voteThreshold;
  private final long seed;
  private final SeverityCutoffs severityCutoffs;
  private final int isolationTrees;
  private final int isolationSampleSize;
  private final double isolationContamination;
  private final int reconstructionWindowLength;
  private final double reconstructionLatentRatio;
  private final double reconstructionValidationFraction;
  private final double reconstructionThreshold;
  private final double zScoreThreshold;

  public static DetectorConfig from(Config appConfig) {
    return new DetectorConfig(
        appConfig.hasPath(ENGINE_CONFIG)
            ? appConfig.getConfig(ENGINE_CONFIG)
            : ConfigFactory.empty());
  }

  public static DetectorConfig defaults() {
    return new DetectorConfig(ConfigFactory.empty());
  }

  private DetectorConfig(Config engineConfig) {
    this.lenientFeatures =
        engineConfig.hasPath(FEATURE_LENIENT) && engineConfig.getBoolean(FEATURE_LENIENT);
    this.cyclicalTimeFeatures =
        engineConfig.hasPath(FEATURE_CYCLICAL_TIME)
            && engineConfig.getBoolean(FEATURE_CYCLICAL_TIME);
    this.baselineWindowSize =
        engineConfig.hasPath(BASELINE_WINDOW_SIZE)
            ? engineConfig.getInt(BASELINE_WINDOW_SIZE)
            : DEFAULT_BASELINE_WINDOW_SIZE;
    this.minTrainingHistory =
        engineConfig.hasPath(TRAINING_MIN_HISTORY)
            ? engineConfig.getInt(TRAINING_MIN_HISTORY)
            : DEFAULT_TRAINING_MIN_HISTORY;
    this.weights = readWeights(engineConfig);
    this.voteThreshold =
        engineConfig.hasPath(ENSEMBLE_VOTE_THRESHOLD)
            ? engineConfig.getDouble(ENSEMBLE_VOTE_THRESHOLD)
            : DEFAULT_VOTE_THRESHOLD;
    this.seed =
        engineConfig.hasPath(ENSEMBLE_SEED) ? engineConfig.getLong(ENSEMBLE_SEED) : DEFAULT_SEED;
    this.severityCutoffs =
        engineConfig.hasPath(SEVERITY_CUTOFFS)
            ? SeverityCutoffs.from(engineConfig.getConfig(SEVERITY_CUTOFFS))
            : SeverityCutoffs.defaults();
    this.isolationTrees =
        engineConfig.hasPath(ISOLATION_TREES)
            ? engineConfig.getInt(ISOLATION_TREES)
            : DEFAULT_ISOLATION_TREES;
    this.isolationSampleSize =
        engineConfig.hasPath(ISOLATION_SAMPLE_SIZE)
            ? engineConfig.getInt(ISOLATION_SAMPLE_SIZE)
            : DEFAULT_ISOLATION_SAMPLE_SIZE;
    this.isolationContamination =
        engineConfig.hasPath(ISOLATION_CONTAMINATION)
            ? engineConfig.getDouble(ISOLATION_CONTAMINATION)
            : DEFAULT_ISOLATION_CONTAMINATION;
    this.reconstructionWindowLength =
        engineConfig.hasPath(RECONSTRUCTION_WINDOW_LENGTH)
            ? engineConfig.getInt(RECONSTRUCTION_WINDOW_LENGTH)
            : DEFAULT_RECONSTRUCTION_WINDOW_LENGTH;
    this.reconstructionLatentRatio =
        engineConfig.hasPath(RECONSTRUCTION_LATENT_RATIO)
            ? engineConfig.getDouble(RECONSTRUCTION_LATENT_RATIO)
            : DEFAULT_RECONSTRUCTION_LATENT_RATIO;
    this.reconstructionValidationFraction =
        engineConfig.hasPath(RECONSTRUCTION_VALIDATION_FRACTION)
            ? engineConfig.getDouble(RECONSTRUCTION_VALIDATION_FRACTION)
            : DEFAULT_RECONSTRUCTION_VALIDATION_FRACTION;
    this.reconstructionThreshold =
        engineConfig.hasPath(RECONSTRUCTION_THRESHOLD)
            ? engineConfig.getDouble(RECONSTRUCTION_THRESHOLD)
            : DEFAULT_RECONSTRUCTION_THRESHOLD;
    this.zScoreThreshold =
        engineConfig.hasPath(STATISTICAL_ZSCORE_THRESHOLD)
            ? engineConfig.getDouble(STATISTICAL_ZSCORE_THRESHOLD)
            : DEFAULT_ZSCORE_THRESHOLD;
  }

  private static Map<ScorerType, Double> readWeights(Config engineConfig) {
    Map<ScorerType, Double> weights = new EnumMap<>(ScorerType.class);
    for (ScorerType type : ScorerType.values()) {
      String path = ENSEMBLE_WEIGHTS + "." + type.wireName();
      weights.put(
          type,
          engineConfig.hasPath(path) ? engineConfig.getDouble(path) : DEFAULT_WEIGHTS.get(type));
    }
    return weights;
  }

  public boolean isLenientFeatures() {
    return lenientFeatures;
  }

  public boolean isCyclicalTimeFeatures() {
    return cyclicalTimeFeatures;
  }

  public int getBaselineWindowSize() {
    return baselineWindowSize;
  }

  public int getMinTrainingHistory() {
    return minTrainingHistory;
  }

  public Map<ScorerType, Double> getWeights() {
    return weights;
  }

  public double getVoteThreshold() {
    return voteThreshold;
  }

  public long getSeed() {
    return seed;
  }

  public SeverityCutoffs getSeverityCutoffs() {
    return severityCutoffs;
  }

  public int getIsolationTrees() {
    return isolationTrees;
  }

  public int getIsolationSampleSize() {
    return isolationSampleSize;
  }

  public double getIsolationContamination() {
    return isolationContamination;
  }

  public int getReconstructionWindowLength() {
    return reconstructionWindowLength;
  }

  public double getReconstructionLatentRatio() {
    return reconstructionLatentRatio;
  }

  public double getReconstructionValidationFraction() {
    return reconstructionValidationFraction;
  }

  public double getReconstructionThreshold() {
    return reconstructionThreshold;
  }

  public double getZScoreThreshold() {
    return zScoreThreshold;
  }
}
