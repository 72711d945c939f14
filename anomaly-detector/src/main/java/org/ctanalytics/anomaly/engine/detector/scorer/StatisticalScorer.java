package org.ctanalytics.anomaly.engine.detector.scorer;

import java.util.List;
import java.util.Optional;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.ScorerType;
import org.ctanalytics.anomaly.engine.detector.DetectorConfig;
import org.ctanalytics.anomaly.engine.detector.baseline.BaselineStore;

/**
 * Largest absolute z-score over the metric features, measured against the live baseline. Derived
 * time features are never scored.
 */
public class StatisticalScorer implements AnomalyScorer {
  static final double MIN_STANDARD_DEVIATION = 1e-6;

  private final BaselineStore baselineStore;
  private final double threshold;

  public StatisticalScorer(DetectorConfig config, BaselineStore baselineStore) {
    this.baselineStore = baselineStore;
    this.threshold = config.getZScoreThreshold();
  }

  @Override
  public ScorerType type() {
    return ScorerType.STATISTICAL;
  }

  @Override
  public TrainedScorer train(List<FeatureVector> history) {
    return new TrainedStatisticalScorer();
  }

  /** Absolute z-score of one feature, with the standard deviation floored. */
  public double zScore(String feature, double value) {
    double std = Math.max(baselineStore.standardDeviation(feature), MIN_STANDARD_DEVIATION);
    return Math.abs(value - baselineStore.mean(feature)) / std;
  }

  private final class TrainedStatisticalScorer implements TrainedScorer {

    @Override
    public ScorerType type() {
      return ScorerType.STATISTICAL;
    }

    @Override
    public double threshold() {
      return threshold;
    }

    @Override
    public double score(FeatureVector current, List<FeatureVector> recentHistory) {
      double max = 0.0;
      for (String metric : baselineStore.getSchema().getMetricNames()) {
        max = Math.max(max, zScore(metric, current.get(metric)));
      }
      return max;
    }

    @Override
    public Optional<String> dominantFeature(FeatureVector current) {
      String dominant = null;
      double max = -1.0;
      for (String metric : baselineStore.getSchema().getMetricNames()) {
        double z = zScore(metric, current.get(metric));
        if (z > max) {
          max = z;
          dominant = metric;
        }
      }
      return Optional.ofNullable(dominant);
    }
  }
}
