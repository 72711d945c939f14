package org.ctanalytics.anomaly.engine.detector.scorer;

import java.util.List;
import java.util.Optional;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.ScorerType;

/** Immutable, calibrated scorer. Safe to call from several threads. */
public interface TrainedScorer {

  ScorerType type();

  /** Calibrated decision threshold; a score strictly above it is a vote for anomaly. */
  double threshold();

  double score(FeatureVector current, List<FeatureVector> recentHistory);

  /** Feature that drove the score, when the scorer can tell. */
  default Optional<String> dominantFeature(FeatureVector current) {
    return Optional.empty();
  }
}
