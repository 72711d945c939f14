package org.ctanalytics.anomaly.engine.detector.scorer;

import java.util.List;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.ScorerType;

/** Untrained scorer. Training is deterministic for a given history and seed. */
public interface AnomalyScorer {

  ScorerType type();

  TrainedScorer train(List<FeatureVector> history);
}
