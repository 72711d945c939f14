package org.ctanalytics.anomaly.engine.detector;

import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.ctanalytics.anomaly.engine.datamodel.DetectorVote;
import org.ctanalytics.anomaly.engine.datamodel.ScorerType;
import org.ctanalytics.anomaly.engine.datamodel.Severity;

/** Weighted vote of the available scorers for one vector. Severity is null for non-anomalies. */
@SuperBuilder
@Getter
@ToString
public class EnsembleDecision {
  private final boolean isAnomaly;
  private final double confidence;
  private final Severity severity;
  private final List<DetectorVote> votes;
  private final Map<ScorerType, Double> effectiveWeights;
  private final List<ScorerType> degradedScorers;
  private final String dominantFeature;
}
