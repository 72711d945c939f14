package org.ctanalytics.anomaly.engine.datamodel;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Outcome of one evaluation that crossed the decision threshold. Only flat values and
 * collections are held so the record can cross the persistence boundary as is.
 */
@SuperBuilder
@Getter
@ToString
public class AnomalyRecord {
  private final String id;
  private final Instant detectedAt;
  private final String source;
  private final boolean isAnomaly;
  private final double confidence;
  private final Severity severity;
  private final Map<ScorerType, Double> scorerScores;
  private final Map<ScorerType, Boolean> scorerVotes;
  private final Map<ScorerType, Double> effectiveWeights;
  private final List<ScorerType> degradedScorers;
  private final String dominantFeature;
  private final Map<String, Double> featureSnapshot;
}
