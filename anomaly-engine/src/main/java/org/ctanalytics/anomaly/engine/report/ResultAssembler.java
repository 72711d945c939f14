package org.ctanalytics.anomaly.engine.report;

import com.google.common.base.Preconditions;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.ctanalytics.anomaly.engine.datamodel.AnomalyRecord;
import org.ctanalytics.anomaly.engine.datamodel.DetectorVote;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.RootCauseResult;
import org.ctanalytics.anomaly.engine.datamodel.ScorerType;
import org.ctanalytics.anomaly.engine.detector.EnsembleDecision;

/**
 * Builds the immutable outputs of one evaluation. The narrative is attached as is and never
 * feeds back into confidence, severity or ranking.
 */
public class ResultAssembler {

  /** Same source and timestamp always give the same id. */
  public static String anomalyId(String source, Instant timestamp) {
    String name = source + "@" + timestamp;
    return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
  }

  public AnomalyRecord record(FeatureVector vector, EnsembleDecision decision) {
    Preconditions.checkArgument(
        decision.isAnomaly(), "only anomalous decisions produce a record");
    Map<ScorerType, Double> scores = new EnumMap<>(ScorerType.class);
    Map<ScorerType, Boolean> votes = new EnumMap<>(ScorerType.class);
    for (DetectorVote vote : decision.getVotes()) {
      scores.put(vote.getScorerType(), vote.getScore());
      votes.put(vote.getScorerType(), vote.isAnomalous());
    }
    return AnomalyRecord.builder()
        .id(anomalyId(vector.getSource(), vector.getTimestamp()))
        .detectedAt(vector.getTimestamp())
        .source(vector.getSource())
        .isAnomaly(true)
        .confidence(decision.getConfidence())
        .severity(decision.getSeverity())
        .scorerScores(Map.copyOf(scores))
        .scorerVotes(Map.copyOf(votes))
        .effectiveWeights(Map.copyOf(decision.getEffectiveWeights()))
        .degradedScorers(decision.getDegradedScorers())
        .dominantFeature(decision.getDominantFeature())
        .featureSnapshot(vector.getValues())
        .build();
  }

  public AnomalyReport assemble(
      AnomalyRecord record, RootCauseResult rootCause, Optional<String> narrative) {
    Preconditions.checkArgument(
        record.getId().equals(rootCause.getAnomalyId()),
        "root cause %s does not explain anomaly %s",
        rootCause.getAnomalyId(),
        record.getId());
    return AnomalyReport.builder()
        .record(record)
        .rootCause(rootCause)
        .narrative(narrative.filter(text -> !text.isBlank()).orElse(null))
        .build();
  }
}
