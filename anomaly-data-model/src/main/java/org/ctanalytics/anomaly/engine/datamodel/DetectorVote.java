package org.ctanalytics.anomaly.engine.datamodel;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder
@Getter
@ToString
public class DetectorVote {
  private final ScorerType scorerType;
  private final double score;
  private final double threshold;
  private final boolean isAnomalous;
}
