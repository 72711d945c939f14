package org.ctanalytics.anomaly.engine.datamodel;

import java.util.List;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Ranked explanation of one anomaly. {@code anomalyId} refers back to the {@link AnomalyRecord}
 * it explains; the result does not own the record.
 */
@SuperBuilder
@Getter
@ToString
public class RootCauseResult {
  private final String anomalyId;
  private final PrimaryCause primaryCause;
  // primary cause came from attribution alone, no causal edge backed it
  private final boolean lowCausalConfidence;
  private final List<ContributingFactor> contributingFactors;
  private final List<CausalEdge> causalRanking;
  private final List<CausalEdge> ambiguousEdges;
  private final List<String> survivingFeatures;
  private final List<TimelineEntry> timeline;
}
