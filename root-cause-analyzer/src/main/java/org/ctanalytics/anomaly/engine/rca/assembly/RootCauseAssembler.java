package org.ctanalytics.anomaly.engine.rca.assembly;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.ctanalytics.anomaly.engine.datamodel.CausalEdge;
import org.ctanalytics.anomaly.engine.datamodel.ContributingFactor;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.PrimaryCause;
import org.ctanalytics.anomaly.engine.datamodel.RootCauseResult;
import org.ctanalytics.anomaly.engine.datamodel.TimelineEntry;
import org.ctanalytics.anomaly.engine.rca.causal.CausalAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Last RCA stage: picks the primary cause and builds the event timeline. */
public class RootCauseAssembler {
  private static final Logger LOGGER = LoggerFactory.getLogger(RootCauseAssembler.class);

  private final int topK;
  private final int timelineFactors;

  public RootCauseAssembler(int topK, int timelineFactors) {
    this.topK = topK;
    this.timelineFactors = timelineFactors;
  }

  public RootCauseResult assemble(
      String anomalyId,
      List<FeatureVector> lookback,
      Map<String, Double> baselineMeans,
      List<String> survivors,
      CausalAnalysis causal,
      Map<String, Double> attribution) {
    List<String> byAttribution = new ArrayList<>(attribution.keySet());
    List<String> topFeatures = byAttribution.subList(0, Math.min(topK, byAttribution.size()));

    // equal p-values go to the cause with more attribution
    List<CausalEdge> ranking = new ArrayList<>(causal.getRanking());
    ranking.sort(
        Comparator.comparingDouble(CausalEdge::getPValue)
            .thenComparing(
                edge -> attribution.getOrDefault(edge.getCauseFeature(), 0.0),
                Comparator.reverseOrder()));

    PrimaryCause primary = null;
    for (CausalEdge edge : ranking) {
      if (topFeatures.contains(edge.getCauseFeature())) {
        primary =
            PrimaryCause.builder()
                .feature(edge.getCauseFeature())
                .confidence(1.0 - edge.getPValue())
                .build();
        break;
      }
    }
    boolean lowCausalConfidence = primary == null;
    if (lowCausalConfidence) {
      String feature = byAttribution.get(0);
      primary =
          PrimaryCause.builder().feature(feature).confidence(attribution.get(feature)).build();
      LOGGER.info(
          "No causal edge backs the top attributed features of {}, falling back to {}",
          anomalyId,
          feature);
    }

    List<ContributingFactor> factors = new ArrayList<>();
    attribution.forEach(
        (feature, weight) ->
            factors.add(
                ContributingFactor.builder().feature(feature).attributionWeight(weight).build()));

    return RootCauseResult.builder()
        .anomalyId(anomalyId)
        .primaryCause(primary)
        .lowCausalConfidence(lowCausalConfidence)
        .contributingFactors(ImmutableList.copyOf(factors))
        .causalRanking(ImmutableList.copyOf(ranking))
        .ambiguousEdges(causal.getAmbiguous())
        .survivingFeatures(ImmutableList.copyOf(survivors))
        .timeline(timeline(lookback, baselineMeans, primary.getFeature(), byAttribution))
        .build();
  }

  private List<TimelineEntry> timeline(
      List<FeatureVector> lookback,
      Map<String, Double> baselineMeans,
      String primary,
      List<String> byAttribution) {
    List<String> features = new ArrayList<>();
    features.add(primary);
    for (String feature : byAttribution) {
      if (features.size() > timelineFactors) {
        break;
      }
      if (!feature.equals(primary)) {
        features.add(feature);
      }
    }
    List<TimelineEntry> timeline = new ArrayList<>();
    for (FeatureVector vector : lookback) {
      for (String feature : features) {
        double value = vector.get(feature);
        timeline.add(
            TimelineEntry.builder()
                .timestamp(vector.getTimestamp())
                .feature(feature)
                .value(value)
                .deltaFromBaseline(value - baselineMeans.get(feature))
                .build());
      }
    }
    return ImmutableList.copyOf(timeline);
  }
}
