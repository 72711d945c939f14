package org.ctanalytics.anomaly.engine.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.ctanalytics.anomaly.engine.datamodel.AnomalyRecord;
import org.ctanalytics.anomaly.engine.datamodel.CausalEdge;
import org.ctanalytics.anomaly.engine.datamodel.ContributingFactor;
import org.ctanalytics.anomaly.engine.datamodel.RootCauseResult;
import org.ctanalytics.anomaly.engine.datamodel.ScorerType;
import org.ctanalytics.anomaly.engine.datamodel.TimelineEntry;
import org.ctanalytics.anomaly.engine.datamodel.exception.AnomalyEngineException;
import org.ctanalytics.anomaly.engine.narrative.transport.ObjectMapperProvider;

/**
 * Persistence shape of a report: snake_case keys, plain numbers, lowercase enum names and
 * ISO-8601 instants. No model object crosses this boundary.
 */
public class AnomalyReportSerializer {

  public String toJson(AnomalyReport report) {
    try {
      return ObjectMapperProvider.get().writeValueAsString(toJsonNode(report));
    } catch (JsonProcessingException e) {
      throw new AnomalyEngineException(
          "Failed to serialize report for anomaly " + report.getRecord().getId(), e);
    }
  }

  public ObjectNode toJsonNode(AnomalyReport report) {
    ObjectMapper mapper = ObjectMapperProvider.get();
    AnomalyRecord record = report.getRecord();
    ObjectNode root = mapper.createObjectNode();
    root.put("anomaly_id", record.getId());
    root.put("detected_at", record.getDetectedAt().toString());
    root.put("source", record.getSource());
    root.put("is_anomaly", record.isAnomaly());
    root.put("confidence", record.getConfidence());
    if (record.getSeverity() != null) {
      root.put("severity", record.getSeverity().wireName());
    }
    root.set("scorer_scores", byScorer(mapper, record.getScorerScores()));
    ObjectNode votes = root.putObject("scorer_votes");
    record.getScorerVotes().forEach((type, vote) -> votes.put(type.wireName(), vote));
    root.set("effective_weights", byScorer(mapper, record.getEffectiveWeights()));
    ArrayNode degraded = root.putArray("degraded_scorers");
    record.getDegradedScorers().forEach(type -> degraded.add(type.wireName()));
    if (record.getDominantFeature() != null) {
      root.put("dominant_feature", record.getDominantFeature());
    }
    ObjectNode snapshot = root.putObject("feature_snapshot");
    record.getFeatureSnapshot().forEach(snapshot::put);

    root.set("root_cause", rootCause(mapper, report.getRootCause()));
    report.narrative().ifPresent(text -> root.put("narrative", text));
    return root;
  }

  private static ObjectNode rootCause(ObjectMapper mapper, RootCauseResult result) {
    ObjectNode node = mapper.createObjectNode();
    node.put("anomaly_id", result.getAnomalyId());
    ObjectNode primary = node.putObject("primary_cause");
    primary.put("feature", result.getPrimaryCause().getFeature());
    primary.put("confidence", result.getPrimaryCause().getConfidence());
    node.put("low_causal_confidence", result.isLowCausalConfidence());

    ArrayNode factors = node.putArray("contributing_factors");
    for (ContributingFactor factor : result.getContributingFactors()) {
      factors
          .addObject()
          .put("feature", factor.getFeature())
          .put("attribution_weight", factor.getAttributionWeight());
    }
    node.set("causal_ranking", edges(mapper, result.getCausalRanking()));
    node.set("ambiguous_edges", edges(mapper, result.getAmbiguousEdges()));
    ArrayNode survivors = node.putArray("surviving_features");
    result.getSurvivingFeatures().forEach(survivors::add);

    ArrayNode timeline = node.putArray("timeline");
    for (TimelineEntry entry : result.getTimeline()) {
      timeline
          .addObject()
          .put("timestamp", entry.getTimestamp().toString())
          .put("feature", entry.getFeature())
          .put("value", entry.getValue())
          .put("delta_from_baseline", entry.getDeltaFromBaseline());
    }
    return node;
  }

  private static ArrayNode edges(ObjectMapper mapper, List<CausalEdge> edges) {
    ArrayNode array = mapper.createArrayNode();
    for (CausalEdge edge : edges) {
      array
          .addObject()
          .put("cause_feature", edge.getCauseFeature())
          .put("effect_feature", edge.getEffectFeature())
          .put("lag", edge.getLag())
          .put("p_value", edge.getPValue())
          .put("direction", edge.getDirection().name().toLowerCase(Locale.ROOT));
    }
    return array;
  }

  private static ObjectNode byScorer(ObjectMapper mapper, Map<ScorerType, Double> values) {
    ObjectNode node = mapper.createObjectNode();
    for (ScorerType type : ScorerType.values()) {
      Double value = values.get(type);
      if (value != null) {
        node.put(type.wireName(), value);
      }
    }
    return node;
  }
}
