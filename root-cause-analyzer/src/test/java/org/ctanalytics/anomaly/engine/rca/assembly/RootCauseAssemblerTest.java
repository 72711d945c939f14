package org.ctanalytics.anomaly.engine.rca.assembly;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.ctanalytics.anomaly.engine.datamodel.CausalDirection;
import org.ctanalytics.anomaly.engine.datamodel.CausalEdge;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.RootCauseResult;
import org.ctanalytics.anomaly.engine.datamodel.TimelineEntry;
import org.ctanalytics.anomaly.engine.rca.causal.CausalAnalysis;
import org.junit.jupiter.api.Test;

class RootCauseAssemblerTest {

  private static final List<String> FEATURES =
      List.of("cpu_usage", "memory_usage", "gc_pause_ms", "response_time_ms", "error_rate");

  private final RootCauseAssembler assembler = new RootCauseAssembler(3, 2);

  @Test
  void equalPValuesBreakTowardHigherAttribution() {
    CausalAnalysis causal =
        analysis(
            List.of(
                edge("memory_usage", "response_time_ms", 0.01),
                edge("cpu_usage", "error_rate", 0.01)),
            List.of());
    RootCauseResult result = assemble(causal, attribution());

    assertEquals("cpu_usage", result.getPrimaryCause().getFeature());
    assertEquals(0.99, result.getPrimaryCause().getConfidence(), 1e-12);
    assertFalse(result.isLowCausalConfidence());
    assertEquals("cpu_usage", result.getCausalRanking().get(0).getCauseFeature());
  }

  @Test
  void edgeOutsideTopAttributionIsSkipped() {
    CausalAnalysis causal =
        analysis(
            List.of(
                edge("error_rate", "response_time_ms", 0.001),
                edge("gc_pause_ms", "response_time_ms", 0.02)),
            List.of());
    RootCauseResult result = assemble(causal, attribution());

    assertEquals("gc_pause_ms", result.getPrimaryCause().getFeature());
    assertEquals(0.98, result.getPrimaryCause().getConfidence(), 1e-12);
    assertEquals(2, result.getCausalRanking().size());
  }

  @Test
  void ambiguousEdgesAreReportedButNeverPrimary() {
    CausalEdge ambiguous =
        CausalEdge.builder()
            .causeFeature("cpu_usage")
            .effectFeature("memory_usage")
            .lag(2)
            .pValue(0.001)
            .direction(CausalDirection.BIDIRECTIONAL)
            .build();
    RootCauseResult result = assemble(analysis(List.of(), List.of(ambiguous)), attribution());

    assertTrue(result.isLowCausalConfidence());
    assertEquals("cpu_usage", result.getPrimaryCause().getFeature());
    assertEquals(0.4, result.getPrimaryCause().getConfidence(), 1e-12);
    assertEquals(List.of(ambiguous), result.getAmbiguousEdges());
    assertTrue(result.getCausalRanking().isEmpty());
  }

  @Test
  void timelineCoversPrimaryAndTwoFactorsPerTimestamp() {
    RootCauseResult result =
        assemble(
            analysis(List.of(edge("gc_pause_ms", "response_time_ms", 0.02)), List.of()),
            attribution());

    List<TimelineEntry> timeline = result.getTimeline();
    assertEquals(9, timeline.size());
    assertEquals("gc_pause_ms", timeline.get(0).getFeature());
    assertEquals("cpu_usage", timeline.get(1).getFeature());
    assertEquals("memory_usage", timeline.get(2).getFeature());
    assertEquals(2.0, timeline.get(8).getDeltaFromBaseline(), 1e-12);
  }

  private RootCauseResult assemble(CausalAnalysis causal, Map<String, Double> attribution) {
    return assembler.assemble("anomaly-7", lookback(), means(), FEATURES, causal, attribution);
  }

  private static Map<String, Double> attribution() {
    Map<String, Double> attribution = new LinkedHashMap<>();
    attribution.put("cpu_usage", 0.4);
    attribution.put("memory_usage", 0.3);
    attribution.put("gc_pause_ms", 0.15);
    attribution.put("error_rate", 0.1);
    attribution.put("response_time_ms", 0.05);
    return attribution;
  }

  private static Map<String, Double> means() {
    Map<String, Double> means = new LinkedHashMap<>();
    FEATURES.forEach(feature -> means.put(feature, 1.0));
    return means;
  }

  private static List<FeatureVector> lookback() {
    Instant start = Instant.parse("2024-05-20T08:00:00Z");
    return List.of(
        vector(start, 1.0),
        vector(start.plusSeconds(60), 1.0),
        vector(start.plusSeconds(120), 3.0));
  }

  private static FeatureVector vector(Instant timestamp, double value) {
    Map<String, Double> values = new LinkedHashMap<>();
    FEATURES.forEach(feature -> values.put(feature, value));
    return new FeatureVector("svc", timestamp, values);
  }

  private static CausalEdge edge(String cause, String effect, double p) {
    return CausalEdge.builder()
        .causeFeature(cause)
        .effectFeature(effect)
        .lag(1)
        .pValue(p)
        .direction(CausalDirection.UNIDIRECTIONAL)
        .build();
  }

  private static CausalAnalysis analysis(List<CausalEdge> ranking, List<CausalEdge> ambiguous) {
    return CausalAnalysis.builder().ranking(ranking).ambiguous(ambiguous).build();
  }
}
