package org.ctanalytics.anomaly.engine.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.ctanalytics.anomaly.engine.datamodel.AnomalyRecord;
import org.ctanalytics.anomaly.engine.datamodel.ScorerType;
import org.ctanalytics.anomaly.engine.datamodel.Severity;
import org.ctanalytics.anomaly.engine.detector.EnsembleDecision;
import org.junit.jupiter.api.Test;

class ResultAssemblerTest {

  private final ResultAssembler assembler = new ResultAssembler();

  @Test
  void recordCarriesDecision() {
    AnomalyRecord record =
        assembler.record(ReportTestData.spike(), ReportTestData.degradedDecision());

    assertEquals(
        ResultAssembler.anomalyId(ReportTestData.SOURCE, ReportTestData.DETECTED_AT),
        record.getId());
    assertEquals(ReportTestData.DETECTED_AT, record.getDetectedAt());
    assertEquals(Severity.CRITICAL, record.getSeverity());
    assertEquals(
        Map.of(ScorerType.ISOLATION, 0.81, ScorerType.STATISTICAL, 42.0),
        record.getScorerScores());
    assertEquals(
        Map.of(ScorerType.ISOLATION, true, ScorerType.STATISTICAL, true), record.getScorerVotes());
    assertEquals(List.of(ScorerType.RECONSTRUCTION), record.getDegradedScorers());
    assertEquals(900.0, record.getFeatureSnapshot().get("response_time_ms"));
  }

  @Test
  void idDependsOnSourceAndTime() {
    String id = ResultAssembler.anomalyId("a", ReportTestData.DETECTED_AT);

    assertEquals(id, ResultAssembler.anomalyId("a", ReportTestData.DETECTED_AT));
    assertNotEquals(id, ResultAssembler.anomalyId("b", ReportTestData.DETECTED_AT));
    assertNotEquals(
        id, ResultAssembler.anomalyId("a", ReportTestData.DETECTED_AT.plusSeconds(60)));
  }

  @Test
  void normalDecisionHasNoRecord() {
    EnsembleDecision normal =
        EnsembleDecision.builder()
            .isAnomaly(false)
            .confidence(0.3)
            .votes(List.of())
            .effectiveWeights(Map.of())
            .degradedScorers(List.of())
            .build();

    assertThrows(
        IllegalArgumentException.class, () -> assembler.record(ReportTestData.spike(), normal));
  }

  @Test
  void reportKeepsNarrativeApart() {
    AnomalyRecord record =
        assembler.record(ReportTestData.spike(), ReportTestData.degradedDecision());

    AnomalyReport withText =
        assembler.assemble(
            record, ReportTestData.rootCause(record.getId()), Optional.of("Checkout slowed."));
    AnomalyReport blank =
        assembler.assemble(record, ReportTestData.rootCause(record.getId()), Optional.of("  "));

    assertEquals(Optional.of("Checkout slowed."), withText.narrative());
    assertTrue(blank.narrative().isEmpty());
    assertEquals(withText.getRecord().getConfidence(), blank.getRecord().getConfidence());
  }

  @Test
  void rootCauseMustExplainRecord() {
    AnomalyRecord record =
        assembler.record(ReportTestData.spike(), ReportTestData.degradedDecision());

    assertThrows(
        IllegalArgumentException.class,
        () -> assembler.assemble(record, ReportTestData.rootCause("other"), Optional.empty()));
  }
}
