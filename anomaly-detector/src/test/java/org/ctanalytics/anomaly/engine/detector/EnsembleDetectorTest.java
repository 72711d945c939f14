package org.ctanalytics.anomaly.engine.detector;

import static org.ctanalytics.anomaly.engine.detector.DetectorTestData.CPU_LATENCY;
import static org.ctanalytics.anomaly.engine.detector.DetectorTestData.steady;
import static org.ctanalytics.anomaly.engine.detector.DetectorTestData.vector;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.ScorerType;
import org.ctanalytics.anomaly.engine.datamodel.Severity;
import org.ctanalytics.anomaly.engine.datamodel.exception.EnsembleUnavailableException;
import org.ctanalytics.anomaly.engine.datamodel.exception.InsufficientHistoryException;
import org.ctanalytics.anomaly.engine.datamodel.exception.InvalidWeightConfigException;
import org.ctanalytics.anomaly.engine.detector.baseline.BaselineStore;
import org.ctanalytics.anomaly.engine.detector.scorer.AnomalyScorer;
import org.ctanalytics.anomaly.engine.detector.scorer.TrainedScorer;
import org.junit.jupiter.api.Test;

class EnsembleDetectorTest {

  private final DetectorConfig config = DetectorConfig.from(DetectorTestData.applicationConfig());

  @Test
  void detectBeforeTrainingFails() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    EnsembleDetector detector =
        new EnsembleDetector(config, new BaselineStore(CPU_LATENCY, 20), registry);
    assertEquals(DetectorState.UNTRAINED, detector.getState());
    assertThrows(
        InsufficientHistoryException.class, () -> detector.detect(vector(0, 40, 200), List.of()));
  }

  @Test
  void retrainRequiresMinimumHistory() {
    EnsembleDetector detector =
        new EnsembleDetector(
            config, new BaselineStore(CPU_LATENCY, 20), new SimpleMeterRegistry());
    assertThrows(InsufficientHistoryException.class, () -> detector.retrain(steady(19, 40, 200)));
    assertEquals(DetectorState.UNTRAINED, detector.getState());
  }

  @Test
  void failedRetrainKeepsPreviousModel() {
    EnsembleDetector detector =
        new EnsembleDetector(
            config, new BaselineStore(CPU_LATENCY, 20), new SimpleMeterRegistry());
    detector.retrain(steady(20, 40, 200));
    EnsembleDetector.ModelSnapshot active = detector.activeModel().orElseThrow();
    assertThrows(InsufficientHistoryException.class, () -> detector.retrain(steady(5, 40, 200)));
    assertSame(active, detector.activeModel().orElseThrow());
    assertEquals(DetectorState.TRAINED, detector.getState());
  }

  @Test
  void weightsMustSumToOne() {
    assertThrows(
        InvalidWeightConfigException.class,
        () ->
            new EnsembleDetector(
                DetectorConfig.from(
                    ConfigFactory.parseString(
                        "anomaly.engine.ensemble.weights { isolation = 0.3, reconstruction = 0.3,"
                            + " statistical = 0.3 }")),
                new BaselineStore(CPU_LATENCY, 20),
                new SimpleMeterRegistry()));
  }

  @Test
  void spikeAfterSteadyBaselineIsCritical() {
    BaselineStore store = new BaselineStore(CPU_LATENCY, 20);
    steady(25, 40, 200).forEach(store::observe);
    EnsembleDetector detector = new EnsembleDetector(config, store, new SimpleMeterRegistry());
    detector.retrain(store.recentHistory());

    EnsembleDecision decision = detector.detect(vector(25, 95, 900), store.recentHistory());

    assertTrue(decision.isAnomaly());
    assertEquals(1.0, decision.getConfidence());
    assertEquals(Severity.CRITICAL, decision.getSeverity());
    assertEquals(3, decision.getVotes().size());
    decision.getVotes().forEach(vote -> assertTrue(vote.isAnomalous(), vote.toString()));
    assertTrue(decision.getDegradedScorers().isEmpty());
    assertEquals("response_time_ms", decision.getDominantFeature());
  }

  @Test
  void steadyVectorIsNotAnomalous() {
    BaselineStore store = new BaselineStore(CPU_LATENCY, 20);
    steady(25, 40, 200).forEach(store::observe);
    EnsembleDetector detector = new EnsembleDetector(config, store, new SimpleMeterRegistry());
    detector.retrain(store.recentHistory());

    EnsembleDecision decision = detector.detect(vector(25, 40, 200), store.recentHistory());

    assertFalse(decision.isAnomaly());
    assertNull(decision.getSeverity());
    assertEquals(0.0, decision.getConfidence());
  }

  @Test
  void failingScorerIsDroppedAndWeightsRenormalized() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    AnomalyScorer reconstruction = mock(AnomalyScorer.class);
    TrainedScorer broken = mock(TrainedScorer.class);
    when(reconstruction.type()).thenReturn(ScorerType.RECONSTRUCTION);
    when(reconstruction.train(anyList())).thenReturn(broken);
    when(broken.type()).thenReturn(ScorerType.RECONSTRUCTION);
    when(broken.score(any(), anyList())).thenThrow(new IllegalStateException("model corrupted"));

    EnsembleDetector detector =
        new EnsembleDetector(
            config,
            List.of(
                fixedScorer(ScorerType.ISOLATION, 0.9, 0.5),
                reconstruction,
                fixedScorer(ScorerType.STATISTICAL, 12.0, 3.0)),
            registry);
    detector.retrain(steady(20, 40, 200));

    EnsembleDecision decision = detector.detect(vector(20, 95, 900), List.of());

    assertEquals(List.of(ScorerType.RECONSTRUCTION), decision.getDegradedScorers());
    Map<ScorerType, Double> weights = decision.getEffectiveWeights();
    assertEquals(0.35 / 0.65, weights.get(ScorerType.ISOLATION), 1e-9);
    assertEquals(0.30 / 0.65, weights.get(ScorerType.STATISTICAL), 1e-9);
    assertFalse(weights.containsKey(ScorerType.RECONSTRUCTION));
    assertTrue(decision.isAnomaly());
    assertEquals(1.0, decision.getConfidence());

    Counter counter =
        registry
            .find(EnsembleDetector.SCORER_DEGRADED_COUNTER)
            .tag("scorer", "reconstruction")
            .counter();
    assertEquals(1.0, counter.count());
  }

  @Test
  void everyScorerFailingIsUnavailable() {
    List<AnomalyScorer> scorers = new ArrayList<>();
    for (ScorerType type : ScorerType.values()) {
      AnomalyScorer scorer = mock(AnomalyScorer.class);
      TrainedScorer trained = mock(TrainedScorer.class);
      when(scorer.type()).thenReturn(type);
      when(scorer.train(anyList())).thenReturn(trained);
      when(trained.type()).thenReturn(type);
      when(trained.score(any(), anyList())).thenThrow(new IllegalStateException("down"));
      scorers.add(scorer);
    }
    EnsembleDetector detector = new EnsembleDetector(config, scorers, new SimpleMeterRegistry());
    detector.retrain(steady(20, 40, 200));
    assertThrows(
        EnsembleUnavailableException.class, () -> detector.detect(vector(20, 40, 200), List.of()));
  }

  @Test
  void confidenceGrowsWithVotingWeight() {
    double previous = -1.0;
    boolean[][] voteSets = {
      {false, false, false},
      {false, false, true},
      {true, false, true},
      {true, true, true}
    };
    for (boolean[] votes : voteSets) {
      EnsembleDetector detector =
          new EnsembleDetector(
              config,
              List.of(
                  fixedScorer(ScorerType.ISOLATION, votes[0] ? 0.9 : 0.1, 0.5),
                  fixedScorer(ScorerType.RECONSTRUCTION, votes[1] ? 2.0 : 0.5, 1.0),
                  fixedScorer(ScorerType.STATISTICAL, votes[2] ? 5.0 : 1.0, 3.0)),
              new SimpleMeterRegistry());
      detector.retrain(steady(20, 40, 200));
      double confidence = detector.detect(vector(20, 40, 200), List.of()).getConfidence();
      assertTrue(confidence > previous, "confidence should grow with voted weight");
      previous = confidence;
    }
    assertEquals(1.0, previous);
  }

  @Test
  void partialVoteBelowThresholdIsNotAnomalous() {
    EnsembleDetector detector =
        new EnsembleDetector(
            config,
            List.of(
                fixedScorer(ScorerType.ISOLATION, 0.9, 0.5),
                fixedScorer(ScorerType.RECONSTRUCTION, 0.5, 1.0),
                fixedScorer(ScorerType.STATISTICAL, 5.0, 3.0)),
            new SimpleMeterRegistry());
    detector.retrain(steady(20, 40, 200));
    EnsembleDecision decision = detector.detect(vector(20, 40, 200), List.of());
    assertFalse(decision.isAnomaly());
    assertEquals(0.65, decision.getConfidence(), 1e-9);
    assertNull(decision.getSeverity());
  }

  @Test
  void continuousScoreUsesScoreOverScorePlusThreshold() {
    EnsembleDetector detector =
        new EnsembleDetector(
            config,
            List.of(
                fixedScorer(ScorerType.ISOLATION, 0.5, 0.5),
                fixedScorer(ScorerType.RECONSTRUCTION, 1.0, 1.0),
                fixedScorer(ScorerType.STATISTICAL, 0.0, 3.0)),
            new SimpleMeterRegistry());
    detector.retrain(steady(20, 40, 200));
    double score = detector.anomalyScore(vector(20, 40, 200), List.of());
    assertEquals(0.35 * 0.5 + 0.35 * 0.5, score, 1e-9);
  }

  private static AnomalyScorer fixedScorer(ScorerType type, double score, double threshold) {
    AnomalyScorer scorer = mock(AnomalyScorer.class);
    TrainedScorer trained = mock(TrainedScorer.class);
    when(scorer.type()).thenReturn(type);
    when(scorer.train(anyList())).thenReturn(trained);
    when(trained.type()).thenReturn(type);
    when(trained.threshold()).thenReturn(threshold);
    when(trained.score(any(FeatureVector.class), anyList())).thenReturn(score);
    return scorer;
  }
}
