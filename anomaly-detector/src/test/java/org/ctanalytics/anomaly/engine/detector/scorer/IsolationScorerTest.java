package org.ctanalytics.anomaly.engine.detector.scorer;

import static org.ctanalytics.anomaly.engine.detector.DetectorTestData.CPU_LATENCY;
import static org.ctanalytics.anomaly.engine.detector.DetectorTestData.noisy;
import static org.ctanalytics.anomaly.engine.detector.DetectorTestData.steady;
import static org.ctanalytics.anomaly.engine.detector.DetectorTestData.vector;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.detector.DetectorConfig;
import org.junit.jupiter.api.Test;

class IsolationScorerTest {

  private final IsolationScorer scorer =
      new IsolationScorer(DetectorConfig.defaults(), CPU_LATENCY);

  @Test
  void trainingIsDeterministicForTheSameSeed() {
    List<FeatureVector> history = noisy(40, 40, 200);
    TrainedScorer first = scorer.train(history);
    TrainedScorer second = scorer.train(history);
    FeatureVector sample = vector(41, 44, 230);

    assertEquals(first.threshold(), second.threshold());
    assertEquals(first.score(sample, List.of()), second.score(sample, List.of()));
  }

  @Test
  void outlierScoresAboveCalibratedThreshold() {
    TrainedScorer trained = scorer.train(noisy(40, 40, 200));
    double score = trained.score(vector(41, 95, 900), List.of());
    assertTrue(score > trained.threshold(), score + " <= " + trained.threshold());
    assertEquals(1.0, score, 1e-12);
  }

  @Test
  void identicalHistoryScoresHalf() {
    TrainedScorer trained = scorer.train(steady(25, 40, 200));
    assertEquals(0.5, trained.threshold(), 1e-12);
    assertEquals(0.5, trained.score(vector(30, 40, 200), List.of()), 1e-12);
  }

  @Test
  void averagePathLengthMatchesHarmonicApproximation() {
    assertEquals(0.0, IsolationScorer.averagePathLength(1));
    assertEquals(1.0, IsolationScorer.averagePathLength(2));
    assertEquals(
        2 * (Math.log(255) + 0.5772156649) - 2.0 * 255 / 256,
        IsolationScorer.averagePathLength(256),
        1e-12);
  }
}
