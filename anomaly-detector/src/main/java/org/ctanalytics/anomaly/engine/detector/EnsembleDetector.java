package org.ctanalytics.anomaly.engine.detector;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.ctanalytics.anomaly.engine.datamodel.DetectorVote;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.ScorerType;
import org.ctanalytics.anomaly.engine.datamodel.exception.EnsembleUnavailableException;
import org.ctanalytics.anomaly.engine.datamodel.exception.InsufficientHistoryException;
import org.ctanalytics.anomaly.engine.datamodel.exception.InvalidWeightConfigException;
import org.ctanalytics.anomaly.engine.detector.baseline.BaselineStore;
import org.ctanalytics.anomaly.engine.detector.scorer.AnomalyScorer;
import org.ctanalytics.anomaly.engine.detector.scorer.IsolationScorer;
import org.ctanalytics.anomaly.engine.detector.scorer.ReconstructionScorer;
import org.ctanalytics.anomaly.engine.detector.scorer.StatisticalScorer;
import org.ctanalytics.anomaly.engine.detector.scorer.TrainedScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weighted-vote ensemble over the isolation, reconstruction and statistical scorers.
 *
 * <p>The trained model is an immutable snapshot behind an atomic reference. {@link #retrain}
 * builds a new snapshot and swaps it in; a {@link #detect} already running keeps the snapshot it
 * started with.
 */
public class EnsembleDetector {
  private static final Logger LOGGER = LoggerFactory.getLogger(EnsembleDetector.class);

  static final String SCORER_DEGRADED_COUNTER = "anomaly.engine.detector.scorer.degraded";
  static final String RETRAIN_TIMER = "anomaly.engine.detector.retrain";
  private static final String SCORER_TAG = "scorer";
  private static final double WEIGHT_SUM_TOLERANCE = 1e-6;
  private static final double MIN_THRESHOLD = 1e-9;

  private final List<AnomalyScorer> scorers;
  private final Map<ScorerType, Double> weights;
  private final double voteThreshold;
  private final SeverityCutoffs severityCutoffs;
  private final int minTrainingHistory;
  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<ScorerType, Counter> degradedCounters = new ConcurrentHashMap<>();
  private final Timer retrainTimer;
  private final AtomicReference<ModelSnapshot> activeModel = new AtomicReference<>();
  private final AtomicInteger activeDetections = new AtomicInteger();

  public EnsembleDetector(
      DetectorConfig config, BaselineStore baselineStore, MeterRegistry meterRegistry) {
    this(
        config,
        List.of(
            new IsolationScorer(config, baselineStore.getSchema()),
            new ReconstructionScorer(config, baselineStore.getSchema()),
            new StatisticalScorer(config, baselineStore)),
        meterRegistry);
  }

  @VisibleForTesting
  EnsembleDetector(
      DetectorConfig config, List<AnomalyScorer> scorers, MeterRegistry meterRegistry) {
    this.scorers = ImmutableList.copyOf(scorers);
    this.weights =
        validateWeights(
            config.getWeights(),
            this.scorers.stream().map(AnomalyScorer::type).collect(Collectors.toList()));
    this.voteThreshold = config.getVoteThreshold();
    this.severityCutoffs = config.getSeverityCutoffs();
    this.minTrainingHistory = config.getMinTrainingHistory();
    this.meterRegistry = meterRegistry;
    this.retrainTimer = meterRegistry.timer(RETRAIN_TIMER);
  }

  /** Fails with {@link InvalidWeightConfigException} unless the configured weights are usable. */
  public static void checkWeights(DetectorConfig config) {
    validateWeights(config.getWeights(), List.of(ScorerType.values()));
  }

  private static Map<ScorerType, Double> validateWeights(
      Map<ScorerType, Double> configured, List<ScorerType> types) {
    Map<ScorerType, Double> weights = new EnumMap<>(ScorerType.class);
    double sum = 0.0;
    for (ScorerType type : types) {
      Double weight = configured.get(type);
      if (weight == null || weight < 0 || weight.isNaN()) {
        throw new InvalidWeightConfigException(
            String.format("Invalid weight %s for scorer %s", weight, type.wireName()));
      }
      weights.put(type, weight);
      sum += weight;
    }
    if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
      throw new InvalidWeightConfigException(
          String.format("Ensemble weights must sum to 1.0, got %s from %s", sum, weights));
    }
    return weights;
  }

  public DetectorState getState() {
    if (activeModel.get() == null) {
      return DetectorState.UNTRAINED;
    }
    return activeDetections.get() > 0 ? DetectorState.SCORING : DetectorState.TRAINED;
  }

  /**
   * Trains every scorer on the given history and atomically replaces the active model. On
   * failure the previous model stays active.
   */
  public void retrain(List<FeatureVector> history) {
    if (history.size() < minTrainingHistory) {
      throw new InsufficientHistoryException(
          String.format(
              "Training needs at least %d vectors, got %d", minTrainingHistory, history.size()));
    }
    List<FeatureVector> trainingSet = ImmutableList.copyOf(history);
    long start = System.nanoTime();
    List<TrainedScorer> trained = new ArrayList<>(scorers.size());
    for (AnomalyScorer scorer : scorers) {
      trained.add(scorer.train(trainingSet));
    }
    ModelSnapshot snapshot =
        new ModelSnapshot(ImmutableList.copyOf(trained), Instant.now(), trainingSet.size());
    retrainTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
    activeModel.set(snapshot);
    LOGGER.info(
        "Activated ensemble model trained on {} vectors, thresholds: {}",
        snapshot.getTrainingSize(),
        snapshot.thresholds());
  }

  public EnsembleDecision detect(FeatureVector current, List<FeatureVector> recentHistory) {
    ModelSnapshot snapshot = requireModel();
    activeDetections.incrementAndGet();
    try {
      return decide(snapshot, current, recentHistory);
    } finally {
      activeDetections.decrementAndGet();
    }
  }

  private EnsembleDecision decide(
      ModelSnapshot snapshot, FeatureVector current, List<FeatureVector> recentHistory) {
    List<DetectorVote> votes = new ArrayList<>();
    List<ScorerType> degraded = new ArrayList<>();
    String dominantFeature = null;
    RuntimeException lastFailure = null;
    for (TrainedScorer scorer : snapshot.getScorers()) {
      try {
        double score = scorer.score(current, recentHistory);
        votes.add(
            DetectorVote.builder()
                .scorerType(scorer.type())
                .score(score)
                .threshold(scorer.threshold())
                .isAnomalous(score > scorer.threshold())
                .build());
        Optional<String> dominant = scorer.dominantFeature(current);
        if (dominant.isPresent()) {
          dominantFeature = dominant.get();
        }
      } catch (RuntimeException e) {
        lastFailure = e;
        degraded.add(scorer.type());
        degradedCounter(scorer.type()).increment();
        LOGGER.warn(
            "Scorer {} failed for source {} at {}, continuing without it",
            scorer.type().wireName(),
            current.getSource(),
            current.getTimestamp(),
            e);
      }
    }
    if (votes.isEmpty()) {
      throw new EnsembleUnavailableException(
          String.format(
              "Every scorer failed for source %s at %s",
              current.getSource(), current.getTimestamp()),
          lastFailure);
    }

    double availableWeight = 0.0;
    double votedWeight = 0.0;
    for (DetectorVote vote : votes) {
      double weight = weights.get(vote.getScorerType());
      availableWeight += weight;
      if (vote.isAnomalous()) {
        votedWeight += weight;
      }
    }
    double total = availableWeight > 0 ? votedWeight / availableWeight : 0.0;
    Map<ScorerType, Double> effectiveWeights = new EnumMap<>(ScorerType.class);
    for (DetectorVote vote : votes) {
      effectiveWeights.put(
          vote.getScorerType(),
          availableWeight > 0 ? weights.get(vote.getScorerType()) / availableWeight : 0.0);
    }

    boolean anomaly = total > voteThreshold;
    double confidence = Math.max(0.0, Math.min(1.0, total));
    if (!degraded.isEmpty()) {
      LOGGER.warn(
          "Ensemble degraded for source {}, unavailable scorers {}, effective weights {}",
          current.getSource(),
          degraded,
          effectiveWeights);
    }
    return EnsembleDecision.builder()
        .isAnomaly(anomaly)
        .confidence(confidence)
        .severity(anomaly ? severityCutoffs.classify(confidence) : null)
        .votes(ImmutableList.copyOf(votes))
        .effectiveWeights(effectiveWeights)
        .degradedScorers(ImmutableList.copyOf(degraded))
        .dominantFeature(dominantFeature)
        .build();
  }

  /**
   * Continuous ensemble score in [0, 1): the weighted mean of {@code s / (s + t)} over the
   * available scorers, where t is the scorer's calibrated threshold.
   */
  public double anomalyScore(FeatureVector vector, List<FeatureVector> recentHistory) {
    ModelSnapshot snapshot = requireModel();
    double weighted = 0.0;
    double availableWeight = 0.0;
    RuntimeException lastFailure = null;
    for (TrainedScorer scorer : snapshot.getScorers()) {
      double score;
      try {
        score = Math.max(0.0, scorer.score(vector, recentHistory));
      } catch (RuntimeException e) {
        LOGGER.debug("Scorer {} unavailable for continuous score", scorer.type().wireName(), e);
        lastFailure = e;
        continue;
      }
      double threshold = scorer.threshold() <= 0 ? MIN_THRESHOLD : scorer.threshold();
      double weight = weights.get(scorer.type());
      weighted += weight * score / (score + threshold);
      availableWeight += weight;
    }
    if (availableWeight <= 0) {
      throw new EnsembleUnavailableException(
          String.format("No scorer could score source %s", vector.getSource()), lastFailure);
    }
    return weighted / availableWeight;
  }

  private ModelSnapshot requireModel() {
    ModelSnapshot snapshot = activeModel.get();
    if (snapshot == null) {
      throw new InsufficientHistoryException("Ensemble has not been trained yet");
    }
    return snapshot;
  }

  private Counter degradedCounter(ScorerType type) {
    return degradedCounters.computeIfAbsent(
        type,
        t ->
            Counter.builder(SCORER_DEGRADED_COUNTER)
                .tag(SCORER_TAG, t.wireName())
                .register(meterRegistry));
  }

  @VisibleForTesting
  Optional<ModelSnapshot> activeModel() {
    return Optional.ofNullable(activeModel.get());
  }

  static final class ModelSnapshot {
    private final List<TrainedScorer> scorers;
    private final Instant trainedAt;
    private final int trainingSize;

    ModelSnapshot(List<TrainedScorer> scorers, Instant trainedAt, int trainingSize) {
      this.scorers = scorers;
      this.trainedAt = trainedAt;
      this.trainingSize = trainingSize;
    }

    List<TrainedScorer> getScorers() {
      return scorers;
    }

    Instant getTrainedAt() {
      return trainedAt;
    }

    int getTrainingSize() {
      return trainingSize;
    }

    Map<ScorerType, Double> thresholds() {
      Map<ScorerType, Double> thresholds = new EnumMap<>(ScorerType.class);
      scorers.forEach(scorer -> thresholds.put(scorer.type(), scorer.threshold()));
      return thresholds;
    }
  }
}
