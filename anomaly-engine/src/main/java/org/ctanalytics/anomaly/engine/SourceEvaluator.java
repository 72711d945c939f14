package org.ctanalytics.anomaly.engine;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.ctanalytics.anomaly.engine.datamodel.AnomalyRecord;
import org.ctanalytics.anomaly.engine.datamodel.FeatureSchema;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.RootCauseResult;
import org.ctanalytics.anomaly.engine.detector.DetectorState;
import org.ctanalytics.anomaly.engine.detector.EnsembleDecision;
import org.ctanalytics.anomaly.engine.detector.EnsembleDetector;
import org.ctanalytics.anomaly.engine.detector.baseline.BaselineStore;
import org.ctanalytics.anomaly.engine.detector.feature.FeatureBuilder;
import org.ctanalytics.anomaly.engine.detector.forecast.ForecastReport;
import org.ctanalytics.anomaly.engine.detector.forecast.ResourceExhaustionPredictor;
import org.ctanalytics.anomaly.engine.narrative.NarrativeGenerator;
import org.ctanalytics.anomaly.engine.narrative.NarrativePayload;
import org.ctanalytics.anomaly.engine.rca.RootCauseAnalyzer;
import org.ctanalytics.anomaly.engine.rca.RootCauseRequest;
import org.ctanalytics.anomaly.engine.report.AnomalyReport;
import org.ctanalytics.anomaly.engine.report.ResultAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pipeline state of one source. Ingestion and evaluation of the same source are serialized by a
 * lock; training and the narrative call run outside it.
 */
class SourceEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(SourceEvaluator.class);

  private final String source;
  private final FeatureSchema schema;
  private final BaselineStore baselineStore;
  private final FeatureBuilder featureBuilder;
  private final EnsembleDetector detector;
  private final RootCauseAnalyzer rootCauseAnalyzer;
  private final NarrativeGenerator narrativeGenerator;
  private final ResultAssembler resultAssembler;
  private final ResourceExhaustionPredictor exhaustionPredictor;
  private final ExecutorService retrainExecutor;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicReference<CompletableFuture<Void>> inFlightRetrain =
      new AtomicReference<>();

  SourceEvaluator(
      String source,
      FeatureSchema schema,
      BaselineStore baselineStore,
      FeatureBuilder featureBuilder,
      EnsembleDetector detector,
      RootCauseAnalyzer rootCauseAnalyzer,
      NarrativeGenerator narrativeGenerator,
      ResultAssembler resultAssembler,
      ResourceExhaustionPredictor exhaustionPredictor,
      ExecutorService retrainExecutor) {
    this.source = source;
    this.schema = schema;
    this.baselineStore = baselineStore;
    this.featureBuilder = featureBuilder;
    this.detector = detector;
    this.rootCauseAnalyzer = rootCauseAnalyzer;
    this.narrativeGenerator = narrativeGenerator;
    this.resultAssembler = resultAssembler;
    this.exhaustionPredictor = exhaustionPredictor;
    this.retrainExecutor = retrainExecutor;
  }

  /** Warm-up: folds the readings into the baseline without scoring them. */
  void ingest(Instant timestamp, Map<String, Double> readings) {
    lock.lock();
    try {
      baselineStore.observe(featureBuilder.build(source, timestamp, readings, schema));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Scores the readings and, when anomalous, explains them. Scoring never trains: without an
   * active model this fails with {@code InsufficientHistoryException}. Out-of-order readings are
   * rejected before anything is scored. The vector joins the baseline only once detection and
   * root cause analysis have completed.
   */
  Optional<AnomalyReport> evaluate(Instant timestamp, Map<String, Double> readings) {
    AnomalyRecord record;
    RootCauseResult rootCause;
    lock.lock();
    try {
      baselineStore.checkOrder(timestamp);
      FeatureVector current = featureBuilder.build(source, timestamp, readings, schema);
      List<FeatureVector> history = baselineStore.recentHistory();
      EnsembleDecision decision = detector.detect(current, history);
      if (!decision.isAnomaly()) {
        baselineStore.observe(current);
        LOGGER.debug(
            "Source {} normal at {} with confidence {}",
            source,
            timestamp,
            decision.getConfidence());
        return Optional.empty();
      }
      record = resultAssembler.record(current, decision);
      rootCause =
          rootCauseAnalyzer.analyze(
              RootCauseRequest.builder()
                  .anomalyId(record.getId())
                  .current(current)
                  .history(history)
                  .baselineMeans(baselineStore.baselineMeans())
                  .scoreFunction(vector -> detector.anomalyScore(vector, history))
                  .candidateFeatures(schema.getMetricNames())
                  .build());
      baselineStore.observe(current);
    } finally {
      lock.unlock();
    }

    LOGGER.info(
        "Anomaly {} on source {} at {}: severity {}, confidence {}",
        record.getId(),
        source,
        timestamp,
        record.getSeverity(),
        record.getConfidence());
    Optional<String> narrative =
        narrativeGenerator.explain(NarrativePayload.from(record, rootCause));
    return Optional.of(resultAssembler.assemble(record, rootCause, narrative));
  }

  /** Trains on the retained training history and blocks until the new model is active. */
  void retrain() {
    try {
      retrainAsync().join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw e;
    }
  }

  /**
   * Snapshots the history under the lock and trains off it on the retrain executor. While a
   * retrain of this source is running, further requests get the running one.
   */
  CompletableFuture<Void> retrainAsync() {
    while (true) {
      CompletableFuture<Void> running = inFlightRetrain.get();
      if (running != null && !running.isDone()) {
        LOGGER.debug("Retrain of source {} already in flight", source);
        return running;
      }
      CompletableFuture<Void> next = new CompletableFuture<>();
      if (!inFlightRetrain.compareAndSet(running, next)) {
        continue;
      }
      List<FeatureVector> history = snapshotHistory();
      try {
        retrainExecutor.execute(() -> train(history, next));
      } catch (RejectedExecutionException e) {
        next.completeExceptionally(e);
      }
      return next;
    }
  }

  private void train(List<FeatureVector> history, CompletableFuture<Void> completion) {
    try {
      detector.retrain(history);
      completion.complete(null);
    } catch (RuntimeException e) {
      LOGGER.warn("Retrain of source {} failed, keeping the previous model", source, e);
      completion.completeExceptionally(e);
    }
  }

  private List<FeatureVector> snapshotHistory() {
    lock.lock();
    try {
      return baselineStore.trainingHistory();
    } finally {
      lock.unlock();
    }
  }

  ForecastReport forecast() {
    lock.lock();
    try {
      return exhaustionPredictor.predict(source, baselineStore);
    } finally {
      lock.unlock();
    }
  }

  DetectorState state() {
    return detector.getState();
  }
}
