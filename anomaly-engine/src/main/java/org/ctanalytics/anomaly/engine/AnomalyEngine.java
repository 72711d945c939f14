package org.ctanalytics.anomaly.engine;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.ctanalytics.anomaly.engine.detector.DetectorConfig;
import org.ctanalytics.anomaly.engine.detector.DetectorState;
import org.ctanalytics.anomaly.engine.detector.EnsembleDetector;
import org.ctanalytics.anomaly.engine.detector.baseline.BaselineStore;
import org.ctanalytics.anomaly.engine.detector.comparison.ComparisonResult;
import org.ctanalytics.anomaly.engine.detector.comparison.EndpointTraffic;
import org.ctanalytics.anomaly.engine.detector.comparison.TrafficComparator;
import org.ctanalytics.anomaly.engine.detector.feature.FeatureBuilder;
import org.ctanalytics.anomaly.engine.detector.forecast.ForecastReport;
import org.ctanalytics.anomaly.engine.detector.forecast.ResourceExhaustionPredictor;
import org.ctanalytics.anomaly.engine.narrative.NarrativeGenerator;
import org.ctanalytics.anomaly.engine.rca.RootCauseAnalyzer;
import org.ctanalytics.anomaly.engine.report.AnomalyReport;
import org.ctanalytics.anomaly.engine.report.AnomalyReportPublisher;
import org.ctanalytics.anomaly.engine.report.ResultAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the engine. Holds one evaluator per source, created on first use from the
 * shared configuration. Sources are independent and may be driven from different threads.
 */
public class AnomalyEngine implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyEngine.class);

  private final EngineConfig config;
  private final MeterRegistry meterRegistry;
  private final AnomalyReportPublisher publisher;
  private final RootCauseAnalyzer rootCauseAnalyzer;
  private final ResultAssembler resultAssembler = new ResultAssembler();
  private final ResourceExhaustionPredictor exhaustionPredictor;
  private final TrafficComparator trafficComparator;
  private final NarrativeGenerator narrativeGenerator;
  private final ExecutorService retrainExecutor;
  private final ExecutorService narrativeExecutor;
  private final ConcurrentMap<String, SourceEvaluator> evaluators = new ConcurrentHashMap<>();

  public AnomalyEngine(Config appConfig, AnomalyReportPublisher publisher) {
    this(EngineConfig.from(appConfig), publisher, new SimpleMeterRegistry());
  }

  public AnomalyEngine(
      EngineConfig config, AnomalyReportPublisher publisher, MeterRegistry meterRegistry) {
    this(config, config.getNarrativeConfig().createGenerator(), publisher, meterRegistry);
  }

  @VisibleForTesting
  AnomalyEngine(
      EngineConfig config,
      NarrativeGenerator narrativeGenerator,
      AnomalyReportPublisher publisher,
      MeterRegistry meterRegistry) {
    this.config = config;
    this.meterRegistry = meterRegistry;
    this.publisher = publisher;
    this.rootCauseAnalyzer = new RootCauseAnalyzer(config.getRcaConfig());
    this.exhaustionPredictor = new ResourceExhaustionPredictor(config.getForecastConfig());
    this.trafficComparator = new TrafficComparator(config.getComparisonConfig());
    this.retrainExecutor =
        Executors.newFixedThreadPool(
            config.getRetrainThreads(),
            new ThreadFactoryBuilder().setNameFormat("anomaly-retrain-%d").setDaemon(true).build());
    this.narrativeExecutor =
        Executors.newFixedThreadPool(
            config.getNarrativeThreads(),
            new ThreadFactoryBuilder()
                .setNameFormat("anomaly-narrative-%d")
                .setDaemon(true)
                .build());
    this.narrativeGenerator =
        new TimeBoundedNarrativeGenerator(
            narrativeGenerator,
            config.getNarrativeConfig().getTimeout(),
            narrativeExecutor,
            meterRegistry);
    LOGGER.info(
        "Anomaly engine started with features {}, narrative timeout {}",
        config.getSchema().getFeatureNames(),
        config.getNarrativeConfig().getTimeout());
  }

  /** Warm-up readings: update the baseline of the source without scoring. */
  public void ingest(String source, Instant timestamp, Map<String, Double> readings) {
    evaluator(source).ingest(timestamp, readings);
  }

  /**
   * Runs the full pipeline on the readings. Returns the published report when they are anomalous
   * and empty when they are normal. Throws {@code InsufficientHistoryException} until {@link
   * #retrain} has activated a model for the source; that outcome must not be read as normal.
   */
  public Optional<AnomalyReport> evaluate(
      String source, Instant timestamp, Map<String, Double> readings) {
    Optional<AnomalyReport> report = evaluator(source).evaluate(timestamp, readings);
    report.ifPresent(publisher::publish);
    return report;
  }

  public void retrain(String source) {
    evaluator(source).retrain();
  }

  public CompletableFuture<Void> retrainAsync(String source) {
    return evaluator(source).retrainAsync();
  }

  public ForecastReport forecast(String source) {
    return evaluator(source).forecast();
  }

  /** Compares test-run traffic against production, one result per endpoint and metric. */
  public List<ComparisonResult> compareTraffic(
      List<EndpointTraffic> production, List<EndpointTraffic> test) {
    List<ComparisonResult> results = trafficComparator.compare(production, test);
    List<ComparisonResult> critical = TrafficComparator.criticalIssues(results);
    if (!critical.isEmpty()) {
      LOGGER.warn("Traffic comparison found {} critical issues", critical.size());
    }
    return results;
  }

  public DetectorState state(String source) {
    return evaluator(source).state();
  }

  public MeterRegistry getMeterRegistry() {
    return meterRegistry;
  }

  @Override
  public void close() {
    retrainExecutor.shutdownNow();
    narrativeExecutor.shutdownNow();
    LOGGER.info("Anomaly engine stopped after serving {} sources", evaluators.size());
  }

  private SourceEvaluator evaluator(String source) {
    Preconditions.checkArgument(source != null && !source.isBlank(), "source is required");
    return evaluators.computeIfAbsent(source, this::createEvaluator);
  }

  private SourceEvaluator createEvaluator(String source) {
    DetectorConfig detectorConfig = config.getDetectorConfig();
    BaselineStore baselineStore =
        new BaselineStore(
            config.getSchema(),
            detectorConfig.getBaselineWindowSize(),
            config.getTrainingHistorySize());
    LOGGER.info("Creating evaluator for source {}", source);
    return new SourceEvaluator(
        source,
        config.getSchema(),
        baselineStore,
        new FeatureBuilder(baselineStore, detectorConfig.isLenientFeatures()),
        new EnsembleDetector(detectorConfig, baselineStore, meterRegistry),
        rootCauseAnalyzer,
        narrativeGenerator,
        resultAssembler,
        exhaustionPredictor,
        retrainExecutor);
  }
}
