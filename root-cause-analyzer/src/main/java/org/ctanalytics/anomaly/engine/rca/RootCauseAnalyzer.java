package org.ctanalytics.anomaly.engine.rca;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.tuple.Pair;
import org.ctanalytics.anomaly.engine.datamodel.CorrelationMatrix;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.RootCauseResult;
import org.ctanalytics.anomaly.engine.rca.assembly.RootCauseAssembler;
import org.ctanalytics.anomaly.engine.rca.attribution.PerturbationAttributor;
import org.ctanalytics.anomaly.engine.rca.causal.CausalAnalysis;
import org.ctanalytics.anomaly.engine.rca.causal.GrangerCausalityTester;
import org.ctanalytics.anomaly.engine.rca.correlation.CorrelationAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explains an anomalous evaluation: correlation pruning, lagged causality, score attribution and
 * assembly of the ranked result. Stateless and read-only over its request.
 */
public class RootCauseAnalyzer {
  private static final Logger LOGGER = LoggerFactory.getLogger(RootCauseAnalyzer.class);

  private final CorrelationAnalyzer correlationAnalyzer;
  private final GrangerCausalityTester causalityTester;
  private final PerturbationAttributor attributor;
  private final RootCauseAssembler assembler;

  public RootCauseAnalyzer(RcaConfig config) {
    this.correlationAnalyzer = new CorrelationAnalyzer(config.getPruningThreshold());
    this.causalityTester =
        new GrangerCausalityTester(config.getMaxLag(), config.getSignificance());
    this.attributor = new PerturbationAttributor();
    this.assembler = new RootCauseAssembler(config.getTopK(), config.getTimelineFactors());
  }

  public RootCauseResult analyze(RootCauseRequest request) {
    Preconditions.checkArgument(
        !request.getCandidateFeatures().isEmpty(), "no candidate features to analyze");
    List<FeatureVector> lookback = request.lookback();
    Map<String, double[]> series = request.candidateSeries();

    CorrelationMatrix matrix = correlationAnalyzer.correlate(series);
    List<Pair<String, String>> pairs = correlationAnalyzer.survivingPairs(matrix);
    List<String> survivors = correlationAnalyzer.prune(matrix, request.getCandidateFeatures());
    if (pairs.isEmpty()) {
      pairs = allPairs(survivors);
    }

    CausalAnalysis causal = causalityTester.analyze(series, pairs);
    Map<String, Double> attribution =
        attributor.attribute(
            request.getCurrent(),
            request.getBaselineMeans(),
            request.getCandidateFeatures(),
            survivors,
            request.getScoreFunction());

    RootCauseResult result =
        assembler.assemble(
            request.getAnomalyId(),
            lookback,
            request.getBaselineMeans(),
            survivors,
            causal,
            attribution);
    LOGGER.info(
        "Root cause of {}: {} (confidence {}, low causal confidence {}), {} of {} features kept",
        request.getAnomalyId(),
        result.getPrimaryCause().getFeature(),
        result.getPrimaryCause().getConfidence(),
        result.isLowCausalConfidence(),
        survivors.size(),
        request.getCandidateFeatures().size());
    return result;
  }

  private static List<Pair<String, String>> allPairs(List<String> features) {
    List<Pair<String, String>> pairs = new ArrayList<>();
    for (int i = 0; i < features.size(); i++) {
      for (int j = i + 1; j < features.size(); j++) {
        pairs.add(Pair.of(features.get(i), features.get(j)));
      }
    }
    return pairs;
  }
}
