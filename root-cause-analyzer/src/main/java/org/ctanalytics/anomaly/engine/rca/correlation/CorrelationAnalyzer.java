package org.ctanalytics.anomaly.engine.rca.correlation;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleSupplier;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.correlation.SpearmansCorrelation;
import org.ctanalytics.anomaly.engine.datamodel.Correlation;
import org.ctanalytics.anomaly.engine.datamodel.CorrelationMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** First RCA stage: pairwise association and pruning of unrelated features. */
public class CorrelationAnalyzer {
  private static final Logger LOGGER = LoggerFactory.getLogger(CorrelationAnalyzer.class);

  private final double pruningThreshold;

  public CorrelationAnalyzer(double pruningThreshold) {
    this.pruningThreshold = pruningThreshold;
  }

  public CorrelationMatrix correlate(Map<String, double[]> series) {
    List<String> features = new ArrayList<>(series.keySet());
    Map<Pair<String, String>, Correlation> entries = new LinkedHashMap<>();
    for (int i = 0; i < features.size(); i++) {
      for (int j = i + 1; j < features.size(); j++) {
        double[] x = series.get(features.get(i));
        double[] y = series.get(features.get(j));
        entries.put(
            Pair.of(features.get(i), features.get(j)),
            Correlation.builder()
                .pearson(definedOrZero(() -> new PearsonsCorrelation().correlation(x, y), x))
                .spearman(definedOrZero(() -> new SpearmansCorrelation().correlation(x, y), x))
                .mutualInformation(MutualInformation.normalized(x, y))
                .build());
      }
    }
    return new CorrelationMatrix(entries);
  }

  private static double definedOrZero(DoubleSupplier coefficient, double[] series) {
    if (series.length < 2) {
      return 0.0;
    }
    double value = coefficient.getAsDouble();
    return Double.isNaN(value) ? 0.0 : value;
  }

  /** Pairs with at least one measure at or above the pruning threshold. */
  public List<Pair<String, String>> survivingPairs(CorrelationMatrix matrix) {
    List<Pair<String, String>> pairs = new ArrayList<>();
    matrix
        .getEntries()
        .forEach(
            (pair, correlation) -> {
              if (!correlation.isNegligible(pruningThreshold)) {
                pairs.add(pair);
              }
            });
    return pairs;
  }

  /**
   * Features that take part in at least one surviving pair, in candidate order. When every pair
   * is pruned nothing can be ruled out and every candidate survives.
   */
  public List<String> prune(CorrelationMatrix matrix, List<String> candidates) {
    Set<String> linked = new LinkedHashSet<>();
    for (Pair<String, String> pair : survivingPairs(matrix)) {
      linked.add(pair.getLeft());
      linked.add(pair.getRight());
    }
    if (linked.isEmpty()) {
      LOGGER.debug("Every feature pair was pruned, keeping all {} candidates", candidates.size());
      return ImmutableList.copyOf(candidates);
    }
    List<String> survivors = new ArrayList<>();
    for (String candidate : candidates) {
      if (linked.contains(candidate)) {
        survivors.add(candidate);
      }
    }
    return ImmutableList.copyOf(survivors);
  }
}
