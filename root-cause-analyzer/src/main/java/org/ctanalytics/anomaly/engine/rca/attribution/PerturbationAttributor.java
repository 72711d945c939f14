package org.ctanalytics.anomaly.engine.rca.attribution;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;

/**
 * Third RCA stage. Each surviving feature is credited with how much of the anomaly score it
 * produces alone: the score of a vector holding only that feature at its current value and every
 * other candidate at its baseline mean, minus the score of the all-baseline vector. Derived time
 * features keep their current values throughout.
 */
public class PerturbationAttributor {

  /**
   * Attribution weights summing to 1, ordered by weight descending. Ties keep survivor order. If
   * no feature raises the score on its own, the weight is shared evenly.
   */
  public Map<String, Double> attribute(
      FeatureVector current,
      Map<String, Double> baselineMeans,
      List<String> candidates,
      List<String> survivors,
      ToDoubleFunction<FeatureVector> scoreFunction) {
    Preconditions.checkArgument(!survivors.isEmpty(), "nothing to attribute");
    FeatureVector baseline = current;
    for (String candidate : candidates) {
      Double mean = baselineMeans.get(candidate);
      Preconditions.checkArgument(mean != null, "no baseline mean for %s", candidate);
      baseline = baseline.withValue(candidate, mean);
    }
    double baselineScore = scoreFunction.applyAsDouble(baseline);

    Map<String, Double> deltas = new LinkedHashMap<>();
    double total = 0.0;
    for (String feature : survivors) {
      double score =
          scoreFunction.applyAsDouble(baseline.withValue(feature, current.get(feature)));
      double delta = Math.max(0.0, score - baselineScore);
      deltas.put(feature, delta);
      total += delta;
    }

    List<Map.Entry<String, Double>> weights = new ArrayList<>();
    for (Map.Entry<String, Double> entry : deltas.entrySet()) {
      double weight = total > 0 ? entry.getValue() / total : 1.0 / survivors.size();
      weights.add(Map.entry(entry.getKey(), weight));
    }
    weights.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));
    Map<String, Double> ordered = new LinkedHashMap<>();
    weights.forEach(entry -> ordered.put(entry.getKey(), entry.getValue()));
    return ordered;
  }
}
