package org.ctanalytics.anomaly.engine.rca;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import lombok.Getter;
import lombok.experimental.SuperBuilder;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;

/**
 * Everything one analysis reads. The score function is the detector's continuous anomaly score
 * and must be safe to call repeatedly.
 */
@SuperBuilder
@Getter
public class RootCauseRequest {
  private final String anomalyId;
  private final FeatureVector current;
  private final List<FeatureVector> history;
  private final Map<String, Double> baselineMeans;
  private final ToDoubleFunction<FeatureVector> scoreFunction;
  // metric features that may be proposed as causes, in schema order
  private final List<String> candidateFeatures;

  /** History followed by the current vector. */
  public List<FeatureVector> lookback() {
    List<FeatureVector> lookback = new ArrayList<>(history.size() + 1);
    lookback.addAll(history);
    lookback.add(current);
    return lookback;
  }

  /** One series per candidate feature over the lookback window. */
  public Map<String, double[]> candidateSeries() {
    List<FeatureVector> lookback = lookback();
    Map<String, double[]> series = new LinkedHashMap<>();
    for (String feature : candidateFeatures) {
      double[] values = new double[lookback.size()];
      for (int i = 0; i < values.length; i++) {
        values[i] = lookback.get(i).get(feature);
      }
      series.put(feature, values);
    }
    return series;
  }
}
