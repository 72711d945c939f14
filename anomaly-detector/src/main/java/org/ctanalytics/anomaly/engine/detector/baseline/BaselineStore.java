package org.ctanalytics.anomaly.engine.detector.baseline;

import com.google.common.base.Preconditions;
import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.ctanalytics.anomaly.engine.datamodel.FeatureSchema;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;

/**
 * Per-source rolling baseline. Only the owning evaluator writes to it, always in non-decreasing
 * timestamp order.
 */
public class BaselineStore {
  private final FeatureSchema schema;
  private final int windowSize;
  private final Map<String, BaselineState> states = new LinkedHashMap<>();
  private final EvictingQueue<FeatureVector> recentVectors;
  private final EvictingQueue<FeatureVector> trainingVectors;
  private Instant lastObserved;

  public BaselineStore(FeatureSchema schema, int windowSize) {
    this(schema, windowSize, windowSize);
  }

  /**
   * @param trainingCapacity how many vectors to keep for retraining, at least {@code windowSize}
   */
  public BaselineStore(FeatureSchema schema, int windowSize, int trainingCapacity) {
    Preconditions.checkArgument(windowSize > 0, "window size must be positive: %s", windowSize);
    Preconditions.checkArgument(
        trainingCapacity >= windowSize,
        "training capacity %s is smaller than window size %s",
        trainingCapacity,
        windowSize);
    this.schema = schema;
    this.windowSize = windowSize;
    this.recentVectors = EvictingQueue.create(windowSize);
    this.trainingVectors = EvictingQueue.create(trainingCapacity);
  }

  /** Fails if a vector stamped {@code timestamp} would go backwards in time. */
  public void checkOrder(Instant timestamp) {
    Preconditions.checkArgument(
        lastObserved == null || !timestamp.isBefore(lastObserved),
        "out of order observation at %s, last observed %s",
        timestamp,
        lastObserved);
  }

  public void observe(FeatureVector vector) {
    checkOrder(vector.getTimestamp());
    vector
        .getValues()
        .forEach(
            (feature, value) ->
                states.computeIfAbsent(feature, f -> new BaselineState(windowSize)).update(value));
    recentVectors.add(vector);
    trainingVectors.add(vector);
    lastObserved = vector.getTimestamp();
  }

  public boolean contains(String feature) {
    return states.containsKey(feature);
  }

  public long count(String feature) {
    BaselineState state = states.get(feature);
    return state == null ? 0 : state.getCount();
  }

  public double mean(String feature) {
    return state(feature).getMean();
  }

  public double standardDeviation(String feature) {
    return state(feature).getStandardDeviation();
  }

  public BaselineState state(String feature) {
    BaselineState state = states.get(feature);
    Preconditions.checkArgument(state != null, "no baseline for feature %s", feature);
    return state;
  }

  /** Last N vectors, oldest first. */
  public List<FeatureVector> recentHistory() {
    return ImmutableList.copyOf(recentVectors);
  }

  /** Up to the training capacity of most recent vectors, oldest first. */
  public List<FeatureVector> trainingHistory() {
    return ImmutableList.copyOf(trainingVectors);
  }

  public Map<String, Double> baselineMeans() {
    ImmutableMap.Builder<String, Double> builder = ImmutableMap.builder();
    states.forEach((feature, state) -> builder.put(feature, state.getMean()));
    return builder.build();
  }

  public FeatureSchema getSchema() {
    return schema;
  }

  public int size() {
    return recentVectors.size();
  }
}
