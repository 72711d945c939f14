package org.ctanalytics.anomaly.engine.detector.baseline;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Running statistics of one feature: Welford mean and variance plus the last N raw values. */
public class BaselineState {
  private final EvictingQueue<Double> recentValues;
  private long count;
  private double mean;
  private double m2;

  BaselineState(int windowSize) {
    this.recentValues = EvictingQueue.create(windowSize);
  }

  void update(double value) {
    count++;
    double delta = value - mean;
    mean += delta / count;
    m2 += delta * (value - mean);
    recentValues.add(value);
  }

  public long getCount() {
    return count;
  }

  public double getMean() {
    return mean;
  }

  /** Sample variance, 0 until two values are seen. */
  public double getVariance() {
    return count < 2 ? 0.0 : m2 / (count - 1);
  }

  public double getStandardDeviation() {
    return Math.sqrt(getVariance());
  }

  /** Oldest first. */
  public List<Double> getRecentValues() {
    return ImmutableList.copyOf(recentValues);
  }
}
