package org.ctanalytics.anomaly.engine.datamodel;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** One fixed-shape numeric snapshot of a source at a point in time. Immutable. */
public class FeatureVector {

  private final String source;
  private final Instant timestamp;
  private final ImmutableMap<String, Double> values;

  public FeatureVector(String source, Instant timestamp, Map<String, Double> values) {
    this.source = Preconditions.checkNotNull(source, "source");
    this.timestamp = Preconditions.checkNotNull(timestamp, "timestamp");
    this.values = ImmutableMap.copyOf(values);
  }

  public String getSource() {
    return source;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  /** Values in schema order. */
  public Map<String, Double> getValues() {
    return values;
  }

  public double get(String feature) {
    Double value = values.get(feature);
    Preconditions.checkArgument(value != null, "unknown feature %s", feature);
    return value;
  }

  public boolean has(String feature) {
    return values.containsKey(feature);
  }

  public double[] toArray(List<String> featureOrder) {
    double[] array = new double[featureOrder.size()];
    for (int i = 0; i < array.length; i++) {
      array[i] = get(featureOrder.get(i));
    }
    return array;
  }

  /** Copy of this vector with one feature replaced, keeping key order. */
  public FeatureVector withValue(String feature, double value) {
    Preconditions.checkArgument(values.containsKey(feature), "unknown feature %s", feature);
    ImmutableMap.Builder<String, Double> builder = ImmutableMap.builder();
    values.forEach((name, current) -> builder.put(name, name.equals(feature) ? value : current));
    return new FeatureVector(source, timestamp, builder.build());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FeatureVector)) {
      return false;
    }
    FeatureVector that = (FeatureVector) o;
    return source.equals(that.source)
        && timestamp.equals(that.timestamp)
        && values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, timestamp, values);
  }

  @Override
  public String toString() {
    return "FeatureVector{source=" + source + ", timestamp=" + timestamp + ", values=" + values
        + "}";
  }
}
