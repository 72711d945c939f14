package org.ctanalytics.anomaly.engine.datamodel;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;

/**
 * Ordered set of feature names shared by every {@link FeatureVector} of a deployment. The schema
 * is resolved once at startup; adding a feature means building a new schema.
 */
public class FeatureSchema {

  public static final String HOUR_OF_DAY_SIN = "hour_of_day_sin";
  public static final String HOUR_OF_DAY_COS = "hour_of_day_cos";
  public static final String DAY_OF_WEEK_SIN = "day_of_week_sin";
  public static final String DAY_OF_WEEK_COS = "day_of_week_cos";

  private static final List<String> CYCLICAL_TIME_FEATURES =
      List.of(HOUR_OF_DAY_SIN, HOUR_OF_DAY_COS, DAY_OF_WEEK_SIN, DAY_OF_WEEK_COS);

  private final ImmutableList<String> metricNames;
  private final ImmutableList<String> featureNames;
  private final ImmutableSet<String> metricNameSet;
  private final boolean cyclicalTimeFeatures;

  private FeatureSchema(List<String> metricNames, boolean cyclicalTimeFeatures) {
    Preconditions.checkArgument(!metricNames.isEmpty(), "schema needs at least one metric");
    this.metricNames = ImmutableList.copyOf(metricNames);
    this.metricNameSet = ImmutableSet.copyOf(metricNames);
    Preconditions.checkArgument(
        metricNameSet.size() == metricNames.size(), "duplicate metric names in %s", metricNames);
    for (String derived : CYCLICAL_TIME_FEATURES) {
      Preconditions.checkArgument(
          !metricNameSet.contains(derived), "%s is a reserved feature name", derived);
    }
    this.cyclicalTimeFeatures = cyclicalTimeFeatures;
    ImmutableList.Builder<String> builder = ImmutableList.<String>builder().addAll(metricNames);
    if (cyclicalTimeFeatures) {
      builder.addAll(CYCLICAL_TIME_FEATURES);
    }
    this.featureNames = builder.build();
  }

  public static FeatureSchema of(List<String> metricNames) {
    return new FeatureSchema(metricNames, false);
  }

  public static FeatureSchema withCyclicalTime(List<String> metricNames) {
    return new FeatureSchema(metricNames, true);
  }

  /** Metric names as they appear in raw readings. */
  public List<String> getMetricNames() {
    return metricNames;
  }

  /** All feature names in vector order: metrics first, then derived time features. */
  public List<String> getFeatureNames() {
    return featureNames;
  }

  public boolean isMetric(String name) {
    return metricNameSet.contains(name);
  }

  public boolean hasCyclicalTimeFeatures() {
    return cyclicalTimeFeatures;
  }

  public int size() {
    return featureNames.size();
  }

  @Override
  public String toString() {
    return "FeatureSchema" + featureNames;
  }
}
