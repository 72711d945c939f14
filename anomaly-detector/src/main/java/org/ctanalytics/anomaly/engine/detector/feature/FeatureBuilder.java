package org.ctanalytics.anomaly.engine.detector.feature;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import org.ctanalytics.anomaly.engine.datamodel.FeatureSchema;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.exception.InsufficientHistoryException;
import org.ctanalytics.anomaly.engine.datamodel.exception.SchemaMismatchException;
import org.ctanalytics.anomaly.engine.detector.baseline.BaselineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Turns raw readings into a schema-ordered {@link FeatureVector}. */
public class FeatureBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(FeatureBuilder.class);

  private static final double HOURS_PER_DAY = 24.0;
  private static final double DAYS_PER_WEEK = 7.0;

  private final BaselineStore baselineStore;
  private final boolean lenient;

  public FeatureBuilder(BaselineStore baselineStore, boolean lenient) {
    this.baselineStore = baselineStore;
    this.lenient = lenient;
  }

  public FeatureVector build(
      String source, Instant timestamp, Map<String, Double> readings, FeatureSchema schema) {
    for (String key : readings.keySet()) {
      if (!schema.isMetric(key)) {
        if (!lenient) {
          throw new SchemaMismatchException(
              String.format("Reading %s from source %s is not in %s", key, source, schema));
        }
        LOGGER.info("Ignoring reading {} from source {}, not part of the schema", key, source);
      }
    }

    Map<String, Double> values = new LinkedHashMap<>();
    for (String metric : schema.getMetricNames()) {
      Double reading = readings.get(metric);
      values.put(metric, reading == null || reading.isNaN() ? impute(source, metric) : reading);
    }
    if (schema.hasCyclicalTimeFeatures()) {
      addCyclicalTimeFeatures(timestamp, values);
    }
    return new FeatureVector(source, timestamp, values);
  }

  private double impute(String source, String metric) {
    if (!baselineStore.contains(metric)) {
      throw new InsufficientHistoryException(
          String.format(
              "Cannot impute missing reading %s for source %s, no baseline yet", metric, source));
    }
    double mean = baselineStore.mean(metric);
    LOGGER.debug("Imputed missing reading {} for source {} with {}", metric, source, mean);
    return mean;
  }

  private static void addCyclicalTimeFeatures(Instant timestamp, Map<String, Double> values) {
    ZonedDateTime utc = timestamp.atZone(ZoneOffset.UTC);
    double hourOfDay = utc.toLocalTime().toSecondOfDay() / 3600.0;
    double hourAngle = 2 * Math.PI * hourOfDay / HOURS_PER_DAY;
    DayOfWeek dayOfWeek = utc.getDayOfWeek();
    double dayAngle = 2 * Math.PI * dayOfWeek.getValue() / DAYS_PER_WEEK;
    values.put(FeatureSchema.HOUR_OF_DAY_SIN, Math.sin(hourAngle));
    values.put(FeatureSchema.HOUR_OF_DAY_COS, Math.cos(hourAngle));
    values.put(FeatureSchema.DAY_OF_WEEK_SIN, Math.sin(dayAngle));
    values.put(FeatureSchema.DAY_OF_WEEK_COS, Math.cos(dayAngle));
  }
}
