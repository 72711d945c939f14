package org.ctanalytics.anomaly.engine.detector.feature;

import static org.ctanalytics.anomaly.engine.detector.DetectorTestData.CPU_LATENCY;
import static org.ctanalytics.anomaly.engine.detector.DetectorTestData.SOURCE;
import static org.ctanalytics.anomaly.engine.detector.DetectorTestData.vector;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.ctanalytics.anomaly.engine.datamodel.FeatureSchema;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;
import org.ctanalytics.anomaly.engine.datamodel.exception.InsufficientHistoryException;
import org.ctanalytics.anomaly.engine.datamodel.exception.SchemaMismatchException;
import org.ctanalytics.anomaly.engine.detector.baseline.BaselineStore;
import org.junit.jupiter.api.Test;

class FeatureBuilderTest {

  private static final Instant NOW = Instant.parse("2024-03-04T18:00:00Z");

  @Test
  void buildsVectorInSchemaOrder() {
    FeatureBuilder builder = new FeatureBuilder(new BaselineStore(CPU_LATENCY, 20), false);
    FeatureVector vector =
        builder.build(
            SOURCE, NOW, Map.of("response_time_ms", 210.0, "cpu_usage", 42.0), CPU_LATENCY);
    assertEquals(
        List.of("cpu_usage", "response_time_ms"), List.copyOf(vector.getValues().keySet()));
    assertEquals(42.0, vector.get("cpu_usage"));
    assertEquals(NOW, vector.getTimestamp());
  }

  @Test
  void strictModeRejectsUnknownReadings() {
    FeatureBuilder builder = new FeatureBuilder(new BaselineStore(CPU_LATENCY, 20), false);
    assertThrows(
        SchemaMismatchException.class,
        () ->
            builder.build(
                SOURCE,
                NOW,
                Map.of("cpu_usage", 42.0, "response_time_ms", 210.0, "gc_pause_ms", 3.0),
                CPU_LATENCY));
  }

  @Test
  void lenientModeIgnoresUnknownReadings() {
    FeatureBuilder builder = new FeatureBuilder(new BaselineStore(CPU_LATENCY, 20), true);
    FeatureVector vector =
        builder.build(
            SOURCE,
            NOW,
            Map.of("cpu_usage", 42.0, "response_time_ms", 210.0, "gc_pause_ms", 3.0),
            CPU_LATENCY);
    assertFalse(vector.has("gc_pause_ms"));
    assertEquals(2, vector.getValues().size());
  }

  @Test
  void missingReadingsAreImputedWithBaselineMean() {
    BaselineStore store = new BaselineStore(CPU_LATENCY, 20);
    store.observe(vector(0, 30, 100));
    store.observe(vector(1, 50, 300));
    FeatureBuilder builder = new FeatureBuilder(store, false);

    Map<String, Double> readings = new HashMap<>();
    readings.put("cpu_usage", null);
    FeatureVector vector = builder.build(SOURCE, NOW, readings, CPU_LATENCY);
    assertEquals(40.0, vector.get("cpu_usage"), 1e-12);
    assertEquals(200.0, vector.get("response_time_ms"), 1e-12);

    FeatureVector nan =
        builder.build(
            SOURCE, NOW, Map.of("cpu_usage", Double.NaN, "response_time_ms", 250.0), CPU_LATENCY);
    assertEquals(40.0, nan.get("cpu_usage"), 1e-12);
  }

  @Test
  void imputationWithoutBaselineFails() {
    FeatureBuilder builder = new FeatureBuilder(new BaselineStore(CPU_LATENCY, 20), false);
    assertThrows(
        InsufficientHistoryException.class,
        () -> builder.build(SOURCE, NOW, Map.of("cpu_usage", 42.0), CPU_LATENCY));
  }

  @Test
  void derivesCyclicalTimeFeatures() {
    FeatureSchema schema = FeatureSchema.withCyclicalTime(List.of("cpu_usage"));
    FeatureBuilder builder = new FeatureBuilder(new BaselineStore(schema, 20), false);
    // Monday 18:00 UTC
    FeatureVector vector = builder.build(SOURCE, NOW, Map.of("cpu_usage", 42.0), schema);

    assertEquals(5, vector.getValues().size());
    assertEquals(-1.0, vector.get(FeatureSchema.HOUR_OF_DAY_SIN), 1e-9);
    assertEquals(0.0, vector.get(FeatureSchema.HOUR_OF_DAY_COS), 1e-9);
    assertEquals(Math.sin(2 * Math.PI / 7), vector.get(FeatureSchema.DAY_OF_WEEK_SIN), 1e-9);
    assertEquals(Math.cos(2 * Math.PI / 7), vector.get(FeatureSchema.DAY_OF_WEEK_COS), 1e-9);
  }
}
