package org.ctanalytics.anomaly.engine.detector;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.net.MalformedURLException;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.ctanalytics.anomaly.engine.datamodel.FeatureSchema;
import org.ctanalytics.anomaly.engine.datamodel.FeatureVector;

public class DetectorTestData {
  public static final String SOURCE = "checkout-service";
  public static final Instant START = Instant.parse("2024-03-04T10:00:00Z");
  public static final FeatureSchema CPU_LATENCY =
      FeatureSchema.of(List.of("cpu_usage", "response_time_ms"));

  public static Config applicationConfig() {
    try {
      return ConfigFactory.parseURL(
          Thread.currentThread()
              .getContextClassLoader()
              .getResource("application.conf")
              .toURI()
              .toURL());
    } catch (URISyntaxException | MalformedURLException e) {
      throw new IllegalStateException(e);
    }
  }

  public static FeatureVector vector(int minute, double cpu, double latency) {
    Map<String, Double> values = new LinkedHashMap<>();
    values.put("cpu_usage", cpu);
    values.put("response_time_ms", latency);
    return new FeatureVector(SOURCE, START.plusSeconds(60L * minute), values);
  }

  public static List<FeatureVector> steady(int count, double cpu, double latency) {
    List<FeatureVector> vectors = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      vectors.add(vector(i, cpu, latency));
    }
    return vectors;
  }

  /** Small deterministic oscillation around the given levels. */
  public static List<FeatureVector> noisy(int count, double cpu, double latency) {
    List<FeatureVector> vectors = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      double wobble = Math.sin(i * 1.7);
      vectors.add(vector(i, cpu + 2 * wobble, latency + 10 * Math.cos(i * 0.9)));
    }
    return vectors;
  }
}
