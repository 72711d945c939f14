package org.ctanalytics.anomaly.engine.detector.comparison;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.ctanalytics.anomaly.engine.datamodel.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares test-environment traffic against production, endpoint by endpoint. Production is the
 * reference: an endpoint missing from the test run is compared against zero traffic.
 */
public class TrafficComparator {
  private static final Logger LOGGER = LoggerFactory.getLogger(TrafficComparator.class);

  private final ComparisonConfig config;

  public TrafficComparator(ComparisonConfig config) {
    this.config = config;
  }

  public List<ComparisonResult> compare(
      List<EndpointTraffic> production, List<EndpointTraffic> test) {
    Map<String, EndpointTraffic> testByEndpoint = new LinkedHashMap<>();
    test.forEach(traffic -> testByEndpoint.put(traffic.getEndpoint(), traffic));

    List<ComparisonResult> results = new ArrayList<>();
    for (EndpointTraffic prod : production) {
      EndpointTraffic candidate = testByEndpoint.remove(prod.getEndpoint());
      if (candidate == null) {
        LOGGER.warn("Endpoint {} has production traffic but none under test", prod.getEndpoint());
        candidate = EndpointTraffic.builder().endpoint(prod.getEndpoint()).build();
      }
      for (ComparisonMetric metric : ComparisonMetric.values()) {
        results.add(compare(prod.getEndpoint(), metric, prod, candidate));
      }
    }
    if (!testByEndpoint.isEmpty()) {
      LOGGER.debug("Skipping test-only endpoints {}", testByEndpoint.keySet());
    }
    return results;
  }

  private ComparisonResult compare(
      String endpoint, ComparisonMetric metric, EndpointTraffic prod, EndpointTraffic test) {
    double prodValue = metric.valueOf(prod);
    double testValue = metric.valueOf(test);
    double differencePct = prodValue == 0 ? 0.0 : (testValue - prodValue) / prodValue * 100.0;
    double threshold = config.variancePct(metric);

    boolean failed;
    if (metric == ComparisonMetric.CALL_COUNT) {
      failed = testValue < config.getMinLoadRatio() * prodValue;
    } else {
      failed = testValue > prodValue * (1 + threshold / 100.0);
    }
    return ComparisonResult.builder()
        .endpoint(endpoint)
        .metric(metric)
        .productionValue(prodValue)
        .testValue(testValue)
        .differencePct(differencePct)
        .severity(severity(Math.abs(differencePct), threshold))
        .status(failed ? ComparisonStatus.FAIL : ComparisonStatus.PASS)
        .build();
  }

  static Severity severity(double absoluteDifferencePct, double threshold) {
    if (absoluteDifferencePct > 1.5 * threshold) {
      return Severity.CRITICAL;
    }
    if (absoluteDifferencePct > threshold) {
      return Severity.HIGH;
    }
    if (absoluteDifferencePct > 0.5 * threshold) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  /** Failed comparisons of high or critical severity. */
  public static List<ComparisonResult> criticalIssues(List<ComparisonResult> results) {
    EnumSet<Severity> critical = EnumSet.of(Severity.HIGH, Severity.CRITICAL);
    return results.stream()
        .filter(result -> result.getStatus() == ComparisonStatus.FAIL)
        .filter(result -> critical.contains(result.getSeverity()))
        .collect(Collectors.toList());
  }
}
