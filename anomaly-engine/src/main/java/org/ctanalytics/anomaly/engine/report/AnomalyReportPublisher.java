package org.ctanalytics.anomaly.engine.report;

/** Persistence collaborator. Receives every assembled report exactly once. */
@FunctionalInterface
public interface AnomalyReportPublisher {

  void publish(AnomalyReport report);
}
