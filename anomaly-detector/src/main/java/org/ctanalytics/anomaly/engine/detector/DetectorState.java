package org.ctanalytics.anomaly.engine.detector;

public enum DetectorState {
  UNTRAINED,
  TRAINED,
  SCORING
}
