package org.ctanalytics.anomaly.engine.datamodel;

import java.util.Locale;

/** Identifiers of the ensemble's scorers, in voting order. */
public enum ScorerType {
  ISOLATION,
  RECONSTRUCTION,
  STATISTICAL;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
