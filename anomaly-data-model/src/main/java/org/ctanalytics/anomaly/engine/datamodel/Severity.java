package org.ctanalytics.anomaly.engine.datamodel;

import java.util.Locale;

public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /** Wire name used at the persistence boundary. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
