package org.ctanalytics.anomaly.engine.datamodel;

public enum CausalDirection {
  /** Significant in one direction only; eligible for the causal ranking. */
  UNIDIRECTIONAL,
  /** Significant both ways; recorded as ambiguous and never ranked. */
  BIDIRECTIONAL
}
