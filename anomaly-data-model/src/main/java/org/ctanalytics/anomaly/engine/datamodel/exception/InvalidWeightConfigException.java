package org.ctanalytics.anomaly.engine.datamodel.exception;

/** Ensemble weights or severity cutoffs are inconsistent. Raised at construction time only. */
public class InvalidWeightConfigException extends AnomalyEngineException {

  public InvalidWeightConfigException(String message) {
    super(message);
  }
}
