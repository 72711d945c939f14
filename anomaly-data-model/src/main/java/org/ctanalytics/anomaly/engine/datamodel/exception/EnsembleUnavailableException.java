package org.ctanalytics.anomaly.engine.datamodel.exception;

/** Every scorer of the ensemble failed for this evaluation. */
public class EnsembleUnavailableException extends AnomalyEngineException {

  public EnsembleUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
