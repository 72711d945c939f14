package org.ctanalytics.anomaly.engine.datamodel.exception;

/** Base of every failure the engine surfaces to its caller. */
public class AnomalyEngineException extends RuntimeException {

  public AnomalyEngineException(String message) {
    super(message);
  }

  public AnomalyEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
