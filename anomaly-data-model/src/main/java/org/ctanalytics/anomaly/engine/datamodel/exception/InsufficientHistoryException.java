package org.ctanalytics.anomaly.engine.datamodel.exception;

/**
 * Not enough history to evaluate. The window must be treated as unevaluated, never as normal.
 */
public class InsufficientHistoryException extends AnomalyEngineException {

  public InsufficientHistoryException(String message) {
    super(message);
  }
}
