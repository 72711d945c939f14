package org.ctanalytics.anomaly.engine.datamodel.exception;

/** A raw reading does not fit the configured feature schema. */
public class SchemaMismatchException extends AnomalyEngineException {

  public SchemaMismatchException(String message) {
    super(message);
  }
}
